package com.portico.backend.modules.auth.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

import com.portico.backend.global.crypto.SecureTokenGenerator;
import com.portico.backend.global.crypto.TokenDigest;
import com.portico.backend.global.error.AuthException;
import com.portico.backend.global.error.ProblemCode;
import com.portico.backend.modules.auth.domain.PasswordResetToken;
import com.portico.backend.modules.auth.domain.UserAccount;
import com.portico.backend.modules.auth.infrastructure.persistence.PasswordResetTokenRepository;
import com.portico.backend.modules.auth.infrastructure.persistence.UserAccountRepository;
import com.portico.backend.support.MutableClock;
import com.portico.backend.support.TestAccounts;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

@ExtendWith(MockitoExtension.class)
class AccountTokenServiceTest {

    @Mock
    private UserAccountRepository userAccountRepository;

    @Mock
    private PasswordResetTokenRepository passwordResetTokenRepository;

    private MutableClock clock;
    private AccountTokenService accountTokenService;
    private UserAccount user;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2025-01-01T00:00:00Z");
        accountTokenService = new AccountTokenService(userAccountRepository, passwordResetTokenRepository,
                new SecureTokenGenerator(), Duration.ofHours(24), Duration.ofHours(1), clock);
        user = TestAccounts.activeUser("ada@example.com");
    }

    @Test
    void newVerificationTokenSupersedesPrevious() {
        String first = accountTokenService.issueVerificationToken(user);
        String second = accountTokenService.issueVerificationToken(user);

        assertThat(second).isNotEqualTo(first);
        assertThat(user.getVerificationToken()).isEqualTo(second);
        assertThat(user.getVerificationTokenExpiresAt()).isEqualTo(clock.now().plusHours(24));
    }

    @Test
    void reissueWritesOnlyTheTokenColumns() {
        when(userAccountRepository.rotateVerificationToken(eq(user.getId()), anyString(),
                eq(clock.now().plusHours(24)), eq(clock.now()))).thenReturn(1);

        Optional<String> token = accountTokenService.reissueVerificationToken(user);

        assertThat(token).isPresent();
        assertThat(user.getVerificationToken()).isEqualTo(token.get());
        verify(userAccountRepository, never()).save(any());
    }

    @Test
    void reissueAfterConcurrentVerificationYieldsNothing() {
        when(userAccountRepository.rotateVerificationToken(eq(user.getId()), anyString(), any(), any())).thenReturn(0);

        assertThat(accountTokenService.reissueVerificationToken(user)).isEmpty();
        assertThat(user.getVerificationToken()).isNull();
    }

    @Test
    void verifyEmailClaimsTokenOnce() {
        String token = accountTokenService.issueVerificationToken(user);
        when(userAccountRepository.findByVerificationToken(token)).thenReturn(Optional.of(user));
        when(userAccountRepository.markEmailVerified(user.getId(), token, clock.now())).thenReturn(1);

        accountTokenService.verifyEmail(token);

        verify(userAccountRepository).markEmailVerified(user.getId(), token, clock.now());
    }

    @Test
    void expiredVerificationTokenIsRejected() {
        String token = accountTokenService.issueVerificationToken(user);
        when(userAccountRepository.findByVerificationToken(token)).thenReturn(Optional.of(user));
        clock.advance(Duration.ofHours(24));

        AuthException exception = assertThrows(AuthException.class, () -> accountTokenService.verifyEmail(token));

        assertThat(exception.getProblemCode()).isEqualTo(ProblemCode.TOKEN_EXPIRED);
        verify(userAccountRepository, never()).markEmailVerified(any(), any(), any());
    }

    @Test
    void unknownVerificationTokenIsInvalid() {
        when(userAccountRepository.findByVerificationToken("nope")).thenReturn(Optional.empty());

        AuthException exception = assertThrows(AuthException.class, () -> accountTokenService.verifyEmail("nope"));

        assertThat(exception.getProblemCode()).isEqualTo(ProblemCode.INVALID_TOKEN);
    }

    @Test
    void lostVerificationRaceIsInvalidUnlessAccountEndedVerified() {
        String token = accountTokenService.issueVerificationToken(user);
        when(userAccountRepository.findByVerificationToken(token)).thenReturn(Optional.of(user));
        when(userAccountRepository.markEmailVerified(user.getId(), token, clock.now())).thenReturn(0);
        when(userAccountRepository.findById(user.getId())).thenReturn(Optional.of(user));

        AuthException exception = assertThrows(AuthException.class, () -> accountTokenService.verifyEmail(token));

        assertThat(exception.getProblemCode()).isEqualTo(ProblemCode.INVALID_TOKEN);
    }

    @Test
    void passwordResetStoresOnlyDigest() {
        IssuedResetToken issued = accountTokenService.issuePasswordReset(user);

        ArgumentCaptor<PasswordResetToken> captor = ArgumentCaptor.forClass(PasswordResetToken.class);
        verify(passwordResetTokenRepository).save(captor.capture());
        assertThat(captor.getValue().getTokenHash())
                .isEqualTo(TokenDigest.sha256Hex(issued.token()))
                .isNotEqualTo(issued.token());
        assertThat(issued.expiresAt()).isEqualTo(clock.now().plusHours(1));
        assertThat(issued.toString()).doesNotContain(issued.token());
    }

    @Test
    void resetTokenRedeemsExactlyOnce() {
        PasswordResetToken stored = storedResetToken("reset-token");
        when(passwordResetTokenRepository.findByTokenHash(TokenDigest.sha256Hex("reset-token")))
                .thenReturn(Optional.of(stored));
        when(passwordResetTokenRepository.deleteClaimed(stored.getId())).thenReturn(1, 0);

        assertThat(accountTokenService.redeemPasswordReset("reset-token")).isEqualTo(user.getId());
        AuthException second = assertThrows(AuthException.class,
                () -> accountTokenService.redeemPasswordReset("reset-token"));

        assertThat(second.getProblemCode()).isEqualTo(ProblemCode.INVALID_OR_EXPIRED_TOKEN);
    }

    @Test
    void expiredResetTokenIsDiscarded() {
        PasswordResetToken stored = storedResetToken("reset-token");
        when(passwordResetTokenRepository.findByTokenHash(TokenDigest.sha256Hex("reset-token")))
                .thenReturn(Optional.of(stored));
        clock.advance(Duration.ofHours(1));

        AuthException exception = assertThrows(AuthException.class,
                () -> accountTokenService.redeemPasswordReset("reset-token"));

        assertThat(exception.getProblemCode()).isEqualTo(ProblemCode.INVALID_OR_EXPIRED_TOKEN);
        verify(passwordResetTokenRepository).deleteClaimed(eq(stored.getId()));
    }

    @Test
    void blankResetTokenIsRejectedWithoutLookup() {
        assertThrows(AuthException.class, () -> accountTokenService.redeemPasswordReset(" "));

        verify(passwordResetTokenRepository, never()).findByTokenHash(any());
    }

    private PasswordResetToken storedResetToken(String rawToken) {
        PasswordResetToken token = new PasswordResetToken(
                user.getId(), TokenDigest.sha256Hex(rawToken), clock.now().plusHours(1));
        ReflectionTestUtils.setField(token, "id", UUID.randomUUID());
        return token;
    }
}
