package com.portico.backend.modules.auth.application;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Single-use email verification and password reset tokens.
 *
 * <p>Redemption always claims the token with a conditional write first, so of two
 * concurrent redemptions exactly one observes the claim.
 */
@Service
public class AccountTokenService {

    private static final Logger log = LoggerFactory.getLogger(AccountTokenService.class);

    private final UserAccountRepository userAccountRepository;
    private final PasswordResetTokenRepository passwordResetTokenRepository;
    private final SecureTokenGenerator tokenGenerator;
    private final Duration verificationTtl;
    private final Duration resetTtl;
    private final Clock clock;

    public AccountTokenService(
            UserAccountRepository userAccountRepository,
            PasswordResetTokenRepository passwordResetTokenRepository,
            SecureTokenGenerator tokenGenerator,
            @Value("${app.auth.verification-ttl:PT24H}") Duration verificationTtl,
            @Value("${app.auth.reset-ttl:PT1H}") Duration resetTtl,
            Clock clock
    ) {
        this.userAccountRepository = userAccountRepository;
        this.passwordResetTokenRepository = passwordResetTokenRepository;
        this.tokenGenerator = tokenGenerator;
        this.verificationTtl = verificationTtl;
        this.resetTtl = resetTtl;
        this.clock = clock;
    }

    /**
     * Puts a fresh token on the account, superseding any previous one. The caller persists the account.
     */
    public String issueVerificationToken(UserAccount user) {
        String token = tokenGenerator.generate();
        user.assignVerificationToken(token, OffsetDateTime.now(clock).plus(verificationTtl));
        return token;
    }

    /**
     * Writes a fresh token for an account already stored unverified. Empty when the account was
     * verified in the meantime, in which case nothing is written.
     */
    public Optional<String> reissueVerificationToken(UserAccount user) {
        String token = tokenGenerator.generate();
        OffsetDateTime now = OffsetDateTime.now(clock);
        int updated = userAccountRepository.rotateVerificationToken(
                user.getId(), token, now.plus(verificationTtl), now);
        if (updated == 0) {
            return Optional.empty();
        }
        user.assignVerificationToken(token, now.plus(verificationTtl));
        return Optional.of(token);
    }

    public void verifyEmail(String token) {
        if (!StringUtils.hasText(token)) {
            throw new AuthException(ProblemCode.INVALID_TOKEN);
        }
        UserAccount user = userAccountRepository.findByVerificationToken(token)
                .orElseThrow(() -> new AuthException(ProblemCode.INVALID_TOKEN));
        if (user.isEmailVerified()) {
            return;
        }
        OffsetDateTime now = OffsetDateTime.now(clock);
        OffsetDateTime expiresAt = user.getVerificationTokenExpiresAt();
        if (expiresAt == null || !now.isBefore(expiresAt)) {
            throw new AuthException(ProblemCode.TOKEN_EXPIRED);
        }

        int updated = userAccountRepository.markEmailVerified(user.getId(), token, now);
        if (updated == 0) {
            boolean verifiedElsewhere = userAccountRepository.findById(user.getId())
                    .map(UserAccount::isEmailVerified)
                    .orElse(false);
            if (!verifiedElsewhere) {
                throw new AuthException(ProblemCode.INVALID_TOKEN);
            }
            return;
        }
        log.info("Email verified userId={}", user.getId());
    }

    public IssuedResetToken issuePasswordReset(UserAccount user) {
        String token = tokenGenerator.generate();
        OffsetDateTime expiresAt = OffsetDateTime.now(clock).plus(resetTtl);
        passwordResetTokenRepository.save(
                new PasswordResetToken(user.getId(), TokenDigest.sha256Hex(token), expiresAt));
        log.info("Password reset issued userId={} expiresAt={}", user.getId(), expiresAt);
        return new IssuedResetToken(token, expiresAt);
    }

    /**
     * Claims a reset token and returns its owner. Unknown, expired and already used tokens
     * are indistinguishable to the caller.
     */
    public UUID redeemPasswordReset(String token) {
        if (!StringUtils.hasText(token)) {
            throw new AuthException(ProblemCode.INVALID_OR_EXPIRED_TOKEN);
        }
        PasswordResetToken resetToken = passwordResetTokenRepository.findByTokenHash(TokenDigest.sha256Hex(token))
                .orElseThrow(() -> new AuthException(ProblemCode.INVALID_OR_EXPIRED_TOKEN));

        if (resetToken.isExpired(OffsetDateTime.now(clock))) {
            passwordResetTokenRepository.deleteClaimed(resetToken.getId());
            throw new AuthException(ProblemCode.INVALID_OR_EXPIRED_TOKEN);
        }
        if (passwordResetTokenRepository.deleteClaimed(resetToken.getId()) == 0) {
            log.warn("Password reset token already claimed userId={}", resetToken.getUserId());
            throw new AuthException(ProblemCode.INVALID_OR_EXPIRED_TOKEN);
        }
        return resetToken.getUserId();
    }

    public int purgeExpiredResetTokens() {
        return passwordResetTokenRepository.deleteExpired(OffsetDateTime.now(clock));
    }
}
