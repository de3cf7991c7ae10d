package com.portico.backend.modules.auth.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Duration;
import java.time.Instant;
import java.util.Date;

import com.portico.backend.global.error.AuthException;
import com.portico.backend.global.error.ProblemCode;
import com.portico.backend.modules.auth.infrastructure.jwt.EmailLinkKeyProvider;
import com.portico.backend.support.MutableClock;

import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.Jwts.SIG;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class EmailLinkServiceTest {

    private static final String SECRET = "0123456789abcdef0123456789abcdef";
    private static final String ISSUER = "https://portico.example.com";

    private MutableClock clock;
    private EmailLinkKeyProvider keyProvider;
    private EmailLinkService emailLinkService;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2025-01-01T00:00:00Z");
        keyProvider = new EmailLinkKeyProvider(SECRET);
        emailLinkService = new EmailLinkService(keyProvider, Duration.ofMinutes(15), ISSUER, clock);
    }

    @Test
    void linkResolvesToItsEmailWithinLifetime() {
        String token = emailLinkService.issue("ada@example.com");
        clock.advance(Duration.ofMinutes(14));

        assertThat(emailLinkService.verify(token)).isEqualTo("ada@example.com");
    }

    @Test
    void expiredLinkIsRejected() {
        String token = emailLinkService.issue("ada@example.com");
        clock.advance(Duration.ofMinutes(16));

        assertInvalid(token);
    }

    @Test
    void linkSignedWithAnotherSecretIsRejected() {
        EmailLinkService other = new EmailLinkService(
                new EmailLinkKeyProvider("fedcba9876543210fedcba9876543210"), Duration.ofMinutes(15), ISSUER, clock);

        assertInvalid(other.issue("ada@example.com"));
    }

    @Test
    void tokenWithOtherPurposeIsRejected() {
        Instant now = clock.instant();
        String token = Jwts.builder()
                .subject("ada@example.com")
                .issuer(ISSUER)
                .issuedAt(Date.from(now))
                .expiration(Date.from(now.plus(Duration.ofMinutes(15))))
                .claim(EmailLinkService.PURPOSE_CLAIM, "password_reset")
                .signWith(keyProvider.getSecretKey(), SIG.HS256)
                .compact();

        assertInvalid(token);
    }

    @Test
    void tamperedOrMissingTokenIsRejected() {
        String token = emailLinkService.issue("ada@example.com");
        String other = emailLinkService.issue("eve@example.com");
        String tampered = other.substring(0, other.lastIndexOf('.')) + token.substring(token.lastIndexOf('.'));

        assertInvalid(tampered);
        assertInvalid("not-a-token");
        assertInvalid("");
    }

    private void assertInvalid(String token) {
        AuthException exception = assertThrows(AuthException.class, () -> emailLinkService.verify(token));
        assertThat(exception.getProblemCode()).isEqualTo(ProblemCode.INVALID_TOKEN);
    }
}
