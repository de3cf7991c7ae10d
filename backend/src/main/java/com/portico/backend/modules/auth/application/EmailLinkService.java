package com.portico.backend.modules.auth.application;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;

import com.portico.backend.global.error.AuthException;
import com.portico.backend.global.error.ProblemCode;
import com.portico.backend.modules.auth.infrastructure.jwt.EmailLinkKeyProvider;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.Jwts.SIG;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Signed, short-lived sign-in links. The token names the email it was sent to and is only
 * accepted for the {@code email_auth} purpose.
 */
@Service
public class EmailLinkService {

    static final String PURPOSE_CLAIM = "purpose";
    static final String PURPOSE_EMAIL_AUTH = "email_auth";

    private final EmailLinkKeyProvider keyProvider;
    private final Duration linkTtl;
    private final String issuer;
    private final Clock clock;

    public EmailLinkService(
            EmailLinkKeyProvider keyProvider,
            @Value("${app.auth.email-link-ttl:PT15M}") Duration linkTtl,
            @Value("${app.url}") String issuer,
            Clock clock
    ) {
        this.keyProvider = keyProvider;
        this.linkTtl = linkTtl;
        this.issuer = issuer;
        this.clock = clock;
    }

    public String issue(String email) {
        Instant now = clock.instant();
        return Jwts.builder()
                .subject(email)
                .issuer(issuer)
                .issuedAt(Date.from(now))
                .expiration(Date.from(now.plus(linkTtl)))
                .claim(PURPOSE_CLAIM, PURPOSE_EMAIL_AUTH)
                .signWith(keyProvider.getSecretKey(), SIG.HS256)
                .compact();
    }

    /**
     * Returns the email the link was issued for.
     */
    public String verify(String token) {
        if (!StringUtils.hasText(token)) {
            throw new AuthException(ProblemCode.INVALID_TOKEN);
        }
        try {
            Claims claims = Jwts.parser()
                    .verifyWith(keyProvider.getSecretKey())
                    .requireIssuer(issuer)
                    .clock(() -> Date.from(clock.instant()))
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();
            if (!PURPOSE_EMAIL_AUTH.equals(claims.get(PURPOSE_CLAIM, String.class))
                    || !StringUtils.hasText(claims.getSubject())) {
                throw new AuthException(ProblemCode.INVALID_TOKEN);
            }
            return claims.getSubject();
        } catch (JwtException | IllegalArgumentException ex) {
            throw new AuthException(ProblemCode.INVALID_TOKEN);
        }
    }
}
