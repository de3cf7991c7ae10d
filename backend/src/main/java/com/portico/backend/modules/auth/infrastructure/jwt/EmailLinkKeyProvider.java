package com.portico.backend.modules.auth.infrastructure.jwt;

import java.nio.charset.StandardCharsets;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;

import com.portico.backend.global.crypto.TokenDigest;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * HMAC key for signed sign-in links, derived from the application secret under its own label
 * so it never equals the cipher key.
 */
@Component
public class EmailLinkKeyProvider {

    private static final String HMAC_SHA_256 = "HmacSHA256";
    private static final String KEY_LABEL = "portico/email-link/v1:";

    private final SecretKey secretKey;

    public EmailLinkKeyProvider(@Value("${app.auth.secret}") String secret) {
        if (secret == null || secret.isBlank()) {
            throw new IllegalArgumentException("app.auth.secret must not be blank");
        }
        byte[] keyBytes = TokenDigest.sha256((KEY_LABEL + secret).getBytes(StandardCharsets.UTF_8));
        this.secretKey = new SecretKeySpec(keyBytes, HMAC_SHA_256);
    }

    public SecretKey getSecretKey() {
        return secretKey;
    }
}
