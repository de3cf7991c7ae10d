package com.portico.backend.modules.auth.application;

import java.time.OffsetDateTime;

/**
 * Plaintext reset token as handed to the mailer. It exists only in memory.
 */
public record IssuedResetToken(String token, OffsetDateTime expiresAt) {

    @Override
    public String toString() {
        return "IssuedResetToken[token=***, expiresAt=" + expiresAt + "]";
    }
}
