package com.portico.backend.global.crypto;

import java.security.SecureRandom;
import java.util.HexFormat;

import org.springframework.stereotype.Component;

/**
 * Opaque random identifiers for session ids, verification tokens and reset tokens.
 */
@Component
public class SecureTokenGenerator {

    static final int TOKEN_BYTES = 32;

    private final SecureRandom secureRandom;
    private final HexFormat hexFormat = HexFormat.of();

    public SecureTokenGenerator() {
        this(new SecureRandom());
    }

    SecureTokenGenerator(SecureRandom secureRandom) {
        this.secureRandom = secureRandom;
    }

    /**
     * 256 bits of fresh randomness as 64 lower-case hex characters.
     */
    public String generate() {
        byte[] bytes = new byte[TOKEN_BYTES];
        secureRandom.nextBytes(bytes);
        return hexFormat.formatHex(bytes);
    }
}
