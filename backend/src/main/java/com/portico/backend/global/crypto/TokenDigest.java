package com.portico.backend.global.crypto;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * SHA-256 digests for high-entropy tokens that are looked up by hash.
 */
public final class TokenDigest {

    private static final HexFormat HEX = HexFormat.of();

    private TokenDigest() {
    }

    public static String sha256Hex(String token) {
        if (token == null || token.isEmpty()) {
            throw new IllegalArgumentException("Token must not be empty");
        }
        return HEX.formatHex(sha256(token.getBytes(StandardCharsets.UTF_8)));
    }

    public static byte[] sha256(byte[] input) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(input);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public static boolean matches(String token, String expectedHash) {
        if (token == null || token.isEmpty() || expectedHash == null) {
            return false;
        }
        return MessageDigest.isEqual(
                sha256Hex(token).getBytes(StandardCharsets.UTF_8),
                expectedHash.getBytes(StandardCharsets.UTF_8)
        );
    }
}
