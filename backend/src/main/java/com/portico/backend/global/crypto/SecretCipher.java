package com.portico.backend.global.crypto;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Base64;

import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * AES-256-GCM encryption of secrets at rest (OAuth client credentials and provider tokens).
 *
 * <p>Output layout is {@code base64(nonce || ciphertext || tag)} with a fresh 96-bit nonce
 * per call. The 256-bit key is the SHA-256 digest of the configured secret, so any secret
 * length maps to exactly one valid key.
 */
@Component
public class SecretCipher {

    private static final String ALGORITHM = "AES";
    private static final String TRANSFORMATION = "AES/GCM/NoPadding";
    private static final int NONCE_LENGTH = 12;
    private static final int TAG_LENGTH_BITS = 128;
    private static final int TAG_LENGTH = TAG_LENGTH_BITS / 8;

    private final SecretKey key;
    private final SecureRandom secureRandom = new SecureRandom();

    @Autowired
    public SecretCipher(@Value("${app.auth.secret}") String secret) {
        this(requireSecret(secret).getBytes(StandardCharsets.UTF_8));
    }

    public SecretCipher(byte[] keyMaterial) {
        if (keyMaterial == null || keyMaterial.length == 0) {
            throw new IllegalArgumentException("Encryption key material must not be empty");
        }
        this.key = new SecretKeySpec(TokenDigest.sha256(keyMaterial), ALGORITHM);
    }

    private static String requireSecret(String secret) {
        if (secret == null || secret.isBlank()) {
            throw new IllegalArgumentException("app.auth.secret must be configured");
        }
        return secret;
    }

    public String encrypt(String plaintext) {
        byte[] input = plaintext == null ? new byte[0] : plaintext.getBytes(StandardCharsets.UTF_8);
        byte[] nonce = new byte[NONCE_LENGTH];
        secureRandom.nextBytes(nonce);
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(TAG_LENGTH_BITS, nonce));
            byte[] sealed = cipher.doFinal(input);

            byte[] combined = new byte[NONCE_LENGTH + sealed.length];
            System.arraycopy(nonce, 0, combined, 0, NONCE_LENGTH);
            System.arraycopy(sealed, 0, combined, NONCE_LENGTH, sealed.length);
            return Base64.getEncoder().encodeToString(combined);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("AES-GCM encryption failed", e);
        }
    }

    /**
     * @throws InvalidCiphertextException when the input is not valid Base64, is too short,
     *                                    or fails authentication (wrong key or tampering)
     */
    public String decrypt(String ciphertext) {
        if (ciphertext == null || ciphertext.isEmpty()) {
            return "";
        }
        byte[] combined;
        try {
            combined = Base64.getDecoder().decode(ciphertext);
        } catch (IllegalArgumentException e) {
            throw new InvalidCiphertextException("Ciphertext is not valid Base64", e);
        }
        if (combined.length < NONCE_LENGTH + TAG_LENGTH) {
            throw new InvalidCiphertextException("Ciphertext too short");
        }
        byte[] nonce = Arrays.copyOfRange(combined, 0, NONCE_LENGTH);
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(TAG_LENGTH_BITS, nonce));
            byte[] plain = cipher.doFinal(combined, NONCE_LENGTH, combined.length - NONCE_LENGTH);
            return new String(plain, StandardCharsets.UTF_8);
        } catch (AEADBadTagException e) {
            throw new InvalidCiphertextException("Ciphertext failed authentication", e);
        } catch (GeneralSecurityException e) {
            throw new InvalidCiphertextException("Ciphertext could not be decrypted", e);
        }
    }
}
