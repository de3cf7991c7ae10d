package com.portico.backend.modules.auth.application;

import java.nio.charset.StandardCharsets;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * BCrypt hashing behind the {@link PasswordEncoder} bean. Each hash carries its own salt and cost.
 *
 * <p>BCrypt only reads the first {@value #MAX_PASSWORD_BYTES} bytes of its input, so longer
 * passwords are refused instead of being silently truncated.
 */
@Component
public class PasswordHasher {

    public static final int MAX_PASSWORD_BYTES = 72;

    private static final Logger log = LoggerFactory.getLogger(PasswordHasher.class);

    private final PasswordEncoder passwordEncoder;

    public PasswordHasher(PasswordEncoder passwordEncoder) {
        this.passwordEncoder = passwordEncoder;
    }

    public String hash(String rawPassword) {
        if (rawPassword == null) {
            throw new IllegalArgumentException("Password must not be null");
        }
        if (exceedsMaxLength(rawPassword)) {
            throw new IllegalArgumentException("Password must be at most " + MAX_PASSWORD_BYTES + " bytes");
        }
        return passwordEncoder.encode(rawPassword);
    }

    /**
     * False for a wrong password, for a password too long to have been hashed, and for absent
     * or malformed hashes.
     */
    public boolean matches(String rawPassword, String passwordHash) {
        if (rawPassword == null || !StringUtils.hasText(passwordHash) || exceedsMaxLength(rawPassword)) {
            return false;
        }
        try {
            return passwordEncoder.matches(rawPassword, passwordHash);
        } catch (IllegalArgumentException ex) {
            log.debug("Stored password hash rejected by encoder: {}", ex.getMessage());
            return false;
        }
    }

    public static boolean exceedsMaxLength(String rawPassword) {
        return rawPassword.getBytes(StandardCharsets.UTF_8).length > MAX_PASSWORD_BYTES;
    }
}
