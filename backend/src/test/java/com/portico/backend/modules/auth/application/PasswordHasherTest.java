package com.portico.backend.modules.auth.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;

class PasswordHasherTest {

    private final PasswordHasher passwordHasher = new PasswordHasher(new BCryptPasswordEncoder(4));

    @Test
    void hashesAreSaltedAndVerifiable() {
        String first = passwordHasher.hash("correct horse");
        String second = passwordHasher.hash("correct horse");

        assertThat(first).isNotEqualTo(second).startsWith("$2a$04$");
        assertThat(passwordHasher.matches("correct horse", first)).isTrue();
        assertThat(passwordHasher.matches("correct horse", second)).isTrue();
        assertThat(passwordHasher.matches("wrong horse", first)).isFalse();
    }

    @Test
    void accountsWithoutPasswordNeverMatch() {
        assertThat(passwordHasher.matches("anything", "")).isFalse();
        assertThat(passwordHasher.matches("anything", null)).isFalse();
        assertThat(passwordHasher.matches(null, passwordHasher.hash("x"))).isFalse();
    }

    @Test
    void malformedHashDoesNotMatch() {
        assertThat(passwordHasher.matches("anything", "not-a-bcrypt-hash")).isFalse();
    }

    @Test
    void inputBeyondBcryptLimitNeverMatches() {
        String sharedPrefix = "a".repeat(72);
        String stored = passwordHasher.hash(sharedPrefix);

        assertThat(passwordHasher.matches(sharedPrefix + "totally-different", stored)).isFalse();
        assertThat(passwordHasher.matches(sharedPrefix, stored)).isTrue();
    }

    @Test
    void hashingRefusesInputBeyondBcryptLimit() {
        assertThrows(IllegalArgumentException.class, () -> passwordHasher.hash("a".repeat(73)));
        assertThrows(IllegalArgumentException.class, () -> passwordHasher.hash("\u00e9".repeat(37)));
    }
}
