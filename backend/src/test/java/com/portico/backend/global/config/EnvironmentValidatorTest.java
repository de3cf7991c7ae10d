package com.portico.backend.global.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;
import org.springframework.mock.env.MockEnvironment;

class EnvironmentValidatorTest {

    @Test
    void acceptsCompleteConfiguration() {
        EnvironmentValidator validator = new EnvironmentValidator(validEnvironment());

        assertThat(validator.collectProblems()).isEmpty();
    }

    @Test
    void reportsMissingSecretAndUrl() {
        MockEnvironment environment = validEnvironment()
                .withProperty("app.auth.secret", "")
                .withProperty("app.url", " ");

        assertThat(new EnvironmentValidator(environment).collectProblems())
                .contains("app.auth.secret is required", "app.url is required");
    }

    @Test
    void rejectsShortSecretAndRelativeUrl() {
        MockEnvironment environment = validEnvironment()
                .withProperty("app.auth.secret", "too-short")
                .withProperty("app.url", "portico.example.com");

        assertThat(new EnvironmentValidator(environment).collectProblems())
                .containsExactlyInAnyOrder(
                        "app.auth.secret must be at least 32 characters",
                        "app.url must be an absolute http(s) URL");
    }

    @Test
    void failsStartupOnProblems() {
        EnvironmentValidator validator = new EnvironmentValidator(
                validEnvironment().withProperty("app.auth.secret", "short"));

        assertThatThrownBy(validator::validateEnvironment)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("app.auth.secret");
    }

    private static MockEnvironment validEnvironment() {
        return new MockEnvironment()
                .withProperty("spring.datasource.url", "jdbc:postgresql://localhost:5432/portico")
                .withProperty("app.url", "https://portico.example.com")
                .withProperty("app.auth.secret", "0123456789abcdef0123456789abcdef")
                .withProperty("app.cors.allowed-origins", "https://portico.example.com");
    }
}
