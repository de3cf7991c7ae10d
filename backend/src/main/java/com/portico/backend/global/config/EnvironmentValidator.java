package com.portico.backend.global.config;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * Fails startup when mandatory settings are missing or unsafe.
 */
@Component
public class EnvironmentValidator {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentValidator.class);

    static final int MIN_SECRET_LENGTH = 32;

    private static final String[] REQUIRED_PROPERTIES = {
            "spring.datasource.url",
            "app.url",
            "app.auth.secret",
            "app.cors.allowed-origins"
    };

    private final Environment environment;

    public EnvironmentValidator(Environment environment) {
        this.environment = environment;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void validateEnvironment() {
        List<String> problems = collectProblems();
        if (!problems.isEmpty()) {
            problems.forEach(problem -> log.error("Invalid configuration: {}", problem));
            throw new IllegalStateException("Invalid configuration: " + String.join("; ", problems));
        }
        log.info("Configuration validated");
    }

    List<String> collectProblems() {
        List<String> problems = new ArrayList<>();
        for (String property : REQUIRED_PROPERTIES) {
            Optional<String> value = Optional.ofNullable(environment.getProperty(property));
            if (value.map(String::trim).orElse("").isEmpty()) {
                problems.add(property + " is required");
            }
        }

        Optional.ofNullable(environment.getProperty("app.auth.secret"))
                .map(String::trim)
                .filter(secret -> !secret.isEmpty() && secret.length() < MIN_SECRET_LENGTH)
                .ifPresent(secret -> problems.add("app.auth.secret must be at least " + MIN_SECRET_LENGTH + " characters"));

        Optional.ofNullable(environment.getProperty("app.url"))
                .map(String::trim)
                .filter(url -> !url.isEmpty() && !(url.startsWith("http://") || url.startsWith("https://")))
                .ifPresent(url -> problems.add("app.url must be an absolute http(s) URL"));
        return problems;
    }
}
