package com.portico.backend.modules.auth.infrastructure.mail;

import java.time.Duration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Development sender: records that a message would have gone out. Links are not logged.
 */
@Component
public class LoggingEmailSender implements EmailSender {

    private static final Logger log = LoggerFactory.getLogger(LoggingEmailSender.class);

    @Override
    public void sendVerification(String email, String name, String verificationLink, Duration timeout) {
        log.info("Verification email queued for {} ({})", email, name);
    }

    @Override
    public void sendPasswordReset(String email, String name, String resetLink, Duration timeout) {
        log.info("Password reset email queued for {} ({})", email, name);
    }

    @Override
    public void sendEmailLoginLink(String email, String loginLink, Duration timeout) {
        log.info("Sign-in link email queued for {}", email);
    }
}
