package com.portico.backend.modules.auth.infrastructure.mail;

import java.time.Duration;

/**
 * Outbound mail port. Implementations must give up once {@code timeout} has elapsed
 * and report failures with {@link EmailDeliveryException}.
 */
public interface EmailSender {

    void sendVerification(String email, String name, String verificationLink, Duration timeout);

    void sendPasswordReset(String email, String name, String resetLink, Duration timeout);

    void sendEmailLoginLink(String email, String loginLink, Duration timeout);
}
