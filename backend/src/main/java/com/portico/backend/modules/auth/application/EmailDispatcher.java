package com.portico.backend.modules.auth.application;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import com.portico.backend.global.config.AsyncConfig;
import com.portico.backend.modules.auth.infrastructure.mail.EmailSender;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Fire-and-forget mail delivery. Sends run on the mail executor with a hard timeout;
 * failures are logged and never reach the request that triggered them.
 */
@Component
public class EmailDispatcher {

    private static final Logger log = LoggerFactory.getLogger(EmailDispatcher.class);

    private final EmailSender emailSender;
    private final Executor mailExecutor;
    private final String appUrl;
    private final Duration sendTimeout;

    public EmailDispatcher(
            EmailSender emailSender,
            @Qualifier(AsyncConfig.MAIL_EXECUTOR) Executor mailExecutor,
            @Value("${app.url}") String appUrl,
            @Value("${app.mail.send-timeout:PT10S}") Duration sendTimeout
    ) {
        this.emailSender = emailSender;
        this.mailExecutor = mailExecutor;
        this.appUrl = stripTrailingSlash(appUrl);
        this.sendTimeout = sendTimeout;
    }

    public CompletableFuture<Void> dispatchVerification(String email, String name, String token) {
        String link = appUrl + "/verify-email?token=" + encode(token);
        return dispatch("verification", email, () -> emailSender.sendVerification(email, name, link, sendTimeout));
    }

    public CompletableFuture<Void> dispatchPasswordReset(String email, String name, String token) {
        String link = appUrl + "/reset-password?token=" + encode(token);
        return dispatch("password-reset", email, () -> emailSender.sendPasswordReset(email, name, link, sendTimeout));
    }

    public CompletableFuture<Void> dispatchEmailLoginLink(String email, String token) {
        String link = appUrl + "/auth/email-link/callback?token=" + encode(token);
        return dispatch("email-link", email, () -> emailSender.sendEmailLoginLink(email, link, sendTimeout));
    }

    private CompletableFuture<Void> dispatch(String kind, String recipient, Runnable send) {
        try {
            return CompletableFuture.runAsync(send, mailExecutor)
                    .orTimeout(sendTimeout.toMillis(), TimeUnit.MILLISECONDS)
                    .exceptionally(ex -> {
                        Throwable cause = unwrap(ex);
                        if (cause instanceof TimeoutException) {
                            log.warn("Timed out sending {} email to {} after {}", kind, recipient, sendTimeout);
                        } else {
                            log.warn("Failed to send {} email to {}: {}", kind, recipient, cause.toString());
                        }
                        return null;
                    });
        } catch (RejectedExecutionException ex) {
            log.warn("Mail queue full, dropped {} email to {}", kind, recipient);
            return CompletableFuture.completedFuture(null);
        }
    }

    private static Throwable unwrap(Throwable ex) {
        return (ex instanceof CompletionException && ex.getCause() != null) ? ex.getCause() : ex;
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    private static String stripTrailingSlash(String url) {
        if (url == null) {
            return "";
        }
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
