package com.portico.backend.global.error;

import org.springframework.http.HttpStatus;

/**
 * Client-visible failure kinds. Messages never reveal which half of an
 * email/password pair was wrong or whether an email is registered.
 */
public enum ProblemCode {

    VALIDATION_FAILED(HttpStatus.BAD_REQUEST, "Request validation failed"),
    EMAIL_ALREADY_REGISTERED(HttpStatus.CONFLICT, "An account with this email already exists"),
    INVALID_CREDENTIALS(HttpStatus.UNAUTHORIZED, "Invalid email or password"),
    EMAIL_NOT_VERIFIED(HttpStatus.FORBIDDEN, "Email address has not been verified"),
    UNAUTHENTICATED(HttpStatus.UNAUTHORIZED, "Authentication required"),
    SESSION_EXPIRED(HttpStatus.UNAUTHORIZED, "Session has expired"),
    ACCOUNT_INACTIVE(HttpStatus.FORBIDDEN, "Account is not active"),
    FORBIDDEN(HttpStatus.FORBIDDEN, "Access denied"),
    INVALID_TOKEN(HttpStatus.BAD_REQUEST, "Invalid or malformed token"),
    TOKEN_EXPIRED(HttpStatus.BAD_REQUEST, "Token has expired"),
    INVALID_OR_EXPIRED_TOKEN(HttpStatus.BAD_REQUEST, "Invalid or expired token"),
    RATE_LIMITED(HttpStatus.TOO_MANY_REQUESTS, "Too many requests, slow down"),
    OAUTH_PROVIDER_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE, "Sign-in provider is unavailable"),
    OAUTH_PROVIDER_NOT_FOUND(HttpStatus.NOT_FOUND, "Unknown sign-in provider"),
    OAUTH_ACCOUNT_ALREADY_LINKED(HttpStatus.CONFLICT, "This provider account is already linked"),
    OAUTH_STATE_MISMATCH(HttpStatus.BAD_REQUEST, "Sign-in request could not be matched to this browser"),
    OAUTH_AUTHORIZATION_DENIED(HttpStatus.BAD_REQUEST, "Sign-in was not approved at the provider"),
    OAUTH_EXCHANGE_FAILED(HttpStatus.BAD_GATEWAY, "Sign-in provider did not complete the request"),
    USER_NOT_FOUND(HttpStatus.NOT_FOUND, "User not found"),
    INTERNAL_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error");

    private final HttpStatus status;
    private final String defaultDetail;

    ProblemCode(HttpStatus status, String defaultDetail) {
        this.status = status;
        this.defaultDetail = defaultDetail;
    }

    public HttpStatus status() {
        return status;
    }

    public String defaultDetail() {
        return defaultDetail;
    }
}
