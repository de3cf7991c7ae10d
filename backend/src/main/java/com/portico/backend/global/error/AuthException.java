package com.portico.backend.global.error;

/**
 * Domain failure raised by the authentication, session and token services.
 */
public class AuthException extends ProblemException {

    public AuthException(ProblemCode problemCode) {
        super(problemCode);
    }

    public AuthException(ProblemCode problemCode, String detail) {
        super(problemCode, detail);
    }

    public static AuthException validation(String field, String message) {
        return new AuthException(ProblemCode.VALIDATION_FAILED, field, message);
    }

    private AuthException(ProblemCode problemCode, String field, String detail) {
        super(problemCode, detail, field, null);
    }
}
