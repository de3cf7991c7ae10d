package com.portico.backend.global.error;

import org.springframework.web.server.ResponseStatusException;

public class ProblemException extends ResponseStatusException {

    private final ProblemCode problemCode;
    private final String detail;
    private final String field;

    public ProblemException(ProblemCode problemCode) {
        this(problemCode, null, null, null);
    }

    public ProblemException(ProblemCode problemCode, String detail) {
        this(problemCode, detail, null, null);
    }

    public ProblemException(ProblemCode problemCode, String detail, String field, Throwable cause) {
        super(requireCode(problemCode).status(), problemCode.name(), cause);
        this.problemCode = problemCode;
        this.detail = (detail != null && !detail.isBlank()) ? detail : problemCode.defaultDetail();
        this.field = field;
    }

    private static ProblemCode requireCode(ProblemCode problemCode) {
        if (problemCode == null) {
            throw new IllegalArgumentException("ProblemException code must not be null");
        }
        return problemCode;
    }

    public ProblemCode getProblemCode() {
        return problemCode;
    }

    public String getCode() {
        return problemCode.name();
    }

    public String getDetailMessage() {
        return detail;
    }

    /**
     * Offending input field for validation failures, otherwise {@code null}.
     */
    public String getField() {
        return field;
    }
}
