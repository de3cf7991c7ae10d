package com.portico.backend.modules.auth.domain;

import java.util.Locale;

public enum UserStatus {
    ACTIVE("active"),
    SUSPENDED("suspended"),
    BANNED("banned");

    private final String code;

    UserStatus(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public static UserStatus fromCode(String code) {
        if (code == null) {
            throw new IllegalArgumentException("Status code must not be null");
        }
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        for (UserStatus status : values()) {
            if (status.code.equals(normalized)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown status: " + code);
    }
}
