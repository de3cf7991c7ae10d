package com.portico.backend.modules.auth.domain;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Totally ordered role ladder. A role satisfies every requirement at or below its level.
 */
public enum UserRole {
    USER("user", 1),
    ADMIN("admin", 2),
    SUPER_ADMIN("super_admin", 3);

    private final String code;
    private final int level;

    UserRole(String code, int level) {
        this.code = code;
        this.level = level;
    }

    public String code() {
        return code;
    }

    public int level() {
        return level;
    }

    public boolean hasPermission(UserRole required) {
        return required != null && level >= required.level;
    }

    /**
     * super_admin manages every role, admin manages plain users only, users manage nobody.
     */
    public boolean canManageRole(UserRole target) {
        if (target == null) {
            return false;
        }
        return switch (this) {
            case SUPER_ADMIN -> true;
            case ADMIN -> target == USER;
            case USER -> false;
        };
    }

    /**
     * Spring Security authorities granted to this role, including every lower role.
     */
    public List<String> grantedAuthorities() {
        return Arrays.stream(values())
                .filter(this::hasPermission)
                .map(role -> "ROLE_" + role.name())
                .toList();
    }

    public static UserRole fromCode(String code) {
        if (code == null) {
            throw new IllegalArgumentException("Role code must not be null");
        }
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        for (UserRole role : values()) {
            if (role.code.equals(normalized)) {
                return role;
            }
        }
        throw new IllegalArgumentException("Unknown role: " + code);
    }
}
