package com.portico.backend.global.security;

import java.util.UUID;

import com.portico.backend.modules.auth.domain.UserRole;

public record SessionPrincipal(UUID userId, String email, UserRole role, String sessionId) {

    @Override
    public String toString() {
        return "SessionPrincipal[userId=" + userId + ", role=" + role + "]";
    }
}
