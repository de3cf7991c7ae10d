package com.portico.backend.modules.auth.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.portico.backend.modules.auth.domain.UserAccount;

public record UserProfileResponse(
        UUID userId,
        String email,
        String name,
        String role,
        String status,
        boolean emailVerified,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {

    public static UserProfileResponse from(UserAccount user) {
        return new UserProfileResponse(
                user.getId(),
                user.getEmail(),
                user.getName(),
                user.getRole().code(),
                user.getStatus().code(),
                user.isEmailVerified(),
                user.getCreatedAt(),
                user.getUpdatedAt()
        );
    }
}
