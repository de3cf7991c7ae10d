package com.portico.backend.modules.auth.presentation.dto;

import java.time.OffsetDateTime;

public record LoginResponse(
        UserProfileResponse user,
        OffsetDateTime sessionExpiresAt
) {
}
