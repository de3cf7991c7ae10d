package com.portico.backend.modules.auth.presentation.dto;

public record RegistrationResponse(
        UserProfileResponse user,
        boolean verificationRequired
) {
}
