package com.portico.backend.modules.auth.presentation.dto;

import jakarta.validation.constraints.NotBlank;

public record ForgotPasswordRequest(
        @NotBlank(message = "email is required") String email
) {
}
