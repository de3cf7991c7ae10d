package com.portico.backend.modules.auth.presentation.dto;

import jakarta.validation.constraints.NotBlank;

public record RegisterRequest(
        @NotBlank(message = "email is required") String email,
        @NotBlank(message = "name is required") String name,
        @NotBlank(message = "password is required") String password,
        String passwordConfirmation
) {
}
