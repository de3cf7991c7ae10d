package com.portico.backend.modules.auth.presentation.dto;

import jakarta.validation.constraints.NotBlank;

public record EmailLinkRequest(
        @NotBlank(message = "email is required") String email
) {
}
