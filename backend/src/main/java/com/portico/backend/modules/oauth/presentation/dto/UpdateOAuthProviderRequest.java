package com.portico.backend.modules.oauth.presentation.dto;

import java.util.List;

import jakarta.validation.constraints.Size;

/**
 * Partial update: absent fields keep their stored value.
 */
public record UpdateOAuthProviderRequest(
        @Size(max = 255, message = "clientId must be at most 255 characters") String clientId,
        @Size(max = 255, message = "clientSecret must be at most 255 characters") String clientSecret,
        Boolean enabled,
        List<String> scopes,
        String authUrl,
        String tokenUrl,
        String userInfoUrl
) {

    @Override
    public String toString() {
        return "UpdateOAuthProviderRequest[enabled=" + enabled + ", scopes=" + scopes + "]";
    }
}
