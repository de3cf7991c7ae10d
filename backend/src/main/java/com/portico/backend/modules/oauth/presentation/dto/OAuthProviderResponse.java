package com.portico.backend.modules.oauth.presentation.dto;

import java.time.OffsetDateTime;
import java.util.List;

import com.portico.backend.modules.oauth.domain.OAuthProvider;

/**
 * Administrative view of a provider. Credentials are reported only as configured or not.
 */
public record OAuthProviderResponse(
        String provider,
        boolean enabled,
        List<String> scopes,
        String authUrl,
        String tokenUrl,
        String userInfoUrl,
        boolean clientIdConfigured,
        boolean clientSecretConfigured,
        OffsetDateTime updatedAt
) {

    public static OAuthProviderResponse from(OAuthProvider provider) {
        return new OAuthProviderResponse(
                provider.getType().code(),
                provider.isEnabled(),
                provider.getScopes(),
                provider.getAuthUrl(),
                provider.getTokenUrl(),
                provider.getUserInfoUrl(),
                provider.hasClientId(),
                provider.hasClientSecret(),
                provider.getUpdatedAt()
        );
    }
}
