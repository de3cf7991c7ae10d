package com.portico.backend.modules.oauth.application;

import com.portico.backend.modules.oauth.domain.OAuthProviderType;

public record OAuthClientCredentials(OAuthProviderType provider, String clientId, String clientSecret) {

    @Override
    public String toString() {
        return "OAuthClientCredentials[provider=" + provider + ", clientId=" + clientId + ", clientSecret=***]";
    }
}
