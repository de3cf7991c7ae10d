package com.portico.backend.modules.oauth.application;

import com.portico.backend.modules.oauth.domain.OAuthProviderType;

/**
 * Everything needed to redeem an authorization code: decrypted client credentials, the
 * provider endpoints and the callback URL the code was issued for.
 */
public record OAuthClientRegistration(
        OAuthClientCredentials credentials,
        String tokenUrl,
        String userInfoUrl,
        String redirectUri
) {

    public OAuthProviderType provider() {
        return credentials.provider();
    }
}
