package com.portico.backend.modules.oauth.application;

import java.time.OffsetDateTime;

public record OAuthTokenGrant(String accessToken, String refreshToken, OffsetDateTime expiresAt) {

    @Override
    public String toString() {
        return "OAuthTokenGrant[accessToken=***, refreshToken=***, expiresAt=" + expiresAt + "]";
    }
}
