package com.portico.backend.modules.oauth.domain;

import java.util.Locale;

import com.portico.backend.global.error.ProblemCode;
import com.portico.backend.global.error.ProblemException;

public enum OAuthProviderType {
    GOOGLE("google"),
    GITHUB("github"),
    LINKEDIN("linkedin");

    private final String code;

    OAuthProviderType(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    /**
     * Resolves a path or column value; unknown names surface as 404.
     */
    public static OAuthProviderType fromCode(String code) {
        if (code != null) {
            String normalized = code.trim().toLowerCase(Locale.ROOT);
            for (OAuthProviderType type : values()) {
                if (type.code.equals(normalized)) {
                    return type;
                }
            }
        }
        throw new ProblemException(ProblemCode.OAUTH_PROVIDER_NOT_FOUND);
    }
}
