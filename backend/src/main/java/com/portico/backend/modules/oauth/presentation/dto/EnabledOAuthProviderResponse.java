package com.portico.backend.modules.oauth.presentation.dto;

import java.util.List;

public record EnabledOAuthProviderResponse(String provider, List<String> scopes) {
}
