package com.portico.backend.modules.oauth.presentation.dto;

public record AuthorizationUrlResponse(String provider, String authorizationUrl) {
}
