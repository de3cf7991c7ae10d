package com.portico.backend.modules.oauth.application;

/**
 * Identity reported by a provider. {@code emailVerified} is true only when the provider
 * vouches for the address.
 */
public record OAuthUserProfile(String subject, String email, String name, boolean emailVerified) {
}
