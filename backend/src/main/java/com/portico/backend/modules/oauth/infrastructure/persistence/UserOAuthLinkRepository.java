package com.portico.backend.modules.oauth.infrastructure.persistence;

import java.util.Optional;
import java.util.UUID;

import com.portico.backend.modules.oauth.domain.OAuthProviderType;
import com.portico.backend.modules.oauth.domain.UserOAuthLink;

import org.springframework.data.jpa.repository.JpaRepository;

public interface UserOAuthLinkRepository extends JpaRepository<UserOAuthLink, UUID> {

    Optional<UserOAuthLink> findByProviderAndProviderUserId(OAuthProviderType provider, String providerUserId);

    Optional<UserOAuthLink> findByUserIdAndProvider(UUID userId, OAuthProviderType provider);
}
