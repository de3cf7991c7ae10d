package com.portico.backend.modules.oauth.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.portico.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;

import org.hibernate.annotations.UuidGenerator;

@Entity
@Table(
        name = "user_oauth_link",
        uniqueConstraints = {
                @UniqueConstraint(name = "uq_user_oauth_link_subject", columnNames = {"provider", "provider_user_id"}),
                @UniqueConstraint(name = "uq_user_oauth_link_user_provider", columnNames = {"user_id", "provider"})
        }
)
public class UserOAuthLink extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "user_id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID userId;

    @Convert(converter = OAuthProviderTypeConverter.class)
    @Column(name = "provider", nullable = false, updatable = false, length = 32)
    private OAuthProviderType provider;

    @Column(name = "provider_user_id", nullable = false, updatable = false, length = 255)
    private String providerUserId;

    @Column(name = "access_token_encrypted", columnDefinition = "text")
    private String encryptedAccessToken;

    @Column(name = "refresh_token_encrypted", columnDefinition = "text")
    private String encryptedRefreshToken;

    @Column(name = "expires_at")
    private OffsetDateTime expiresAt;

    protected UserOAuthLink() {
    }

    public UserOAuthLink(UUID userId, OAuthProviderType provider, String providerUserId) {
        this.userId = userId;
        this.provider = provider;
        this.providerUserId = providerUserId;
    }

    public UUID getId() {
        return id;
    }

    public UUID getUserId() {
        return userId;
    }

    public OAuthProviderType getProvider() {
        return provider;
    }

    public String getProviderUserId() {
        return providerUserId;
    }

    public String getEncryptedAccessToken() {
        return encryptedAccessToken;
    }

    public String getEncryptedRefreshToken() {
        return encryptedRefreshToken;
    }

    public OffsetDateTime getExpiresAt() {
        return expiresAt;
    }

    public void updateTokens(String encryptedAccessToken, String encryptedRefreshToken, OffsetDateTime expiresAt) {
        this.encryptedAccessToken = encryptedAccessToken;
        this.encryptedRefreshToken = encryptedRefreshToken;
        this.expiresAt = expiresAt;
    }
}
