package com.portico.backend.modules.oauth.domain;

import java.util.Arrays;
import java.util.List;

import com.portico.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/**
 * Client registration for an external sign-in provider. Client id and secret are held
 * only as {@code SecretCipher} output.
 */
@Entity
@Table(name = "oauth_provider")
public class OAuthProvider extends AbstractTimestampedEntity {

    @Id
    @Column(name = "provider", nullable = false, updatable = false, length = 32)
    private String provider;

    @Column(name = "client_id_encrypted", nullable = false, columnDefinition = "text")
    private String encryptedClientId = "";

    @Column(name = "client_secret_encrypted", nullable = false, columnDefinition = "text")
    private String encryptedClientSecret = "";

    @Column(name = "enabled", nullable = false)
    private boolean enabled;

    @JdbcTypeCode(SqlTypes.ARRAY)
    @Column(name = "scopes", columnDefinition = "text[]")
    private String[] scopes = new String[0];

    @Column(name = "auth_url", length = 255)
    private String authUrl;

    @Column(name = "token_url", length = 255)
    private String tokenUrl;

    @Column(name = "user_info_url", length = 255)
    private String userInfoUrl;

    protected OAuthProvider() {
    }

    public OAuthProvider(OAuthProviderType type) {
        this.provider = type.code();
    }

    public OAuthProviderType getType() {
        return OAuthProviderType.fromCode(provider);
    }

    public String getEncryptedClientId() {
        return encryptedClientId;
    }

    public void setEncryptedClientId(String encryptedClientId) {
        this.encryptedClientId = encryptedClientId == null ? "" : encryptedClientId;
    }

    public String getEncryptedClientSecret() {
        return encryptedClientSecret;
    }

    public void setEncryptedClientSecret(String encryptedClientSecret) {
        this.encryptedClientSecret = encryptedClientSecret == null ? "" : encryptedClientSecret;
    }

    public boolean hasClientId() {
        return !encryptedClientId.isEmpty();
    }

    public boolean hasClientSecret() {
        return !encryptedClientSecret.isEmpty();
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public List<String> getScopes() {
        return scopes == null ? List.of() : List.of(scopes);
    }

    public void setScopes(List<String> scopes) {
        this.scopes = scopes == null ? new String[0] : scopes.toArray(String[]::new);
    }

    public String getAuthUrl() {
        return authUrl;
    }

    public void setAuthUrl(String authUrl) {
        this.authUrl = authUrl;
    }

    public String getTokenUrl() {
        return tokenUrl;
    }

    public void setTokenUrl(String tokenUrl) {
        this.tokenUrl = tokenUrl;
    }

    public String getUserInfoUrl() {
        return userInfoUrl;
    }

    public void setUserInfoUrl(String userInfoUrl) {
        this.userInfoUrl = userInfoUrl;
    }

    @Override
    public String toString() {
        return "OAuthProvider[" + provider + ", enabled=" + enabled + ", scopes=" + Arrays.toString(scopes) + "]";
    }
}
