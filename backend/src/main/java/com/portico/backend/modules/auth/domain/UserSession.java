package com.portico.backend.modules.auth.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.portico.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PostLoad;
import jakarta.persistence.PostPersist;
import jakarta.persistence.Table;
import jakarta.persistence.Transient;

import org.springframework.data.domain.Persistable;

/**
 * Server-side session. The id is the opaque bearer value held in the session cookie.
 */
@Entity
@Table(name = "user_session")
public class UserSession extends AbstractTimestampedEntity implements Persistable<String> {

    @Id
    @Column(name = "id", nullable = false, updatable = false, length = 64)
    private String id;

    @Column(name = "user_id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID userId;

    @Column(name = "issued_at", nullable = false, updatable = false)
    private OffsetDateTime issuedAt;

    @Column(name = "expires_at", nullable = false, updatable = false)
    private OffsetDateTime expiresAt;

    @Column(name = "last_activity_at", nullable = false)
    private OffsetDateTime lastActivityAt;

    @Column(name = "ip_address", length = 64)
    private String ipAddress;

    @Column(name = "user_agent", length = 512)
    private String userAgent;

    @Transient
    private boolean isNew = true;

    protected UserSession() {
    }

    public UserSession(String id, UUID userId, OffsetDateTime issuedAt, OffsetDateTime expiresAt,
                       String ipAddress, String userAgent) {
        this.id = id;
        this.userId = userId;
        this.issuedAt = issuedAt;
        this.expiresAt = expiresAt;
        this.lastActivityAt = issuedAt;
        this.ipAddress = ipAddress;
        this.userAgent = userAgent;
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public boolean isNew() {
        return isNew;
    }

    @PostLoad
    @PostPersist
    void markNotNew() {
        this.isNew = false;
    }

    public UUID getUserId() {
        return userId;
    }

    public OffsetDateTime getIssuedAt() {
        return issuedAt;
    }

    public OffsetDateTime getExpiresAt() {
        return expiresAt;
    }

    public OffsetDateTime getLastActivityAt() {
        return lastActivityAt;
    }

    public String getIpAddress() {
        return ipAddress;
    }

    public String getUserAgent() {
        return userAgent;
    }

    /**
     * Expired from {@code expiresAt} onwards.
     */
    public boolean isExpired(OffsetDateTime now) {
        return !now.isBefore(expiresAt);
    }
}
