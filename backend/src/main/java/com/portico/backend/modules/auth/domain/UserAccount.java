package com.portico.backend.modules.auth.domain;

import java.time.OffsetDateTime;
import java.util.Locale;
import java.util.UUID;

import com.portico.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

/**
 * Portico user account. Accounts are never hard-deleted; access is withdrawn through {@link UserStatus}.
 */
@Entity
@Table(name = "user_account")
public class UserAccount extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "email", nullable = false, unique = true, length = 320)
    private String email;

    @Column(name = "name", nullable = false, length = 100)
    private String name;

    /** Empty for accounts created through the email link or an OAuth provider. */
    @Column(name = "password_hash", nullable = false, length = 255)
    private String passwordHash = "";

    @Convert(converter = UserRoleConverter.class)
    @Column(name = "role", nullable = false, length = 16)
    private UserRole role = UserRole.USER;

    @Convert(converter = UserStatusConverter.class)
    @Column(name = "status", nullable = false, length = 16)
    private UserStatus status = UserStatus.ACTIVE;

    @Column(name = "email_verified", nullable = false)
    private boolean emailVerified;

    @Column(name = "verification_token", unique = true, length = 64)
    private String verificationToken;

    @Column(name = "verification_token_expires_at")
    private OffsetDateTime verificationTokenExpiresAt;

    protected UserAccount() {
    }

    public UserAccount(String email, String name, String passwordHash, UserRole role) {
        this.email = normalizeEmail(email);
        this.name = name;
        this.passwordHash = passwordHash == null ? "" : passwordHash;
        this.role = role;
        this.status = UserStatus.ACTIVE;
    }

    public static String normalizeEmail(String email) {
        return email == null ? null : email.trim().toLowerCase(Locale.ROOT);
    }

    public UUID getId() {
        return id;
    }

    public String getEmail() {
        return email;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getPasswordHash() {
        return passwordHash;
    }

    public void setPasswordHash(String passwordHash) {
        this.passwordHash = passwordHash == null ? "" : passwordHash;
    }

    public boolean hasPassword() {
        return passwordHash != null && !passwordHash.isEmpty();
    }

    public UserRole getRole() {
        return role;
    }

    public void setRole(UserRole role) {
        this.role = role;
    }

    public UserStatus getStatus() {
        return status;
    }

    public void setStatus(UserStatus status) {
        this.status = status;
    }

    public boolean isActive() {
        return status == UserStatus.ACTIVE;
    }

    public boolean isEmailVerified() {
        return emailVerified;
    }

    public String getVerificationToken() {
        return verificationToken;
    }

    public OffsetDateTime getVerificationTokenExpiresAt() {
        return verificationTokenExpiresAt;
    }

    /**
     * Replaces any outstanding verification token.
     */
    public void assignVerificationToken(String token, OffsetDateTime expiresAt) {
        this.verificationToken = token;
        this.verificationTokenExpiresAt = expiresAt;
    }

    public void markEmailVerified() {
        this.emailVerified = true;
        this.verificationToken = null;
        this.verificationTokenExpiresAt = null;
    }
}
