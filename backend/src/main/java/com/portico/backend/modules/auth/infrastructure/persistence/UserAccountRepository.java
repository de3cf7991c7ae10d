package com.portico.backend.modules.auth.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

import com.portico.backend.modules.auth.domain.UserAccount;
import com.portico.backend.modules.auth.domain.UserRole;
import com.portico.backend.modules.auth.domain.UserStatus;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

public interface UserAccountRepository extends JpaRepository<UserAccount, UUID> {

    Optional<UserAccount> findByEmail(String email);

    boolean existsByEmail(String email);

    Optional<UserAccount> findByVerificationToken(String verificationToken);

    /**
     * Claims a verification token: succeeds for exactly one caller while the token is still on the account.
     */
    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("""
            update UserAccount u
               set u.emailVerified = true,
                   u.verificationToken = null,
                   u.verificationTokenExpiresAt = null,
                   u.updatedAt = :now
             where u.id = :userId
               and u.verificationToken = :token
               and u.emailVerified = false
            """)
    int markEmailVerified(@Param("userId") UUID userId,
                          @Param("token") String token,
                          @Param("now") OffsetDateTime now);

    /**
     * Replaces a stale verification token. Matches nothing once the account is verified.
     */
    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("""
            update UserAccount u
               set u.verificationToken = :token,
                   u.verificationTokenExpiresAt = :expiresAt,
                   u.updatedAt = :now
             where u.id = :userId
               and u.emailVerified = false
            """)
    int rotateVerificationToken(@Param("userId") UUID userId,
                                @Param("token") String token,
                                @Param("expiresAt") OffsetDateTime expiresAt,
                                @Param("now") OffsetDateTime now);

    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("""
            update UserAccount u
               set u.emailVerified = true,
                   u.verificationToken = null,
                   u.verificationTokenExpiresAt = null,
                   u.updatedAt = :now
             where u.id = :userId
               and u.emailVerified = false
            """)
    int markEmailVerifiedById(@Param("userId") UUID userId, @Param("now") OffsetDateTime now);

    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("update UserAccount u set u.passwordHash = :passwordHash, u.updatedAt = :now where u.id = :userId")
    int updatePasswordHash(@Param("userId") UUID userId,
                           @Param("passwordHash") String passwordHash,
                           @Param("now") OffsetDateTime now);

    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("update UserAccount u set u.status = :status, u.updatedAt = :now where u.id = :userId")
    int updateStatus(@Param("userId") UUID userId,
                     @Param("status") UserStatus status,
                     @Param("now") OffsetDateTime now);

    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("update UserAccount u set u.role = :role, u.updatedAt = :now where u.id = :userId")
    int updateRole(@Param("userId") UUID userId,
                   @Param("role") UserRole role,
                   @Param("now") OffsetDateTime now);
}
