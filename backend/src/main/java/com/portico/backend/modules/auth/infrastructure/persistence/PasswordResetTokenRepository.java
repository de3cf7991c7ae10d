package com.portico.backend.modules.auth.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

import com.portico.backend.modules.auth.domain.PasswordResetToken;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

public interface PasswordResetTokenRepository extends JpaRepository<PasswordResetToken, UUID> {

    Optional<PasswordResetToken> findByTokenHash(String tokenHash);

    /**
     * Single-use claim: returns 1 for the one caller that removed the row, 0 for everyone else.
     */
    @Transactional
    @Modifying
    @Query("delete from PasswordResetToken t where t.id = :id")
    int deleteClaimed(@Param("id") UUID id);

    @Transactional
    @Modifying
    @Query("delete from PasswordResetToken t where t.expiresAt <= :now")
    int deleteExpired(@Param("now") OffsetDateTime now);
}
