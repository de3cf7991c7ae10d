package com.portico.backend.modules.auth.application;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.UUID;

import com.portico.backend.global.crypto.SecureTokenGenerator;
import com.portico.backend.global.error.AuthException;
import com.portico.backend.global.error.ProblemCode;
import com.portico.backend.modules.auth.domain.UserAccount;
import com.portico.backend.modules.auth.domain.UserSession;
import com.portico.backend.modules.auth.infrastructure.persistence.UserAccountRepository;
import com.portico.backend.modules.auth.infrastructure.persistence.UserSessionRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Issues, validates and revokes server-side sessions. Lifetime is fixed at creation.
 */
@Service
public class SessionService {

    private static final Logger log = LoggerFactory.getLogger(SessionService.class);
    private static final int USER_AGENT_MAX_LENGTH = 512;
    private static final int IP_ADDRESS_MAX_LENGTH = 64;

    private final UserSessionRepository userSessionRepository;
    private final UserAccountRepository userAccountRepository;
    private final SecureTokenGenerator tokenGenerator;
    private final Duration sessionTtl;
    private final Clock clock;

    public SessionService(
            UserSessionRepository userSessionRepository,
            UserAccountRepository userAccountRepository,
            SecureTokenGenerator tokenGenerator,
            @Value("${app.auth.session-ttl:P7D}") Duration sessionTtl,
            Clock clock
    ) {
        this.userSessionRepository = userSessionRepository;
        this.userAccountRepository = userAccountRepository;
        this.tokenGenerator = tokenGenerator;
        this.sessionTtl = sessionTtl;
        this.clock = clock;
    }

    public UserSession create(UUID userId, String ipAddress, String userAgent) {
        if (userId == null) {
            throw new IllegalArgumentException("userId must not be null");
        }
        OffsetDateTime now = OffsetDateTime.now(clock);
        UserSession session = new UserSession(
                tokenGenerator.generate(),
                userId,
                now,
                now.plus(sessionTtl),
                truncate(ipAddress, IP_ADDRESS_MAX_LENGTH),
                truncate(userAgent, USER_AGENT_MAX_LENGTH)
        );
        UserSession saved = userSessionRepository.save(session);
        log.info("Session issued userId={} expiresAt={}", userId, saved.getExpiresAt());
        return saved;
    }

    /**
     * Resolves the session owner. Expired sessions are deleted on sight; sessions of
     * non-active owners are kept but refused.
     */
    public UserAccount validate(String sessionId) {
        if (!StringUtils.hasText(sessionId)) {
            throw new AuthException(ProblemCode.UNAUTHENTICATED);
        }
        UserSession session = userSessionRepository.findById(sessionId)
                .orElseThrow(() -> new AuthException(ProblemCode.UNAUTHENTICATED));

        if (session.isExpired(OffsetDateTime.now(clock))) {
            userSessionRepository.deleteById(sessionId);
            log.debug("Expired session removed userId={}", session.getUserId());
            throw new AuthException(ProblemCode.SESSION_EXPIRED);
        }

        UserAccount user = userAccountRepository.findById(session.getUserId())
                .orElseThrow(() -> new AuthException(ProblemCode.UNAUTHENTICATED));
        if (!user.isActive()) {
            throw new AuthException(ProblemCode.ACCOUNT_INACTIVE);
        }
        return user;
    }

    public void revoke(String sessionId) {
        if (!StringUtils.hasText(sessionId)) {
            return;
        }
        userSessionRepository.deleteById(sessionId);
    }

    public int revokeAllForUser(UUID userId) {
        int revoked = userSessionRepository.deleteByUserId(userId);
        if (revoked > 0) {
            log.info("Revoked {} session(s) userId={}", revoked, userId);
        }
        return revoked;
    }

    public int purgeExpired() {
        return userSessionRepository.deleteExpired(OffsetDateTime.now(clock));
    }

    private static String truncate(String value, int maxLength) {
        if (value == null) {
            return null;
        }
        return value.length() > maxLength ? value.substring(0, maxLength) : value;
    }
}
