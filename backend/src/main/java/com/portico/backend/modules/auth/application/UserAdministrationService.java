package com.portico.backend.modules.auth.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.UUID;

import com.portico.backend.global.error.AuthException;
import com.portico.backend.global.error.ProblemCode;
import com.portico.backend.modules.auth.domain.UserAccount;
import com.portico.backend.modules.auth.domain.UserRole;
import com.portico.backend.modules.auth.domain.UserStatus;
import com.portico.backend.modules.auth.infrastructure.persistence.UserAccountRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Status and role changes by administrators. Each change writes only its own column.
 */
@Service
public class UserAdministrationService {

    private static final Logger log = LoggerFactory.getLogger(UserAdministrationService.class);

    private final UserAccountRepository userAccountRepository;
    private final SessionService sessionService;
    private final Clock clock;

    public UserAdministrationService(UserAccountRepository userAccountRepository, SessionService sessionService,
                                     Clock clock) {
        this.userAccountRepository = userAccountRepository;
        this.sessionService = sessionService;
        this.clock = clock;
    }

    /**
     * Moving a user away from {@code active} also ends every session they hold.
     */
    public UserAccount changeStatus(UUID actorId, UUID targetId, UserStatus newStatus) {
        UserAccount actor = loadActor(actorId);
        UserAccount target = loadTarget(actorId, targetId);
        if (!actor.getRole().canManageRole(target.getRole())) {
            throw new AuthException(ProblemCode.FORBIDDEN, "Not allowed to manage this user");
        }
        UserStatus previous = target.getStatus();
        if (userAccountRepository.updateStatus(targetId, newStatus, OffsetDateTime.now(clock)) == 0) {
            throw new AuthException(ProblemCode.USER_NOT_FOUND);
        }
        target.setStatus(newStatus);
        if (newStatus != UserStatus.ACTIVE) {
            sessionService.revokeAllForUser(targetId);
        }
        log.info("User status changed userId={} {} -> {} by {}", targetId, previous.code(), newStatus.code(), actorId);
        return target;
    }

    public UserAccount changeRole(UUID actorId, UUID targetId, UserRole newRole) {
        UserAccount actor = loadActor(actorId);
        UserAccount target = loadTarget(actorId, targetId);
        if (!actor.getRole().canManageRole(target.getRole()) || !actor.getRole().canManageRole(newRole)) {
            throw new AuthException(ProblemCode.FORBIDDEN, "Not allowed to assign this role");
        }
        UserRole previous = target.getRole();
        if (userAccountRepository.updateRole(targetId, newRole, OffsetDateTime.now(clock)) == 0) {
            throw new AuthException(ProblemCode.USER_NOT_FOUND);
        }
        target.setRole(newRole);
        log.info("User role changed userId={} {} -> {} by {}", targetId, previous.code(), newRole.code(), actorId);
        return target;
    }

    private UserAccount loadActor(UUID actorId) {
        return userAccountRepository.findById(actorId)
                .orElseThrow(() -> new AuthException(ProblemCode.UNAUTHENTICATED));
    }

    private UserAccount loadTarget(UUID actorId, UUID targetId) {
        if (actorId.equals(targetId)) {
            throw new AuthException(ProblemCode.FORBIDDEN, "Cannot change your own account");
        }
        return userAccountRepository.findById(targetId)
                .orElseThrow(() -> new AuthException(ProblemCode.USER_NOT_FOUND));
    }
}
