package com.portico.backend.modules.auth.application;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Hourly removal of expired sessions and reset tokens. Expiry is enforced on every read,
 * so this only keeps the tables small.
 */
@Service
public class SessionMaintenanceScheduler {

    private static final Logger log = LoggerFactory.getLogger(SessionMaintenanceScheduler.class);

    private final SessionService sessionService;
    private final AccountTokenService accountTokenService;

    public SessionMaintenanceScheduler(SessionService sessionService, AccountTokenService accountTokenService) {
        this.sessionService = sessionService;
        this.accountTokenService = accountTokenService;
    }

    @Scheduled(cron = "${app.maintenance.cron:0 0 * * * *}")
    public void purgeExpired() {
        try {
            int sessions = sessionService.purgeExpired();
            int resetTokens = accountTokenService.purgeExpiredResetTokens();
            if (sessions > 0 || resetTokens > 0) {
                log.info("Maintenance purged {} expired session(s) and {} reset token(s)", sessions, resetTokens);
            }
        } catch (DataAccessException ex) {
            log.warn("Session maintenance failed: {}", ex.getMessage(), ex);
        }
    }
}
