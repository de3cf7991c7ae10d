package com.portico.backend.modules.auth.application;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.QueryTimeoutException;

@ExtendWith(MockitoExtension.class)
class SessionMaintenanceSchedulerTest {

    @Mock
    private SessionService sessionService;

    @Mock
    private AccountTokenService accountTokenService;

    @InjectMocks
    private SessionMaintenanceScheduler scheduler;

    @Test
    void purgesSessionsAndResetTokens() {
        when(sessionService.purgeExpired()).thenReturn(2);
        when(accountTokenService.purgeExpiredResetTokens()).thenReturn(1);

        scheduler.purgeExpired();

        verify(sessionService).purgeExpired();
        verify(accountTokenService).purgeExpiredResetTokens();
    }

    @Test
    void storeFailureDoesNotEscapeTheJob() {
        when(sessionService.purgeExpired()).thenThrow(new QueryTimeoutException("statement timeout"));

        scheduler.purgeExpired();

        verifyNoInteractions(accountTokenService);
    }
}
