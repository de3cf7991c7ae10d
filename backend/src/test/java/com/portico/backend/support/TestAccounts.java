package com.portico.backend.support;

import java.util.UUID;

import com.portico.backend.modules.auth.domain.UserAccount;
import com.portico.backend.modules.auth.domain.UserRole;
import com.portico.backend.modules.auth.domain.UserStatus;

import org.springframework.test.util.ReflectionTestUtils;

public final class TestAccounts {

    private TestAccounts() {
    }

    public static UserAccount account(String email, UserRole role, UserStatus status) {
        UserAccount user = new UserAccount(email, "Test " + role.code(), "hash", role);
        user.setStatus(status);
        ReflectionTestUtils.setField(user, "id", UUID.randomUUID());
        return user;
    }

    public static UserAccount activeUser(String email) {
        return account(email, UserRole.USER, UserStatus.ACTIVE);
    }

    public static UserAccount verifiedUser(String email, UserRole role) {
        UserAccount user = account(email, role, UserStatus.ACTIVE);
        user.markEmailVerified();
        return user;
    }
}
