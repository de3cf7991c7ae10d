package com.portico.backend.modules.auth.application;

import com.portico.backend.modules.auth.domain.UserAccount;

public record RegistrationResult(UserAccount user, boolean verificationRequired) {
}
