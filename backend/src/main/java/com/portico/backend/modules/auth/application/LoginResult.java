package com.portico.backend.modules.auth.application;

import com.portico.backend.modules.auth.domain.UserAccount;
import com.portico.backend.modules.auth.domain.UserSession;

public record LoginResult(UserAccount user, UserSession session) {
}
