package com.portico.backend.modules.oauth.application;

import java.util.UUID;

import com.portico.backend.global.error.AuthException;
import com.portico.backend.global.error.ProblemCode;
import com.portico.backend.global.error.ProblemException;
import com.portico.backend.modules.auth.application.AuthService;
import com.portico.backend.modules.auth.application.LoginResult;
import com.portico.backend.modules.auth.application.SessionService;
import com.portico.backend.modules.auth.domain.UserAccount;
import com.portico.backend.modules.auth.domain.UserSession;
import com.portico.backend.modules.auth.infrastructure.persistence.UserAccountRepository;
import com.portico.backend.modules.oauth.domain.OAuthProviderType;
import com.portico.backend.modules.oauth.infrastructure.client.OAuthProviderClient;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Completes a provider sign-in: redeems the authorization code, resolves the local account
 * and opens a session.
 *
 * <p>An existing link wins. Otherwise the provider's email selects the account, and only an
 * email the provider has verified may be used to create or claim one. New accounts follow the
 * same first-user rule as registration.
 */
@Service
public class OAuthLoginService {

    private static final Logger log = LoggerFactory.getLogger(OAuthLoginService.class);

    private final OAuthCredentialService oauthCredentialService;
    private final OAuthProviderClient providerClient;
    private final AuthService authService;
    private final UserAccountRepository userAccountRepository;
    private final SessionService sessionService;

    public OAuthLoginService(
            OAuthCredentialService oauthCredentialService,
            OAuthProviderClient providerClient,
            AuthService authService,
            UserAccountRepository userAccountRepository,
            SessionService sessionService
    ) {
        this.oauthCredentialService = oauthCredentialService;
        this.providerClient = providerClient;
        this.authService = authService;
        this.userAccountRepository = userAccountRepository;
        this.sessionService = sessionService;
    }

    public LoginResult login(OAuthProviderType type, String code, String ipAddress, String userAgent) {
        if (!StringUtils.hasText(code)) {
            throw AuthException.validation("code", "code is required");
        }
        OAuthClientRegistration registration = oauthCredentialService.loadRegistration(type);
        OAuthTokenGrant grant = providerClient.exchangeCode(registration, code);
        OAuthUserProfile profile = providerClient.fetchProfile(registration, grant.accessToken());

        UserAccount user = oauthCredentialService.findLinkedUser(type, profile.subject())
                .map(this::linkedAccount)
                .orElseGet(() -> accountForEmail(profile));
        if (!user.isActive()) {
            log.info("OAuth sign-in refused: account {} userId={}", user.getStatus().code(), user.getId());
            throw new AuthException(ProblemCode.ACCOUNT_INACTIVE);
        }

        oauthCredentialService.linkAccount(user.getId(), type, profile.subject(),
                grant.accessToken(), grant.refreshToken(), grant.expiresAt());
        UserSession session = sessionService.create(user.getId(), ipAddress, userAgent);
        log.info("OAuth sign-in userId={} provider={} ip={}", user.getId(), type.code(), ipAddress);
        return new LoginResult(user, session);
    }

    private UserAccount linkedAccount(UUID userId) {
        return userAccountRepository.findById(userId)
                .orElseThrow(() -> new AuthException(ProblemCode.USER_NOT_FOUND));
    }

    private UserAccount accountForEmail(OAuthUserProfile profile) {
        if (!StringUtils.hasText(profile.email())) {
            throw new ProblemException(ProblemCode.OAUTH_EXCHANGE_FAILED, "Provider did not share an email address");
        }
        if (!profile.emailVerified()) {
            throw new AuthException(ProblemCode.EMAIL_NOT_VERIFIED, "Provider has not verified this email address");
        }
        return authService.resolveVerifiedAccount(profile.email(), profile.name());
    }
}
