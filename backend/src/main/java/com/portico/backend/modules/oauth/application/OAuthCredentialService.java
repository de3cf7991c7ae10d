package com.portico.backend.modules.oauth.application;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.portico.backend.global.crypto.InvalidCiphertextException;
import com.portico.backend.global.crypto.SecretCipher;
import com.portico.backend.global.error.AuthException;
import com.portico.backend.global.error.ProblemCode;
import com.portico.backend.global.error.ProblemException;
import com.portico.backend.modules.oauth.domain.OAuthProvider;
import com.portico.backend.modules.oauth.domain.OAuthProviderType;
import com.portico.backend.modules.oauth.domain.UserOAuthLink;
import com.portico.backend.modules.oauth.infrastructure.persistence.OAuthProviderRepository;
import com.portico.backend.modules.oauth.infrastructure.persistence.UserOAuthLinkRepository;
import com.portico.backend.modules.oauth.presentation.dto.UpdateOAuthProviderRequest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * Provider client credentials and per-user provider tokens, encrypted at rest with {@link SecretCipher}.
 *
 * <p>Stored values that fail to decrypt make the provider unavailable. They are never
 * passed on in encrypted form.
 */
@Service
@Transactional(readOnly = true)
public class OAuthCredentialService {

    private static final Logger log = LoggerFactory.getLogger(OAuthCredentialService.class);

    private final OAuthProviderRepository providerRepository;
    private final UserOAuthLinkRepository linkRepository;
    private final SecretCipher secretCipher;
    private final String appUrl;

    public OAuthCredentialService(
            OAuthProviderRepository providerRepository,
            UserOAuthLinkRepository linkRepository,
            SecretCipher secretCipher,
            @Value("${app.url}") String appUrl
    ) {
        this.providerRepository = providerRepository;
        this.linkRepository = linkRepository;
        this.secretCipher = secretCipher;
        this.appUrl = appUrl.endsWith("/") ? appUrl.substring(0, appUrl.length() - 1) : appUrl;
    }

    public List<OAuthProvider> listProviders() {
        return providerRepository.findAllByOrderByProviderAsc();
    }

    public List<OAuthProvider> listEnabledProviders() {
        return providerRepository.findAllByEnabledTrueOrderByProviderAsc();
    }

    @Transactional
    public OAuthProvider updateProvider(OAuthProviderType type, UpdateOAuthProviderRequest request) {
        OAuthProvider provider = providerRepository.findById(type.code())
                .orElseGet(() -> new OAuthProvider(type));

        if (request.clientId() != null) {
            provider.setEncryptedClientId(encryptOrEmpty(request.clientId().trim()));
        }
        if (request.clientSecret() != null) {
            provider.setEncryptedClientSecret(encryptOrEmpty(request.clientSecret()));
        }
        if (request.scopes() != null) {
            provider.setScopes(request.scopes().stream()
                    .filter(StringUtils::hasText)
                    .map(String::trim)
                    .toList());
        }
        if (request.authUrl() != null) {
            provider.setAuthUrl(requireHttpUrl("authUrl", request.authUrl()));
        }
        if (request.tokenUrl() != null) {
            provider.setTokenUrl(requireHttpUrl("tokenUrl", request.tokenUrl()));
        }
        if (request.userInfoUrl() != null) {
            provider.setUserInfoUrl(requireHttpUrl("userInfoUrl", request.userInfoUrl()));
        }
        if (request.enabled() != null) {
            provider.setEnabled(request.enabled());
        }
        if (provider.isEnabled() && (!provider.hasClientId() || !provider.hasClientSecret())) {
            throw AuthException.validation("enabled", "client id and secret are required to enable a provider");
        }

        OAuthProvider saved = providerRepository.save(provider);
        log.info("OAuth provider updated provider={} enabled={}", type.code(), saved.isEnabled());
        return saved;
    }

    /**
     * Decrypted client credentials and endpoints of an enabled provider, ready for a code exchange.
     */
    public OAuthClientRegistration loadRegistration(OAuthProviderType type) {
        OAuthProvider provider = enabledProvider(type);
        if (!StringUtils.hasText(provider.getTokenUrl()) || !StringUtils.hasText(provider.getUserInfoUrl())) {
            log.warn("OAuth provider {} is enabled without token or user info endpoint", type.code());
            throw new ProblemException(ProblemCode.OAUTH_PROVIDER_UNAVAILABLE);
        }
        return new OAuthClientRegistration(credentialsOf(provider),
                provider.getTokenUrl(), provider.getUserInfoUrl(), callbackUrl(type));
    }

    public String buildAuthorizationUrl(OAuthProviderType type, String state) {
        if (!StringUtils.hasText(state)) {
            throw AuthException.validation("state", "state is required");
        }
        OAuthProvider provider = enabledProvider(type);
        if (!StringUtils.hasText(provider.getAuthUrl())) {
            throw new ProblemException(ProblemCode.OAUTH_PROVIDER_UNAVAILABLE);
        }
        OAuthClientCredentials credentials = credentialsOf(provider);
        return UriComponentsBuilder.fromHttpUrl(provider.getAuthUrl())
                .queryParam("client_id", credentials.clientId())
                .queryParam("redirect_uri", callbackUrl(type))
                .queryParam("response_type", "code")
                .queryParam("scope", String.join(" ", provider.getScopes()))
                .queryParam("state", state)
                .encode()
                .build()
                .toUriString();
    }

    /**
     * Binds a provider subject to a user. A subject belongs to at most one user and a user holds
     * at most one link per provider; relinking the same pair refreshes the stored tokens.
     */
    @Transactional
    public UserOAuthLink linkAccount(UUID userId, OAuthProviderType type, String providerUserId,
                                     String accessToken, String refreshToken, OffsetDateTime expiresAt) {
        if (!StringUtils.hasText(providerUserId)) {
            throw AuthException.validation("providerUserId", "providerUserId is required");
        }
        Optional<UserOAuthLink> bySubject = linkRepository.findByProviderAndProviderUserId(type, providerUserId);
        if (bySubject.isPresent() && !bySubject.get().getUserId().equals(userId)) {
            throw new ProblemException(ProblemCode.OAUTH_ACCOUNT_ALREADY_LINKED);
        }
        Optional<UserOAuthLink> byUser = linkRepository.findByUserIdAndProvider(userId, type);
        if (byUser.isPresent() && !byUser.get().getProviderUserId().equals(providerUserId)) {
            throw new ProblemException(ProblemCode.OAUTH_ACCOUNT_ALREADY_LINKED);
        }

        UserOAuthLink link = bySubject.orElseGet(() -> new UserOAuthLink(userId, type, providerUserId));
        link.updateTokens(encryptOrNull(accessToken), encryptOrNull(refreshToken), expiresAt);
        try {
            UserOAuthLink saved = linkRepository.saveAndFlush(link);
            log.info("OAuth account linked userId={} provider={}", userId, type.code());
            return saved;
        } catch (DataIntegrityViolationException ex) {
            throw new ProblemException(ProblemCode.OAUTH_ACCOUNT_ALREADY_LINKED);
        }
    }

    public Optional<UUID> findLinkedUser(OAuthProviderType type, String providerUserId) {
        return linkRepository.findByProviderAndProviderUserId(type, providerUserId)
                .map(UserOAuthLink::getUserId);
    }

    private String callbackUrl(OAuthProviderType type) {
        return appUrl + "/auth/oauth/" + type.code() + "/callback";
    }

    private OAuthProvider enabledProvider(OAuthProviderType type) {
        return providerRepository.findById(type.code())
                .filter(OAuthProvider::isEnabled)
                .orElseThrow(() -> new ProblemException(ProblemCode.OAUTH_PROVIDER_UNAVAILABLE));
    }

    private OAuthClientCredentials credentialsOf(OAuthProvider provider) {
        OAuthProviderType type = provider.getType();
        String clientId = decrypt(type, provider.getEncryptedClientId());
        String clientSecret = decrypt(type, provider.getEncryptedClientSecret());
        if (clientId.isEmpty() || clientSecret.isEmpty()) {
            throw new ProblemException(ProblemCode.OAUTH_PROVIDER_UNAVAILABLE);
        }
        return new OAuthClientCredentials(type, clientId, clientSecret);
    }

    private String decrypt(OAuthProviderType type, String ciphertext) {
        try {
            return secretCipher.decrypt(ciphertext);
        } catch (InvalidCiphertextException ex) {
            log.error("Stored credential for provider={} cannot be decrypted", type.code());
            throw new ProblemException(ProblemCode.OAUTH_PROVIDER_UNAVAILABLE, null, null, ex);
        }
    }

    private String encryptOrEmpty(String plaintext) {
        return plaintext.isEmpty() ? "" : secretCipher.encrypt(plaintext);
    }

    private String encryptOrNull(String plaintext) {
        return StringUtils.hasText(plaintext) ? secretCipher.encrypt(plaintext) : null;
    }

    private static String requireHttpUrl(String field, String url) {
        String trimmed = url.trim();
        if (!trimmed.startsWith("https://") && !trimmed.startsWith("http://")) {
            throw AuthException.validation(field, field + " must be an absolute http(s) URL");
        }
        return trimmed;
    }
}
