package com.portico.backend.modules.oauth.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.portico.backend.global.crypto.SecretCipher;
import com.portico.backend.global.error.ProblemCode;
import com.portico.backend.global.error.ProblemException;
import com.portico.backend.modules.oauth.domain.OAuthProvider;
import com.portico.backend.modules.oauth.domain.OAuthProviderType;
import com.portico.backend.modules.oauth.domain.UserOAuthLink;
import com.portico.backend.modules.oauth.infrastructure.persistence.OAuthProviderRepository;
import com.portico.backend.modules.oauth.infrastructure.persistence.UserOAuthLinkRepository;
import com.portico.backend.modules.oauth.presentation.dto.UpdateOAuthProviderRequest;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class OAuthCredentialServiceTest {

    private static final String SECRET = "0123456789abcdef0123456789abcdef";

    @Mock
    private OAuthProviderRepository providerRepository;

    @Mock
    private UserOAuthLinkRepository linkRepository;

    private final SecretCipher secretCipher = new SecretCipher(SECRET);

    private OAuthCredentialService service;

    @BeforeEach
    void setUp() {
        service = new OAuthCredentialService(providerRepository, linkRepository, secretCipher, "https://portico.example.com/");
    }

    @Test
    void credentialsAreStoredEncrypted() {
        when(providerRepository.findById("google")).thenReturn(Optional.empty());
        when(providerRepository.save(any(OAuthProvider.class))).thenAnswer(invocation -> invocation.getArgument(0));

        OAuthProvider saved = service.updateProvider(OAuthProviderType.GOOGLE, new UpdateOAuthProviderRequest(
                " client-123 ", "s3cr3t", true, List.of("openid", " email ", ""),
                "https://accounts.example.com/o/oauth2/auth", null, null));

        assertThat(saved.isEnabled()).isTrue();
        assertThat(saved.getEncryptedClientId()).isNotEmpty().doesNotContain("client-123");
        assertThat(saved.getEncryptedClientSecret()).isNotEmpty().doesNotContain("s3cr3t");
        assertThat(secretCipher.decrypt(saved.getEncryptedClientId())).isEqualTo("client-123");
        assertThat(saved.getScopes()).containsExactly("openid", "email");
    }

    @Test
    void enablingWithoutCredentialsIsRejected() {
        when(providerRepository.findById("github")).thenReturn(Optional.of(new OAuthProvider(OAuthProviderType.GITHUB)));

        ProblemException exception = assertThrows(ProblemException.class, () -> service.updateProvider(
                OAuthProviderType.GITHUB, new UpdateOAuthProviderRequest(null, null, true, null, null, null, null)));

        assertThat(exception.getProblemCode()).isEqualTo(ProblemCode.VALIDATION_FAILED);
        assertThat(exception.getField()).isEqualTo("enabled");
        verify(providerRepository, never()).save(any());
    }

    @Test
    void loadsDecryptedRegistration() {
        when(providerRepository.findById("google")).thenReturn(Optional.of(configuredProvider(true)));

        OAuthClientRegistration registration = service.loadRegistration(OAuthProviderType.GOOGLE);

        assertThat(registration.credentials().clientId()).isEqualTo("client-123");
        assertThat(registration.credentials().clientSecret()).isEqualTo("s3cr3t");
        assertThat(registration.toString()).doesNotContain("s3cr3t");
        assertThat(registration.tokenUrl()).isEqualTo("https://oauth2.example.com/token");
        assertThat(registration.redirectUri()).isEqualTo("https://portico.example.com/auth/oauth/google/callback");
    }

    @Test
    void providerWithoutTokenEndpointIsUnavailable() {
        OAuthProvider provider = configuredProvider(true);
        provider.setTokenUrl(null);
        when(providerRepository.findById("google")).thenReturn(Optional.of(provider));

        ProblemException exception = assertThrows(ProblemException.class,
                () -> service.loadRegistration(OAuthProviderType.GOOGLE));

        assertThat(exception.getProblemCode()).isEqualTo(ProblemCode.OAUTH_PROVIDER_UNAVAILABLE);
    }

    @Test
    void disabledProviderIsUnavailable() {
        when(providerRepository.findById("google")).thenReturn(Optional.of(configuredProvider(false)));

        ProblemException exception = assertThrows(ProblemException.class,
                () -> service.loadRegistration(OAuthProviderType.GOOGLE));

        assertThat(exception.getProblemCode()).isEqualTo(ProblemCode.OAUTH_PROVIDER_UNAVAILABLE);
        assertThat(exception.getStatusCode().value()).isEqualTo(503);
    }

    @Test
    void undecryptableCredentialsFailClosed() {
        OAuthProvider provider = configuredProvider(true);
        provider.setEncryptedClientSecret(new SecretCipher("fedcba9876543210fedcba9876543210").encrypt("s3cr3t"));
        when(providerRepository.findById("google")).thenReturn(Optional.of(provider));

        ProblemException exception = assertThrows(ProblemException.class,
                () -> service.loadRegistration(OAuthProviderType.GOOGLE));

        assertThat(exception.getProblemCode()).isEqualTo(ProblemCode.OAUTH_PROVIDER_UNAVAILABLE);
    }

    @Test
    void authorizationUrlCarriesClientAndCallback() {
        when(providerRepository.findById("google")).thenReturn(Optional.of(configuredProvider(true)));

        String url = service.buildAuthorizationUrl(OAuthProviderType.GOOGLE, "state-xyz");

        assertThat(url)
                .startsWith("https://accounts.example.com/o/oauth2/auth?")
                .contains("client_id=client-123")
                .contains("redirect_uri=https://portico.example.com/auth/oauth/google/callback")
                .contains("response_type=code")
                .contains("scope=openid%20email")
                .contains("state=state-xyz")
                .doesNotContain("s3cr3t");
    }

    @Test
    void subjectLinkedToAnotherUserIsRejected() {
        UUID owner = UUID.randomUUID();
        UserOAuthLink existing = new UserOAuthLink(owner, OAuthProviderType.GITHUB, "gh-42");
        when(linkRepository.findByProviderAndProviderUserId(OAuthProviderType.GITHUB, "gh-42"))
                .thenReturn(Optional.of(existing));

        ProblemException exception = assertThrows(ProblemException.class, () -> service.linkAccount(
                UUID.randomUUID(), OAuthProviderType.GITHUB, "gh-42", "access", null, null));

        assertThat(exception.getProblemCode()).isEqualTo(ProblemCode.OAUTH_ACCOUNT_ALREADY_LINKED);
        verify(linkRepository, never()).saveAndFlush(any());
    }

    @Test
    void userAlreadyLinkedToAnotherSubjectIsRejected() {
        UUID userId = UUID.randomUUID();
        when(linkRepository.findByProviderAndProviderUserId(OAuthProviderType.GITHUB, "gh-99"))
                .thenReturn(Optional.empty());
        when(linkRepository.findByUserIdAndProvider(userId, OAuthProviderType.GITHUB))
                .thenReturn(Optional.of(new UserOAuthLink(userId, OAuthProviderType.GITHUB, "gh-42")));

        ProblemException exception = assertThrows(ProblemException.class, () -> service.linkAccount(
                userId, OAuthProviderType.GITHUB, "gh-99", "access", null, null));

        assertThat(exception.getProblemCode()).isEqualTo(ProblemCode.OAUTH_ACCOUNT_ALREADY_LINKED);
        assertThat(exception.getStatusCode().value()).isEqualTo(409);
        verify(linkRepository, never()).saveAndFlush(any());
    }

    @Test
    void linkStoresEncryptedTokens() {
        UUID userId = UUID.randomUUID();
        OffsetDateTime expiresAt = OffsetDateTime.parse("2025-01-01T01:00:00Z");
        when(linkRepository.findByProviderAndProviderUserId(OAuthProviderType.GITHUB, "gh-42")).thenReturn(Optional.empty());
        when(linkRepository.findByUserIdAndProvider(userId, OAuthProviderType.GITHUB)).thenReturn(Optional.empty());
        when(linkRepository.saveAndFlush(any(UserOAuthLink.class))).thenAnswer(invocation -> invocation.getArgument(0));

        UserOAuthLink link = service.linkAccount(userId, OAuthProviderType.GITHUB, "gh-42", "access-1", "refresh-1", expiresAt);

        assertThat(link.getEncryptedAccessToken()).doesNotContain("access-1");
        assertThat(secretCipher.decrypt(link.getEncryptedAccessToken())).isEqualTo("access-1");
        assertThat(secretCipher.decrypt(link.getEncryptedRefreshToken())).isEqualTo("refresh-1");
        assertThat(link.getExpiresAt()).isEqualTo(expiresAt);
    }

    @Test
    void unknownProviderCodeIsNotFound() {
        ProblemException exception = assertThrows(ProblemException.class, () -> OAuthProviderType.fromCode("myspace"));

        assertThat(exception.getProblemCode()).isEqualTo(ProblemCode.OAUTH_PROVIDER_NOT_FOUND);
    }

    private OAuthProvider configuredProvider(boolean enabled) {
        OAuthProvider provider = new OAuthProvider(OAuthProviderType.GOOGLE);
        provider.setEncryptedClientId(secretCipher.encrypt("client-123"));
        provider.setEncryptedClientSecret(secretCipher.encrypt("s3cr3t"));
        provider.setScopes(List.of("openid", "email"));
        provider.setAuthUrl("https://accounts.example.com/o/oauth2/auth");
        provider.setTokenUrl("https://oauth2.example.com/token");
        provider.setUserInfoUrl("https://openidconnect.example.com/v1/userinfo");
        provider.setEnabled(enabled);
        return provider;
    }
}
