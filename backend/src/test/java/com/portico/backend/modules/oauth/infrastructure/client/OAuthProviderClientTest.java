package com.portico.backend.modules.oauth.infrastructure.client;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import java.util.Map;

import com.portico.backend.global.error.ProblemCode;
import com.portico.backend.global.error.ProblemException;
import com.portico.backend.modules.oauth.application.OAuthClientCredentials;
import com.portico.backend.modules.oauth.application.OAuthClientRegistration;
import com.portico.backend.modules.oauth.application.OAuthTokenGrant;
import com.portico.backend.modules.oauth.application.OAuthUserProfile;
import com.portico.backend.modules.oauth.domain.OAuthProviderType;
import com.portico.backend.support.MutableClock;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

class OAuthProviderClientTest {

    private static final String TOKEN_URL = "https://oauth2.example.com/token";
    private static final String USER_INFO_URL = "https://api.example.com/userinfo";

    private final MutableClock clock = MutableClock.at("2025-01-01T00:00:00Z");

    private MockRestServiceServer server;
    private OAuthProviderClient client;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        client = new OAuthProviderClient(builder.build(), clock);
    }

    @Test
    void exchangesCodeForTokens() {
        server.expect(requestTo(TOKEN_URL))
                .andExpect(method(HttpMethod.POST))
                .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_FORM_URLENCODED))
                .andExpect(content().formDataContains(Map.of(
                        "grant_type", "authorization_code",
                        "code", "auth-code",
                        "client_id", "client-123",
                        "redirect_uri", "https://portico.example.com/auth/oauth/google/callback")))
                .andRespond(withSuccess("""
                        {"access_token":"access-1","refresh_token":"refresh-1","expires_in":3600,"token_type":"Bearer"}
                        """, MediaType.APPLICATION_JSON));

        OAuthTokenGrant grant = client.exchangeCode(registration(OAuthProviderType.GOOGLE), "auth-code");

        assertThat(grant.accessToken()).isEqualTo("access-1");
        assertThat(grant.refreshToken()).isEqualTo("refresh-1");
        assertThat(grant.expiresAt()).isEqualTo(clock.now().plusHours(1));
        server.verify();
    }

    @Test
    void errorBodyWithSuccessStatusFailsExchange() {
        server.expect(requestTo(TOKEN_URL))
                .andRespond(withSuccess("{\"error\":\"bad_verification_code\"}", MediaType.APPLICATION_JSON));

        ProblemException exception = assertThrows(ProblemException.class,
                () -> client.exchangeCode(registration(OAuthProviderType.GITHUB), "stale-code"));

        assertThat(exception.getProblemCode()).isEqualTo(ProblemCode.OAUTH_EXCHANGE_FAILED);
        assertThat(exception.getStatusCode().value()).isEqualTo(502);
    }

    @Test
    void providerOutageFailsExchange() {
        server.expect(requestTo(TOKEN_URL)).andRespond(withServerError());

        ProblemException exception = assertThrows(ProblemException.class,
                () -> client.exchangeCode(registration(OAuthProviderType.GOOGLE), "auth-code"));

        assertThat(exception.getProblemCode()).isEqualTo(ProblemCode.OAUTH_EXCHANGE_FAILED);
    }

    @Test
    void readsOpenIdProfileWithBearerToken() {
        server.expect(requestTo(USER_INFO_URL))
                .andExpect(method(HttpMethod.GET))
                .andExpect(header(HttpHeaders.AUTHORIZATION, "Bearer access-1"))
                .andRespond(withSuccess("""
                        {"sub":"1099","email":"ada@example.com","email_verified":true,"name":"Ada Lovelace"}
                        """, MediaType.APPLICATION_JSON));

        OAuthUserProfile profile = client.fetchProfile(registration(OAuthProviderType.GOOGLE), "access-1");

        assertThat(profile).isEqualTo(new OAuthUserProfile("1099", "ada@example.com", "Ada Lovelace", true));
    }

    @Test
    void githubProfileUsesNumericIdAndLogin() {
        server.expect(requestTo(USER_INFO_URL))
                .andRespond(withSuccess("""
                        {"id":583231,"login":"octocat","name":null,"email":"octocat@example.com"}
                        """, MediaType.APPLICATION_JSON));

        OAuthUserProfile profile = client.fetchProfile(registration(OAuthProviderType.GITHUB), "access-1");

        assertThat(profile.subject()).isEqualTo("583231");
        assertThat(profile.name()).isEqualTo("octocat");
        assertThat(profile.emailVerified()).isTrue();
    }

    @Test
    void unverifiedEmailIsReportedAsSuch() {
        server.expect(requestTo(USER_INFO_URL))
                .andRespond(withSuccess("""
                        {"sub":"li-7","email":"ada@example.com","email_verified":false}
                        """, MediaType.APPLICATION_JSON));

        OAuthUserProfile profile = client.fetchProfile(registration(OAuthProviderType.LINKEDIN), "access-1");

        assertThat(profile.emailVerified()).isFalse();
    }

    @Test
    void profileWithoutSubjectFails() {
        server.expect(requestTo(USER_INFO_URL))
                .andRespond(withSuccess("{\"email\":\"ada@example.com\"}", MediaType.APPLICATION_JSON));

        ProblemException exception = assertThrows(ProblemException.class,
                () -> client.fetchProfile(registration(OAuthProviderType.GOOGLE), "access-1"));

        assertThat(exception.getProblemCode()).isEqualTo(ProblemCode.OAUTH_EXCHANGE_FAILED);
    }

    private static OAuthClientRegistration registration(OAuthProviderType type) {
        return new OAuthClientRegistration(new OAuthClientCredentials(type, "client-123", "s3cr3t"),
                TOKEN_URL, USER_INFO_URL, "https://portico.example.com/auth/oauth/" + type.code() + "/callback");
    }
}
