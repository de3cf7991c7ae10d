package com.portico.backend.modules.oauth.infrastructure.client;

import java.time.Clock;
import java.time.OffsetDateTime;

import com.fasterxml.jackson.databind.JsonNode;
import com.portico.backend.global.error.ProblemCode;
import com.portico.backend.global.error.ProblemException;
import com.portico.backend.modules.oauth.application.OAuthClientRegistration;
import com.portico.backend.modules.oauth.application.OAuthTokenGrant;
import com.portico.backend.modules.oauth.application.OAuthUserProfile;
import com.portico.backend.modules.oauth.domain.OAuthProviderType;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * Authorization-code exchange and user info lookup against a provider's HTTP endpoints.
 *
 * <p>Every provider-side failure, including a 200 response without an access token, surfaces
 * as {@code OAUTH_EXCHANGE_FAILED}. Provider response bodies are not logged.
 */
@Component
public class OAuthProviderClient {

    private static final Logger log = LoggerFactory.getLogger(OAuthProviderClient.class);

    private final RestClient restClient;
    private final Clock clock;

    public OAuthProviderClient(RestClient oauthRestClient, Clock clock) {
        this.restClient = oauthRestClient;
        this.clock = clock;
    }

    public OAuthTokenGrant exchangeCode(OAuthClientRegistration registration, String code) {
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("grant_type", "authorization_code");
        form.add("code", code);
        form.add("redirect_uri", registration.redirectUri());
        form.add("client_id", registration.credentials().clientId());
        form.add("client_secret", registration.credentials().clientSecret());

        JsonNode body;
        try {
            body = restClient.post()
                    .uri(registration.tokenUrl())
                    .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                    .accept(MediaType.APPLICATION_JSON)
                    .body(form)
                    .retrieve()
                    .body(JsonNode.class);
        } catch (RestClientException ex) {
            log.warn("Token exchange failed provider={} reason={}", registration.provider().code(), ex.getMessage());
            throw new ProblemException(ProblemCode.OAUTH_EXCHANGE_FAILED, null, null, ex);
        }

        String accessToken = text(body, "access_token");
        if (accessToken == null) {
            log.warn("Token exchange rejected provider={} error={}",
                    registration.provider().code(), text(body, "error"));
            throw new ProblemException(ProblemCode.OAUTH_EXCHANGE_FAILED);
        }
        OffsetDateTime expiresAt = null;
        if (body.hasNonNull("expires_in") && body.get("expires_in").asLong() > 0) {
            expiresAt = OffsetDateTime.now(clock).plusSeconds(body.get("expires_in").asLong());
        }
        return new OAuthTokenGrant(accessToken, text(body, "refresh_token"), expiresAt);
    }

    public OAuthUserProfile fetchProfile(OAuthClientRegistration registration, String accessToken) {
        JsonNode body;
        try {
            body = restClient.get()
                    .uri(registration.userInfoUrl())
                    .headers(headers -> headers.setBearerAuth(accessToken))
                    .accept(MediaType.APPLICATION_JSON)
                    .retrieve()
                    .body(JsonNode.class);
        } catch (RestClientException ex) {
            log.warn("User info lookup failed provider={} reason={}", registration.provider().code(), ex.getMessage());
            throw new ProblemException(ProblemCode.OAUTH_EXCHANGE_FAILED, null, null, ex);
        }

        String subject = text(body, "sub");
        if (subject == null) {
            subject = text(body, "id");
        }
        if (subject == null) {
            log.warn("User info without subject provider={}", registration.provider().code());
            throw new ProblemException(ProblemCode.OAUTH_EXCHANGE_FAILED);
        }
        String email = text(body, "email");
        String name = text(body, "name");
        if (name == null) {
            name = text(body, "login");
        }
        return new OAuthUserProfile(subject, email, name, emailVerified(registration.provider(), body, email));
    }

    // GitHub only exposes a public email after the owner has verified it.
    private static boolean emailVerified(OAuthProviderType provider, JsonNode body, String email) {
        if (email == null) {
            return false;
        }
        if (provider == OAuthProviderType.GITHUB) {
            return true;
        }
        return body.path("email_verified").asBoolean(false) || body.path("verified_email").asBoolean(false);
    }

    private static String text(JsonNode body, String field) {
        if (body == null) {
            return null;
        }
        JsonNode value = body.get(field);
        if (value == null || value.isNull() || value.isContainerNode() || value.asText().isBlank()) {
            return null;
        }
        return value.asText();
    }
}
