package com.portico.backend.modules.oauth.presentation;

import java.util.List;

import com.portico.backend.global.error.ProblemCode;
import com.portico.backend.global.error.ProblemException;
import com.portico.backend.global.security.SessionCookieManager;
import com.portico.backend.global.web.ClientIpResolver;
import com.portico.backend.modules.auth.application.LoginResult;
import com.portico.backend.modules.auth.presentation.dto.LoginResponse;
import com.portico.backend.modules.auth.presentation.dto.UserProfileResponse;
import com.portico.backend.modules.oauth.application.OAuthCredentialService;
import com.portico.backend.modules.oauth.application.OAuthLoginService;
import com.portico.backend.modules.oauth.domain.OAuthProviderType;
import com.portico.backend.modules.oauth.presentation.dto.AuthorizationUrlResponse;
import com.portico.backend.modules.oauth.presentation.dto.EnabledOAuthProviderResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/auth/oauth")
public class OAuthController {

    private static final Logger log = LoggerFactory.getLogger(OAuthController.class);

    private final OAuthCredentialService oauthCredentialService;
    private final OAuthLoginService oauthLoginService;
    private final OAuthStateCookies stateCookies;
    private final SessionCookieManager sessionCookieManager;

    public OAuthController(
            OAuthCredentialService oauthCredentialService,
            OAuthLoginService oauthLoginService,
            OAuthStateCookies stateCookies,
            SessionCookieManager sessionCookieManager
    ) {
        this.oauthCredentialService = oauthCredentialService;
        this.oauthLoginService = oauthLoginService;
        this.stateCookies = stateCookies;
        this.sessionCookieManager = sessionCookieManager;
    }

    @Operation(summary = "Enabled sign-in providers")
    @GetMapping("/providers")
    public ResponseEntity<List<EnabledOAuthProviderResponse>> listEnabledProviders() {
        List<EnabledOAuthProviderResponse> response = oauthCredentialService.listEnabledProviders().stream()
                .map(provider -> new EnabledOAuthProviderResponse(provider.getType().code(), provider.getScopes()))
                .toList();
        return ResponseEntity.ok(response);
    }

    @Operation(summary = "Provider authorization URL",
            description = "Issues a fresh state value, bound to this browser by the oauth_state cookie.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "URL built"),
            @ApiResponse(responseCode = "404", description = "Unknown provider"),
            @ApiResponse(responseCode = "503", description = "Provider disabled or misconfigured")
    })
    @GetMapping("/{provider}/authorize-url")
    public ResponseEntity<AuthorizationUrlResponse> authorizationUrl(
            @PathVariable("provider") String provider,
            HttpServletRequest httpRequest,
            HttpServletResponse httpResponse
    ) {
        OAuthProviderType type = OAuthProviderType.fromCode(provider);
        String state = stateCookies.newState();
        String url = oauthCredentialService.buildAuthorizationUrl(type, state);
        stateCookies.write(httpRequest, httpResponse, state);
        return ResponseEntity.ok(new AuthorizationUrlResponse(type.code(), url));
    }

    @Operation(summary = "Complete provider sign-in",
            description = "Redeems the authorization code and sets the session cookie. Creates the account on first use.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Signed in"),
            @ApiResponse(responseCode = "400", description = "State mismatch, denied authorization or missing code"),
            @ApiResponse(responseCode = "403", description = "Account inactive or provider email not verified"),
            @ApiResponse(responseCode = "409", description = "Provider account linked elsewhere"),
            @ApiResponse(responseCode = "502", description = "Provider exchange failed"),
            @ApiResponse(responseCode = "503", description = "Provider disabled or misconfigured")
    })
    @GetMapping("/{provider}/callback")
    public ResponseEntity<LoginResponse> callback(
            @PathVariable("provider") String provider,
            @RequestParam(value = "code", required = false) String code,
            @RequestParam(value = "state", required = false) String state,
            @RequestParam(value = "error", required = false) String error,
            HttpServletRequest httpRequest,
            HttpServletResponse httpResponse
    ) {
        OAuthProviderType type = OAuthProviderType.fromCode(provider);
        boolean stateMatches = stateCookies.matches(httpRequest, state);
        stateCookies.clear(httpRequest, httpResponse);
        if (!stateMatches) {
            log.warn("OAuth callback with unmatched state provider={}", type.code());
            throw new ProblemException(ProblemCode.OAUTH_STATE_MISMATCH);
        }
        if (StringUtils.hasText(error)) {
            log.info("OAuth authorization denied provider={} error={}", type.code(), error);
            throw new ProblemException(ProblemCode.OAUTH_AUTHORIZATION_DENIED);
        }

        LoginResult result = oauthLoginService.login(type, code,
                ClientIpResolver.resolve(httpRequest), httpRequest.getHeader(HttpHeaders.USER_AGENT));
        sessionCookieManager.write(httpRequest, httpResponse, result.session());
        return ResponseEntity.ok(new LoginResponse(
                UserProfileResponse.from(result.user()), result.session().getExpiresAt()));
    }
}
