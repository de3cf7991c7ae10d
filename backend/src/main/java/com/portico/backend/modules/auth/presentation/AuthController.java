package com.portico.backend.modules.auth.presentation;

import com.portico.backend.global.security.SecurityUtils;
import com.portico.backend.global.security.SessionCookieManager;
import com.portico.backend.global.web.ClientIpResolver;
import com.portico.backend.modules.auth.application.AuthService;
import com.portico.backend.modules.auth.application.LoginResult;
import com.portico.backend.modules.auth.application.RegistrationResult;
import com.portico.backend.modules.auth.presentation.dto.EmailLinkRequest;
import com.portico.backend.modules.auth.presentation.dto.ForgotPasswordRequest;
import com.portico.backend.modules.auth.presentation.dto.LoginRequest;
import com.portico.backend.modules.auth.presentation.dto.LoginResponse;
import com.portico.backend.modules.auth.presentation.dto.RegisterRequest;
import com.portico.backend.modules.auth.presentation.dto.RegistrationResponse;
import com.portico.backend.modules.auth.presentation.dto.ResetPasswordRequest;
import com.portico.backend.modules.auth.presentation.dto.UserProfileResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import jakarta.validation.Valid;

import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/auth")
public class AuthController {

    private final AuthService authService;
    private final SessionCookieManager sessionCookieManager;

    public AuthController(AuthService authService, SessionCookieManager sessionCookieManager) {
        this.authService = authService;
        this.sessionCookieManager = sessionCookieManager;
    }

    @Operation(summary = "Register", description = "Creates an account and sends the verification email.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Account created"),
            @ApiResponse(responseCode = "400", description = "Invalid input"),
            @ApiResponse(responseCode = "409", description = "Email already registered"),
            @ApiResponse(responseCode = "429", description = "Too many requests")
    })
    @PostMapping("/register")
    public ResponseEntity<RegistrationResponse> register(
            @Valid @RequestBody RegisterRequest request,
            HttpServletRequest httpRequest
    ) {
        RegistrationResult result = authService.register(
                request, ClientIpResolver.resolve(httpRequest), httpRequest.getHeader(HttpHeaders.USER_AGENT));
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(new RegistrationResponse(UserProfileResponse.from(result.user()), result.verificationRequired()));
    }

    @Operation(summary = "Sign in", description = "Verifies credentials and sets the session cookie.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Signed in"),
            @ApiResponse(responseCode = "401", description = "Invalid credentials"),
            @ApiResponse(responseCode = "403", description = "Email not verified or account inactive"),
            @ApiResponse(responseCode = "429", description = "Too many requests")
    })
    @PostMapping("/login")
    public ResponseEntity<LoginResponse> login(
            @Valid @RequestBody LoginRequest request,
            HttpServletRequest httpRequest,
            HttpServletResponse httpResponse
    ) {
        LoginResult result = authService.login(
                request, ClientIpResolver.resolve(httpRequest), httpRequest.getHeader(HttpHeaders.USER_AGENT));
        return signedIn(result, httpRequest, httpResponse);
    }

    @Operation(summary = "Sign out", description = "Ends the current session. Succeeds without a session.")
    @PostMapping("/logout")
    public ResponseEntity<Void> logout(HttpServletRequest httpRequest, HttpServletResponse httpResponse) {
        SessionCookieManager.readSessionId(httpRequest).ifPresent(authService::logout);
        sessionCookieManager.clear(httpRequest, httpResponse);
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "Current user")
    @GetMapping("/me")
    public ResponseEntity<UserProfileResponse> me() {
        return ResponseEntity.ok(UserProfileResponse.from(
                authService.currentUser(SecurityUtils.getCurrentPrincipal().sessionId())));
    }

    @Operation(summary = "Sign out everywhere", description = "Revokes every session of the current user.")
    @PostMapping("/sessions/revoke-all")
    public ResponseEntity<Void> revokeAllSessions(HttpServletRequest httpRequest, HttpServletResponse httpResponse) {
        authService.signOutAllDevices(SecurityUtils.getCurrentUserId());
        sessionCookieManager.clear(httpRequest, httpResponse);
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "Verify email")
    @ApiResponses({
            @ApiResponse(responseCode = "204", description = "Verified"),
            @ApiResponse(responseCode = "400", description = "Unknown or expired token")
    })
    @GetMapping("/verify-email")
    public ResponseEntity<Void> verifyEmail(@RequestParam("token") String token) {
        authService.verifyEmail(token);
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "Request password reset", description = "Always accepted for a well-formed address.")
    @PostMapping("/password/forgot")
    public ResponseEntity<Void> forgotPassword(@Valid @RequestBody ForgotPasswordRequest request) {
        authService.requestPasswordReset(request.email());
        return ResponseEntity.accepted().build();
    }

    @Operation(summary = "Reset password", description = "Redeems a reset token and signs out every session.")
    @ApiResponses({
            @ApiResponse(responseCode = "204", description = "Password changed"),
            @ApiResponse(responseCode = "400", description = "Invalid input or invalid/expired token")
    })
    @PostMapping("/password/reset")
    public ResponseEntity<Void> resetPassword(@Valid @RequestBody ResetPasswordRequest request) {
        authService.resetPassword(request);
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "Request sign-in link")
    @PostMapping("/email-link")
    public ResponseEntity<Void> requestEmailLink(@Valid @RequestBody EmailLinkRequest request) {
        authService.requestEmailLink(request.email());
        return ResponseEntity.accepted().build();
    }

    @Operation(summary = "Complete sign-in link", description = "Creates the account on first use.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Signed in"),
            @ApiResponse(responseCode = "400", description = "Invalid or expired link"),
            @ApiResponse(responseCode = "403", description = "Account inactive")
    })
    @GetMapping("/email-link/callback")
    public ResponseEntity<LoginResponse> emailLinkCallback(
            @RequestParam("token") String token,
            HttpServletRequest httpRequest,
            HttpServletResponse httpResponse
    ) {
        LoginResult result = authService.loginWithEmailLink(
                token, ClientIpResolver.resolve(httpRequest), httpRequest.getHeader(HttpHeaders.USER_AGENT));
        return signedIn(result, httpRequest, httpResponse);
    }

    private ResponseEntity<LoginResponse> signedIn(LoginResult result,
                                                   HttpServletRequest httpRequest,
                                                   HttpServletResponse httpResponse) {
        sessionCookieManager.write(httpRequest, httpResponse, result.session());
        return ResponseEntity.ok(new LoginResponse(
                UserProfileResponse.from(result.user()), result.session().getExpiresAt()));
    }
}
