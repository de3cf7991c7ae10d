package com.portico.backend.modules.auth.presentation;

import com.portico.backend.global.security.SecurityUtils;
import com.portico.backend.global.security.SessionCookieManager;
import com.portico.backend.modules.auth.application.AuthService;
import com.portico.backend.modules.auth.presentation.dto.ChangePasswordRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/account")
public class AccountController {

    private final AuthService authService;
    private final SessionCookieManager sessionCookieManager;

    public AccountController(AuthService authService, SessionCookieManager sessionCookieManager) {
        this.authService = authService;
        this.sessionCookieManager = sessionCookieManager;
    }

    @Operation(summary = "Change password", description = "Requires the current password; ends every session.")
    @ApiResponses({
            @ApiResponse(responseCode = "204", description = "Password changed"),
            @ApiResponse(responseCode = "400", description = "New password rejected"),
            @ApiResponse(responseCode = "401", description = "Current password wrong or not signed in")
    })
    @PostMapping("/password")
    public ResponseEntity<Void> changePassword(
            @Valid @RequestBody ChangePasswordRequest request,
            HttpServletRequest httpRequest,
            HttpServletResponse httpResponse
    ) {
        authService.changePassword(SecurityUtils.getCurrentUserId(), request);
        sessionCookieManager.clear(httpRequest, httpResponse);
        return ResponseEntity.noContent().build();
    }
}
