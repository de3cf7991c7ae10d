package com.portico.backend.modules.auth.presentation;

import java.util.UUID;

import com.portico.backend.global.error.AuthException;
import com.portico.backend.global.security.SecurityUtils;
import com.portico.backend.modules.auth.application.UserAdministrationService;
import com.portico.backend.modules.auth.domain.UserRole;
import com.portico.backend.modules.auth.domain.UserStatus;
import com.portico.backend.modules.auth.presentation.dto.UpdateUserRoleRequest;
import com.portico.backend.modules.auth.presentation.dto.UpdateUserStatusRequest;
import com.portico.backend.modules.auth.presentation.dto.UserProfileResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/admin/users")
public class AdminUserController {

    private final UserAdministrationService userAdministrationService;

    public AdminUserController(UserAdministrationService userAdministrationService) {
        this.userAdministrationService = userAdministrationService;
    }

    @Operation(summary = "Change account status", description = "Suspending or banning ends every session of the user.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Updated"),
            @ApiResponse(responseCode = "403", description = "Target outranks the caller"),
            @ApiResponse(responseCode = "404", description = "No such user")
    })
    @PatchMapping("/{userId}/status")
    public ResponseEntity<UserProfileResponse> updateStatus(
            @PathVariable("userId") UUID userId,
            @Valid @RequestBody UpdateUserStatusRequest request
    ) {
        UserStatus status;
        try {
            status = UserStatus.fromCode(request.status());
        } catch (IllegalArgumentException ex) {
            throw AuthException.validation("status", ex.getMessage());
        }
        return ResponseEntity.ok(UserProfileResponse.from(
                userAdministrationService.changeStatus(SecurityUtils.getCurrentUserId(), userId, status)));
    }

    @Operation(summary = "Change role")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Updated"),
            @ApiResponse(responseCode = "403", description = "Role outside the caller's authority"),
            @ApiResponse(responseCode = "404", description = "No such user")
    })
    @PatchMapping("/{userId}/role")
    public ResponseEntity<UserProfileResponse> updateRole(
            @PathVariable("userId") UUID userId,
            @Valid @RequestBody UpdateUserRoleRequest request
    ) {
        UserRole role;
        try {
            role = UserRole.fromCode(request.role());
        } catch (IllegalArgumentException ex) {
            throw AuthException.validation("role", ex.getMessage());
        }
        return ResponseEntity.ok(UserProfileResponse.from(
                userAdministrationService.changeRole(SecurityUtils.getCurrentUserId(), userId, role)));
    }
}
