package com.portico.backend.modules.oauth.presentation;

import java.util.List;

import com.portico.backend.modules.oauth.application.OAuthCredentialService;
import com.portico.backend.modules.oauth.domain.OAuthProviderType;
import com.portico.backend.modules.oauth.presentation.dto.OAuthProviderResponse;
import com.portico.backend.modules.oauth.presentation.dto.UpdateOAuthProviderRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/admin/oauth/providers")
public class AdminOAuthProviderController {

    private final OAuthCredentialService oauthCredentialService;

    public AdminOAuthProviderController(OAuthCredentialService oauthCredentialService) {
        this.oauthCredentialService = oauthCredentialService;
    }

    @Operation(summary = "List providers", description = "Client secrets are never returned.")
    @GetMapping
    public ResponseEntity<List<OAuthProviderResponse>> listProviders() {
        return ResponseEntity.ok(oauthCredentialService.listProviders().stream()
                .map(OAuthProviderResponse::from)
                .toList());
    }

    @Operation(summary = "Update provider", description = "Stores client credentials encrypted.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Updated"),
            @ApiResponse(responseCode = "400", description = "Invalid configuration"),
            @ApiResponse(responseCode = "403", description = "super_admin required"),
            @ApiResponse(responseCode = "404", description = "Unknown provider")
    })
    @PutMapping("/{provider}")
    public ResponseEntity<OAuthProviderResponse> updateProvider(
            @PathVariable("provider") String provider,
            @Valid @RequestBody UpdateOAuthProviderRequest request
    ) {
        OAuthProviderType type = OAuthProviderType.fromCode(provider);
        return ResponseEntity.ok(OAuthProviderResponse.from(oauthCredentialService.updateProvider(type, request)));
    }
}
