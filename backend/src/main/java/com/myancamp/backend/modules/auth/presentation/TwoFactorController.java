package com.myancamp.backend.modules.auth.presentation;

import com.myancamp.backend.global.security.SecurityUtils;
import com.myancamp.backend.modules.auth.application.AuthService;
import com.myancamp.backend.modules.auth.presentation.dto.LoginResponse;
import com.myancamp.backend.modules.auth.presentation.dto.MessageResponse;
import com.myancamp.backend.modules.auth.presentation.dto.TwoFactorCodeRequest;
import com.myancamp.backend.modules.auth.presentation.dto.TwoFactorEnabledResponse;
import com.myancamp.backend.modules.auth.presentation.dto.TwoFactorLoginRequest;
import com.myancamp.backend.modules.auth.presentation.dto.TwoFactorSetupResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/auth/2fa")
@Tag(name = "Two-factor", description = "TOTP enrollment and login challenge")
public class TwoFactorController {

    private final AuthService authService;

    public TwoFactorController(AuthService authService) {
        this.authService = authService;
    }

    @PostMapping("/setup")
    @Operation(summary = "Generate a pending TOTP secret for the current user")
    public ResponseEntity<TwoFactorSetupResponse> setup() {
        return ResponseEntity.ok(authService.setupTwoFactor(SecurityUtils.getCurrentUserId()));
    }

    @PostMapping("/verify-setup")
    @Operation(
            summary = "Confirm the pending secret and enable two-factor authentication",
            responses = {
                    @ApiResponse(responseCode = "200", description = "Enabled; backup codes are shown once"),
                    @ApiResponse(responseCode = "400", description = "Setup not started or code rejected")
            }
    )
    public ResponseEntity<TwoFactorEnabledResponse> verifySetup(@Valid @RequestBody TwoFactorCodeRequest request,
                                                                HttpServletRequest httpRequest) {
        return ResponseEntity.ok(authService.confirmTwoFactor(
                SecurityUtils.getCurrentUserId(),
                request.code(),
                RequestMetadataResolver.from(httpRequest)
        ));
    }

    @PostMapping("/verify-login")
    @Operation(summary = "Answer a login challenge with a TOTP or backup code")
    public ResponseEntity<LoginResponse> verifyLogin(@Valid @RequestBody TwoFactorLoginRequest request,
                                                     HttpServletRequest httpRequest) {
        return ResponseEntity.ok(authService.verifyTwoFactorLogin(request, RequestMetadataResolver.from(httpRequest)));
    }

    @PostMapping("/disable")
    @Operation(summary = "Disable two-factor authentication after re-checking a TOTP code")
    public ResponseEntity<MessageResponse> disable(@Valid @RequestBody TwoFactorCodeRequest request,
                                                   HttpServletRequest httpRequest) {
        return ResponseEntity.ok(authService.disableTwoFactor(
                SecurityUtils.getCurrentUserId(),
                request.code(),
                RequestMetadataResolver.from(httpRequest)
        ));
    }
}
