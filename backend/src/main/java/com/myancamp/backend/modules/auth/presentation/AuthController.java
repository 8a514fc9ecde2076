package com.myancamp.backend.modules.auth.presentation;

import java.util.Optional;

import com.myancamp.backend.global.security.JwtAuthenticationFilter;
import com.myancamp.backend.global.security.JwtAuthenticationPrincipal;
import com.myancamp.backend.global.security.SecurityUtils;
import com.myancamp.backend.modules.auth.application.AuthService;
import com.myancamp.backend.modules.auth.presentation.dto.AuthStatusResponse;
import com.myancamp.backend.modules.auth.presentation.dto.EmailVerificationResponse;
import com.myancamp.backend.modules.auth.presentation.dto.ForgotPasswordRequest;
import com.myancamp.backend.modules.auth.presentation.dto.LoginRequest;
import com.myancamp.backend.modules.auth.presentation.dto.LoginResponse;
import com.myancamp.backend.modules.auth.presentation.dto.LogoutRequest;
import com.myancamp.backend.modules.auth.presentation.dto.MessageResponse;
import com.myancamp.backend.modules.auth.presentation.dto.OAuthLoginRequest;
import com.myancamp.backend.modules.auth.presentation.dto.RefreshRequest;
import com.myancamp.backend.modules.auth.presentation.dto.RegisterRequest;
import com.myancamp.backend.modules.auth.presentation.dto.RegisterResponse;
import com.myancamp.backend.modules.auth.presentation.dto.ResetPasswordRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/auth")
@Tag(name = "Auth", description = "Registration, login and credential lifecycle")
public class AuthController {

    private final AuthService authService;

    public AuthController(AuthService authService) {
        this.authService = authService;
    }

    @PostMapping("/register")
    @Operation(
            summary = "Register a local account",
            responses = {
                    @ApiResponse(responseCode = "201", description = "Account created, verification email sent"),
                    @ApiResponse(responseCode = "400", description = "Weak password or duplicate username/email")
            }
    )
    public ResponseEntity<RegisterResponse> register(@Valid @RequestBody RegisterRequest request,
                                                     HttpServletRequest httpRequest) {
        RegisterResponse response = authService.register(request, RequestMetadataResolver.from(httpRequest));
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @PostMapping("/login")
    @Operation(
            summary = "Log in with username and password",
            description = "Returns a token pair, or a short-lived challenge token when two-factor authentication is enabled.",
            responses = {
                    @ApiResponse(responseCode = "200", description = "Authenticated or two-factor challenge issued"),
                    @ApiResponse(responseCode = "401", description = "Invalid credentials"),
                    @ApiResponse(responseCode = "403", description = "Email not verified or account suspended")
            }
    )
    public ResponseEntity<LoginResponse> login(@Valid @RequestBody LoginRequest request, HttpServletRequest httpRequest) {
        return ResponseEntity.ok(authService.login(request, RequestMetadataResolver.from(httpRequest)));
    }

    @PostMapping("/refresh")
    @Operation(summary = "Rotate a refresh token into a new token pair")
    public ResponseEntity<LoginResponse> refresh(@Valid @RequestBody RefreshRequest request, HttpServletRequest httpRequest) {
        return ResponseEntity.ok(authService.refresh(request, RequestMetadataResolver.from(httpRequest)));
    }

    @PostMapping("/logout")
    @Operation(summary = "Revoke a refresh token and blacklist the presented access token")
    public ResponseEntity<MessageResponse> logout(@Valid @RequestBody LogoutRequest request, HttpServletRequest httpRequest) {
        String bearerToken = JwtAuthenticationFilter.resolveBearerToken(httpRequest);
        return ResponseEntity.ok(authService.logout(request, bearerToken, RequestMetadataResolver.from(httpRequest)));
    }

    @PostMapping("/logout-all")
    @Operation(summary = "Revoke every refresh token of the current user")
    public ResponseEntity<MessageResponse> logoutAll(HttpServletRequest httpRequest) {
        return ResponseEntity.ok(authService.logoutAll(
                SecurityUtils.getCurrentUserId(),
                SecurityUtils.getCurrentAccessToken().orElse(null),
                RequestMetadataResolver.from(httpRequest)
        ));
    }

    @GetMapping("/verify-email")
    @Operation(summary = "Consume an email verification token")
    public ResponseEntity<EmailVerificationResponse> verifyEmail(
            @Parameter(description = "Token from the verification link") @RequestParam("token") String token,
            HttpServletRequest httpRequest) {
        return ResponseEntity.ok(authService.verifyEmail(token, RequestMetadataResolver.from(httpRequest)));
    }

    @PostMapping("/resend-verification")
    @Operation(summary = "Send a fresh verification email to the current user")
    public ResponseEntity<MessageResponse> resendVerification(HttpServletRequest httpRequest) {
        return ResponseEntity.ok(authService.resendVerification(
                SecurityUtils.getCurrentUserId(),
                RequestMetadataResolver.from(httpRequest)
        ));
    }

    @PostMapping("/forgot-password")
    @Operation(
            summary = "Request a password reset link",
            description = "Always answers with the same message whether or not the email is registered."
    )
    public ResponseEntity<MessageResponse> forgotPassword(@Valid @RequestBody ForgotPasswordRequest request,
                                                          HttpServletRequest httpRequest) {
        return ResponseEntity.ok(authService.requestPasswordReset(request, RequestMetadataResolver.from(httpRequest)));
    }

    @PostMapping("/reset-password")
    @Operation(summary = "Set a new password with a reset token; signs the user out everywhere")
    public ResponseEntity<MessageResponse> resetPassword(@Valid @RequestBody ResetPasswordRequest request,
                                                         HttpServletRequest httpRequest) {
        return ResponseEntity.ok(authService.resetPassword(request, RequestMetadataResolver.from(httpRequest)));
    }

    @PostMapping("/oauth/{provider}")
    @Operation(
            summary = "Exchange an OAuth authorization code for a session",
            responses = {
                    @ApiResponse(responseCode = "200", description = "Authenticated or two-factor challenge issued"),
                    @ApiResponse(responseCode = "409", description = "Email belongs to an account with a local password"),
                    @ApiResponse(responseCode = "502", description = "Provider exchange failed")
            }
    )
    public ResponseEntity<LoginResponse> oauthLogin(
            @Parameter(description = "google or facebook") @PathVariable("provider") String provider,
            @Valid @RequestBody OAuthLoginRequest request,
            HttpServletRequest httpRequest) {
        return ResponseEntity.ok(authService.oauthLogin(provider, request, RequestMetadataResolver.from(httpRequest)));
    }

    @GetMapping("/status")
    @Operation(summary = "Report whether the caller carries a valid access token")
    public ResponseEntity<AuthStatusResponse> status() {
        Optional<JwtAuthenticationPrincipal> principal = SecurityUtils.findCurrentPrincipal();
        return ResponseEntity.ok(authService.authStatus(principal.map(JwtAuthenticationPrincipal::userId)));
    }
}
