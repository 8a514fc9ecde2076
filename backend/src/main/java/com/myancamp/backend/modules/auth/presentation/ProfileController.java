package com.myancamp.backend.modules.auth.presentation;

import com.myancamp.backend.global.security.SecurityUtils;
import com.myancamp.backend.modules.auth.application.AuthService;
import com.myancamp.backend.modules.auth.presentation.dto.UserProfileResponse;

import io.swagger.v3.oas.annotations.Operation;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/profile")
public class ProfileController {

    private final AuthService authService;

    public ProfileController(AuthService authService) {
        this.authService = authService;
    }

    @GetMapping("/me")
    @Operation(summary = "Security profile of the current user")
    public ResponseEntity<UserProfileResponse> getMyProfile() {
        return ResponseEntity.ok(authService.loadProfile(SecurityUtils.getCurrentUserId()));
    }
}
