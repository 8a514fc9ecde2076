package com.myancamp.backend.modules.auth.presentation.dto;

public record TwoFactorSetupResponse(String secret, String otpauthUrl, String message) {
}
