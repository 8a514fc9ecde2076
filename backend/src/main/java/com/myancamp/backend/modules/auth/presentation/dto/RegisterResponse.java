package com.myancamp.backend.modules.auth.presentation.dto;

public record RegisterResponse(UserSummaryResponse user, String message) {
}
