package com.myancamp.backend.modules.auth.presentation.dto;

public record EmailVerificationResponse(String message, UserSummaryResponse user) {
}
