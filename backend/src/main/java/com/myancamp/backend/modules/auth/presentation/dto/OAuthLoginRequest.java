package com.myancamp.backend.modules.auth.presentation.dto;

import jakarta.validation.constraints.NotBlank;

public record OAuthLoginRequest(
        @NotBlank(message = "code is required") String code,
        @NotBlank(message = "redirectUri is required") String redirectUri
) {
}
