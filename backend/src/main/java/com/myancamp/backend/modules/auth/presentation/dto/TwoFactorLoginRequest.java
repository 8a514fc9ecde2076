package com.myancamp.backend.modules.auth.presentation.dto;

import jakarta.validation.constraints.NotBlank;

public record TwoFactorLoginRequest(
        @NotBlank(message = "twoFactorToken is required") String twoFactorToken,
        @NotBlank(message = "code is required") String code,
        boolean useBackupCode
) {
}
