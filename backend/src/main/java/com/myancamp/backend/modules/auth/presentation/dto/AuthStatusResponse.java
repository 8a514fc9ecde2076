package com.myancamp.backend.modules.auth.presentation.dto;

public record AuthStatusResponse(
        boolean isAuthenticated,
        UserSummaryResponse user,
        boolean emailVerified,
        boolean requiresTwoFactor
) {

    public static AuthStatusResponse anonymous() {
        return new AuthStatusResponse(false, null, false, false);
    }
}
