package com.myancamp.backend.modules.auth.presentation.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Either a full token pair, or a two-factor challenge carrying only the short-lived
 * {@code twoFactorToken}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record LoginResponse(
        boolean requiresTwoFactor,
        String message,
        TokenPairResponse tokens,
        String twoFactorToken,
        Long twoFactorExpiresIn,
        UserSummaryResponse user,
        Long remainingBackupCodes
) {

    public static LoginResponse authenticated(TokenPairResponse tokens, UserSummaryResponse user) {
        return new LoginResponse(false, null, tokens, null, null, user, null);
    }

    public static LoginResponse authenticated(TokenPairResponse tokens, UserSummaryResponse user, Long remainingBackupCodes) {
        return new LoginResponse(false, null, tokens, null, null, user, remainingBackupCodes);
    }

    public static LoginResponse twoFactorChallenge(String twoFactorToken, long expiresIn, UserSummaryResponse user) {
        return new LoginResponse(true, "Two-factor authentication required", null, twoFactorToken, expiresIn, user, null);
    }
}
