package com.myancamp.backend.global.security;

import java.util.Optional;
import java.util.UUID;

import com.myancamp.backend.modules.auth.application.AuthErrorCode;
import com.myancamp.backend.modules.auth.application.AuthException;

import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

public final class SecurityUtils {

    private SecurityUtils() {
    }

    public static Optional<JwtAuthenticationPrincipal> findCurrentPrincipal() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication == null || !(authentication.getPrincipal() instanceof JwtAuthenticationPrincipal principal)) {
            return Optional.empty();
        }
        return Optional.of(principal);
    }

    public static JwtAuthenticationPrincipal getCurrentPrincipal() {
        return findCurrentPrincipal().orElseThrow(() -> new AuthException(AuthErrorCode.UNAUTHENTICATED));
    }

    public static UUID getCurrentUserId() {
        return getCurrentPrincipal().userId();
    }

    /**
     * The raw bearer token the current request was authenticated with.
     */
    public static Optional<String> getCurrentAccessToken() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication == null || !(authentication.getCredentials() instanceof String token)) {
            return Optional.empty();
        }
        return Optional.of(token);
    }

    public static boolean hasRole(String roleCode) {
        return findCurrentPrincipal().map(principal -> principal.roles().contains(roleCode)).orElse(false);
    }
}
