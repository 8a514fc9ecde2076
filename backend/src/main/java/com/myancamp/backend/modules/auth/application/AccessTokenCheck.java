package com.myancamp.backend.modules.auth.application;

/**
 * Outcome of checking a bearer token. Only {@link Outcome#AUTHENTICATED} carries claims.
 */
public record AccessTokenCheck(Outcome outcome, AccessTokenClaims claims) {

    public enum Outcome {
        AUTHENTICATED,
        INVALID,
        EXPIRED,
        REVOKED,
        STORE_UNAVAILABLE
    }

    public static AccessTokenCheck authenticated(AccessTokenClaims claims) {
        return new AccessTokenCheck(Outcome.AUTHENTICATED, claims);
    }

    public static AccessTokenCheck rejected(Outcome outcome) {
        return new AccessTokenCheck(outcome, null);
    }

    public boolean isAuthenticated() {
        return outcome == Outcome.AUTHENTICATED;
    }
}
