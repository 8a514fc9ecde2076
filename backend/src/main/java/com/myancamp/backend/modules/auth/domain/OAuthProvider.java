package com.myancamp.backend.modules.auth.domain;

import java.util.Locale;
import java.util.Optional;

public enum OAuthProvider {
    GOOGLE,
    FACEBOOK;

    public static Optional<OAuthProvider> fromPath(String value) {
        if (value == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(valueOf(value.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException ex) {
            return Optional.empty();
        }
    }
}
