package com.myancamp.backend.modules.auth.domain;

import java.time.Duration;

public enum SingleUseTokenKind {
    EMAIL_VERIFICATION(Duration.ofHours(24), "/verify-email"),
    PASSWORD_RESET(Duration.ofHours(1), "/reset-password");

    private final Duration ttl;
    private final String clientPath;

    SingleUseTokenKind(Duration ttl, String clientPath) {
        this.ttl = ttl;
        this.clientPath = clientPath;
    }

    public Duration getTtl() {
        return ttl;
    }

    public String getClientPath() {
        return clientPath;
    }
}
