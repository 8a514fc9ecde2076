package com.myancamp.backend.modules.auth.application;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

public record AccessTokenClaims(
        UUID userId,
        String username,
        String email,
        boolean admin,
        boolean owner,
        String tokenType,
        OffsetDateTime issuedAt,
        OffsetDateTime expiresAt
) {

    public List<String> roles() {
        List<String> roles = new ArrayList<>();
        roles.add("USER");
        if (owner) {
            roles.add("OWNER");
        }
        if (admin) {
            roles.add("ADMIN");
        }
        return List.copyOf(roles);
    }
}
