package com.myancamp.backend.modules.auth.presentation.dto;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

public record UserProfileResponse(
        UUID userId,
        String username,
        String email,
        String phone,
        List<String> roles,
        boolean isAdmin,
        boolean isOwner,
        boolean isEmailVerified,
        OffsetDateTime emailVerifiedAt,
        boolean isTwoFactorEnabled,
        List<String> linkedProviders,
        OffsetDateTime lastLoginAt,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {
}
