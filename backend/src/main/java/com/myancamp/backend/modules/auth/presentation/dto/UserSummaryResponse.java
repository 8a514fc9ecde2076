package com.myancamp.backend.modules.auth.presentation.dto;

import java.util.UUID;

import com.myancamp.backend.modules.auth.domain.CampUser;

public record UserSummaryResponse(
        UUID userId,
        String username,
        String email,
        String phone,
        boolean isAdmin,
        boolean isOwner,
        boolean isEmailVerified,
        boolean isTwoFactorEnabled
) {

    public static UserSummaryResponse from(CampUser user) {
        return new UserSummaryResponse(
                user.getId(),
                user.getUsername(),
                user.getEmail(),
                user.getPhone(),
                user.isAdmin(),
                user.isOwner(),
                user.isEmailVerified(),
                user.isTwoFactorEnabled()
        );
    }
}
