package com.myancamp.backend.global.security;

import java.util.List;
import java.util.UUID;

public record JwtAuthenticationPrincipal(UUID userId, String username, String email, List<String> roles) {
}
