package com.myancamp.backend.modules.auth.presentation.dto;

public record MessageResponse(String message) {
}
