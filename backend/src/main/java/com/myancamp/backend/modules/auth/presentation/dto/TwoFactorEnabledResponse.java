package com.myancamp.backend.modules.auth.presentation.dto;

import java.util.List;

/**
 * Backup codes appear here once and are not retrievable afterwards.
 */
public record TwoFactorEnabledResponse(String message, List<String> backupCodes) {
}
