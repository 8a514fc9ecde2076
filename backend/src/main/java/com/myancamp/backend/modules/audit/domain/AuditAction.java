package com.myancamp.backend.modules.audit.domain;

public enum AuditAction {
    USER_REGISTERED,
    LOGIN_SUCCEEDED,
    LOGIN_FAILED,
    LOGOUT,
    LOGOUT_ALL,
    REFRESH_TOKEN_REPLAY,
    EMAIL_VERIFIED,
    PASSWORD_RESET_REQUESTED,
    PASSWORD_RESET,
    TWO_FACTOR_ENABLED,
    TWO_FACTOR_DISABLED,
    TWO_FACTOR_BACKUP_CODE_USED,
    OAUTH_ACCOUNT_CREATED,
    OAUTH_ACCOUNT_LINKED,
    OAUTH_CONFLICT
}
