package com.myancamp.backend.modules.auth.domain;

public enum BlacklistReason {
    LOGOUT,
    LOGOUT_ALL,
    SECURITY_CONCERN,
    TOKEN_REFRESH,
    TWO_FACTOR_COMPLETED,
    USER_REQUEST,
    ADMIN_ACTION
}
