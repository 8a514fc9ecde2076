package com.myancamp.backend.modules.auth.application;

import org.springframework.http.HttpStatus;

public enum AuthErrorCode {
    INVALID_CREDENTIALS(HttpStatus.UNAUTHORIZED, "invalid_credentials", "Username or password is incorrect"),
    ACCOUNT_NOT_VERIFIED(HttpStatus.FORBIDDEN, "account_not_verified", "Please verify your email address"),
    ACCOUNT_SUSPENDED(HttpStatus.FORBIDDEN, "account_suspended", "This account has been suspended"),
    TOKEN_INVALID(HttpStatus.UNAUTHORIZED, "token_invalid", "Token is invalid"),
    TOKEN_EXPIRED(HttpStatus.UNAUTHORIZED, "token_expired", "Token has expired"),
    TOKEN_ALREADY_USED(HttpStatus.CONFLICT, "token_already_used", "Token has already been used"),
    TWO_FACTOR_REQUIRED(HttpStatus.UNAUTHORIZED, "two_factor_required", "Two-factor authentication required"),
    TWO_FACTOR_INVALID_CODE(HttpStatus.BAD_REQUEST, "two_factor_invalid_code", "Invalid verification code"),
    OAUTH_CONFLICT(HttpStatus.CONFLICT, "oauth_conflict",
            "An account with this email already exists. Log in with your password to link it"),
    VALIDATION_ERROR(HttpStatus.BAD_REQUEST, "validation_error", "Request validation failed"),
    UNAUTHENTICATED(HttpStatus.UNAUTHORIZED, "unauthenticated", "Authentication required"),
    OAUTH_PROVIDER_ERROR(HttpStatus.BAD_GATEWAY, "oauth_provider_error", "Identity provider request failed"),
    USER_NOT_FOUND(HttpStatus.NOT_FOUND, "user_not_found", "User not found");

    private final HttpStatus status;
    private final String code;
    private final String defaultMessage;

    AuthErrorCode(HttpStatus status, String code, String defaultMessage) {
        this.status = status;
        this.code = code;
        this.defaultMessage = defaultMessage;
    }

    public HttpStatus getStatus() {
        return status;
    }

    public String getCode() {
        return code;
    }

    public String getDefaultMessage() {
        return defaultMessage;
    }
}
