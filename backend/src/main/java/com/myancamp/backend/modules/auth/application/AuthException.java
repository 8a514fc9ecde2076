package com.myancamp.backend.modules.auth.application;

import com.myancamp.backend.global.error.ProblemException;

public class AuthException extends ProblemException {

    private final AuthErrorCode errorCode;

    public AuthException(AuthErrorCode errorCode) {
        this(errorCode, errorCode.getDefaultMessage(), null);
    }

    public AuthException(AuthErrorCode errorCode, String detail) {
        this(errorCode, detail, null);
    }

    public AuthException(AuthErrorCode errorCode, String detail, Throwable cause) {
        super(errorCode.getStatus(), errorCode.getCode(), detail, cause);
        this.errorCode = errorCode;
    }

    public AuthErrorCode getErrorCode() {
        return errorCode;
    }
}
