package com.myancamp.backend.modules.auth.application;

import java.util.regex.Pattern;

import org.springframework.stereotype.Component;

@Component
public class PasswordPolicy {

    static final int MIN_LENGTH = 8;

    private static final Pattern UPPER = Pattern.compile("[A-Z]");
    private static final Pattern LOWER = Pattern.compile("[a-z]");
    private static final Pattern DIGIT = Pattern.compile("\\d");
    private static final Pattern SPECIAL = Pattern.compile("[!@#$%^&*(),.?\":{}|<>]");

    public void validate(String password) {
        if (password == null || password.length() < MIN_LENGTH) {
            throw invalid("Password must be at least " + MIN_LENGTH + " characters long");
        }
        if (!UPPER.matcher(password).find()) {
            throw invalid("Password must contain at least one uppercase letter");
        }
        if (!LOWER.matcher(password).find()) {
            throw invalid("Password must contain at least one lowercase letter");
        }
        if (!DIGIT.matcher(password).find()) {
            throw invalid("Password must contain at least one number");
        }
        if (!SPECIAL.matcher(password).find()) {
            throw invalid("Password must contain at least one special character");
        }
    }

    private AuthException invalid(String message) {
        return new AuthException(AuthErrorCode.VALIDATION_ERROR, message);
    }
}
