package com.myancamp.backend.modules.auth.infrastructure.oauth;

public class OAuthProviderException extends RuntimeException {

    public OAuthProviderException(String message) {
        super(message);
    }

    public OAuthProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
