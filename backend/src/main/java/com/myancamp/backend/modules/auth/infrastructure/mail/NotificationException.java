package com.myancamp.backend.modules.auth.infrastructure.mail;

public class NotificationException extends RuntimeException {

    public NotificationException(String message, Throwable cause) {
        super(message, cause);
    }
}
