package com.myancamp.backend.modules.auth.infrastructure.mail;

/**
 * Outbound message channel. Implementations throw {@link NotificationException} on failure.
 */
public interface Notifier {

    /**
     * @return an id identifying the delivery attempt, for correlating with transport logs
     */
    String send(String to, String subject, String text, String html);
}
