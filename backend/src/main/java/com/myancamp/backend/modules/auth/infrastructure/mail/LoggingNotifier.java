package com.myancamp.backend.modules.auth.infrastructure.mail;

import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Used when outbound mail is disabled (local development, tests). Only the subject and
 * recipient are logged since bodies carry live tokens.
 */
@Component
@ConditionalOnProperty(name = "app.mail.enabled", havingValue = "false", matchIfMissing = true)
public class LoggingNotifier implements Notifier {

    private static final Logger log = LoggerFactory.getLogger(LoggingNotifier.class);

    @Override
    public String send(String to, String subject, String text, String html) {
        String deliveryId = UUID.randomUUID().toString();
        log.info("Mail delivery disabled; dropping '{}' for {} (delivery {})", subject, to, deliveryId);
        return deliveryId;
    }
}
