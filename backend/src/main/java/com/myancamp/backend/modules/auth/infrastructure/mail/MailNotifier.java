package com.myancamp.backend.modules.auth.infrastructure.mail;

import java.util.UUID;

import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.mail.MailException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "app.mail.enabled", havingValue = "true")
public class MailNotifier implements Notifier {

    private static final Logger log = LoggerFactory.getLogger(MailNotifier.class);
    static final String DELIVERY_ID_HEADER = "X-MyanCamp-Delivery-Id";

    private final JavaMailSender mailSender;
    private final String from;

    public MailNotifier(JavaMailSender mailSender, @Value("${app.mail.from:MyanCamp <noreply@myancamp.com>}") String from) {
        this.mailSender = mailSender;
        this.from = from;
    }

    @Override
    public String send(String to, String subject, String text, String html) {
        String deliveryId = UUID.randomUUID().toString();
        try {
            MimeMessage message = mailSender.createMimeMessage();
            MimeMessageHelper helper = new MimeMessageHelper(message, true, "UTF-8");
            helper.setFrom(from);
            helper.setTo(to);
            helper.setSubject(subject);
            helper.setText(text, html);
            message.setHeader(DELIVERY_ID_HEADER, deliveryId);
            mailSender.send(message);
        } catch (MessagingException | MailException ex) {
            throw new NotificationException("Mail delivery failed", ex);
        }
        log.info("Mail '{}' sent (delivery {})", subject, deliveryId);
        return deliveryId;
    }
}
