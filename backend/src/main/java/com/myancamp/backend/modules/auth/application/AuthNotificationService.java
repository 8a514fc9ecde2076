package com.myancamp.backend.modules.auth.application;

import com.myancamp.backend.modules.auth.domain.CampUser;
import com.myancamp.backend.modules.auth.infrastructure.mail.Notifier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.util.HtmlUtils;

/**
 * Builds the account e-mails. Delivery failures are logged and never fail the calling flow.
 */
@Service
public class AuthNotificationService {

    private static final Logger log = LoggerFactory.getLogger(AuthNotificationService.class);

    private final Notifier notifier;

    public AuthNotificationService(Notifier notifier) {
        this.notifier = notifier;
    }

    public void sendVerificationEmail(CampUser user, String verificationUrl) {
        String text = "Hello " + user.getUsername() + ",\n\n"
                + "Please verify your email address by opening the link below:\n"
                + verificationUrl + "\n\n"
                + "The link expires in 24 hours. If you did not create a MyanCamp account, ignore this email.";
        String html = "<p>Hello " + escape(user.getUsername()) + ",</p>"
                + "<p>Please verify your email address by clicking the link below:</p>"
                + "<p><a href=\"" + escape(verificationUrl) + "\">Verify email</a></p>"
                + "<p>The link expires in 24 hours. If you did not create a MyanCamp account, ignore this email.</p>";
        deliver(user, "Verify your email address", text, html);
    }

    public void sendWelcomeEmail(CampUser user) {
        String text = "Hello " + user.getUsername() + ",\n\n"
                + "Your email address is verified. Welcome to MyanCamp!";
        String html = "<p>Hello " + escape(user.getUsername()) + ",</p>"
                + "<p>Your email address is verified. Welcome to MyanCamp!</p>";
        deliver(user, "Welcome to MyanCamp!", text, html);
    }

    public void sendPasswordResetEmail(CampUser user, String resetUrl) {
        String text = "Hello " + user.getUsername() + ",\n\n"
                + "A password reset was requested for your account. Open the link below to choose a new password:\n"
                + resetUrl + "\n\n"
                + "The link expires in 1 hour. If you did not request a reset, ignore this email.";
        String html = "<p>Hello " + escape(user.getUsername()) + ",</p>"
                + "<p>A password reset was requested for your account.</p>"
                + "<p><a href=\"" + escape(resetUrl) + "\">Reset password</a></p>"
                + "<p>The link expires in 1 hour. If you did not request a reset, ignore this email.</p>";
        deliver(user, "Reset your password", text, html);
    }

    public void sendPasswordChangedEmail(CampUser user) {
        String text = "Hello " + user.getUsername() + ",\n\n"
                + "The password of your MyanCamp account was changed and all sessions were signed out. "
                + "If this was not you, contact support immediately.";
        String html = "<p>Hello " + escape(user.getUsername()) + ",</p>"
                + "<p>The password of your MyanCamp account was changed and all sessions were signed out.</p>"
                + "<p>If this was not you, contact support immediately.</p>";
        deliver(user, "Your account has been updated", text, html);
    }

    public void sendTwoFactorChangedEmail(CampUser user, boolean enabled) {
        String state = enabled ? "enabled" : "disabled";
        String text = "Hello " + user.getUsername() + ",\n\n"
                + "Two-factor authentication was " + state + " on your MyanCamp account.";
        String html = "<p>Hello " + escape(user.getUsername()) + ",</p>"
                + "<p>Two-factor authentication was " + state + " on your MyanCamp account.</p>";
        deliver(user, "Your account has been updated", text, html);
    }

    private void deliver(CampUser user, String subject, String text, String html) {
        try {
            String deliveryId = notifier.send(user.getEmail(), subject, text, html);
            log.debug("Queued '{}' for user {} (delivery {})", subject, user.getId(), deliveryId);
        } catch (RuntimeException ex) {
            log.warn("Failed to send '{}' to user {}", subject, user.getId(), ex);
        }
    }

    private static String escape(String value) {
        return value == null ? "" : HtmlUtils.htmlEscape(value);
    }
}
