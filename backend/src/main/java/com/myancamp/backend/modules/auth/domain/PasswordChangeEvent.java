package com.myancamp.backend.modules.auth.domain;

import java.time.OffsetDateTime;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;

@Embeddable
public class PasswordChangeEvent {

    public static final String REASON_RESET = "reset";
    public static final String REASON_CHANGE = "change";

    @Column(name = "changed_at", nullable = false)
    private OffsetDateTime changedAt;

    @Column(name = "reason", nullable = false, length = 32)
    private String reason;

    @Column(name = "ip_address", length = 64)
    private String ipAddress;

    @Column(name = "user_agent", length = 512)
    private String userAgent;

    protected PasswordChangeEvent() {
    }

    public PasswordChangeEvent(OffsetDateTime changedAt, String reason, String ipAddress, String userAgent) {
        this.changedAt = changedAt;
        this.reason = reason;
        this.ipAddress = ipAddress;
        this.userAgent = userAgent;
    }

    public OffsetDateTime getChangedAt() {
        return changedAt;
    }

    public String getReason() {
        return reason;
    }

    public String getIpAddress() {
        return ipAddress;
    }

    public String getUserAgent() {
        return userAgent;
    }
}
