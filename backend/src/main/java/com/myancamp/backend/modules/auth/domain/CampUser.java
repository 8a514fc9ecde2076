package com.myancamp.backend.modules.auth.domain;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import com.myancamp.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.OrderBy;
import jakarta.persistence.Table;
import jakarta.persistence.Version;

import org.hibernate.annotations.UuidGenerator;

/**
 * Security view of a MyanCamp account. Booking, review and profile data live elsewhere.
 */
@Entity
@Table(name = "app_user")
public class CampUser extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Version
    @Column(name = "version", nullable = false)
    private long version;

    @Column(name = "username", nullable = false, unique = true, length = 50)
    private String username;

    @Column(name = "email", nullable = false, unique = true, length = 320)
    private String email;

    @Column(name = "phone", length = 32)
    private String phone;

    @Column(name = "password_hash", nullable = false, length = 255)
    private String passwordHash;

    /**
     * False for accounts created through an OAuth provider whose password hash is a random
     * placeholder nobody knows.
     */
    @Column(name = "local_password", nullable = false)
    private boolean localPassword;

    @Column(name = "is_admin", nullable = false)
    private boolean admin;

    @Column(name = "is_owner", nullable = false)
    private boolean owner;

    @Column(name = "email_verified", nullable = false)
    private boolean emailVerified;

    @Column(name = "email_verified_at")
    private OffsetDateTime emailVerifiedAt;

    @Column(name = "suspended", nullable = false)
    private boolean suspended;

    @Column(name = "suspended_reason", length = 255)
    private String suspendedReason;

    @Column(name = "two_factor_enabled", nullable = false)
    private boolean twoFactorEnabled;

    @Column(name = "two_factor_secret", length = 64)
    private String twoFactorSecret;

    @Column(name = "google_id", unique = true, length = 128)
    private String googleId;

    @Column(name = "facebook_id", unique = true, length = 128)
    private String facebookId;

    @Column(name = "last_login_at")
    private OffsetDateTime lastLoginAt;

    @Column(name = "last_login_ip", length = 64)
    private String lastLoginIp;

    @ElementCollection(fetch = FetchType.LAZY)
    @CollectionTable(name = "password_history", joinColumns = @JoinColumn(name = "user_id"))
    @OrderBy("changedAt ASC")
    private List<PasswordChangeEvent> passwordHistory = new ArrayList<>();

    public UUID getId() {
        return id;
    }

    public String getUsername() {
        return username;
    }

    public void setUsername(String username) {
        this.username = username;
    }

    public String getEmail() {
        return email;
    }

    public void setEmail(String email) {
        this.email = email;
    }

    public String getPhone() {
        return phone;
    }

    public void setPhone(String phone) {
        this.phone = phone;
    }

    public String getPasswordHash() {
        return passwordHash;
    }

    public void setPasswordHash(String passwordHash) {
        this.passwordHash = passwordHash;
    }

    public boolean hasLocalPassword() {
        return localPassword;
    }

    public void setLocalPassword(boolean localPassword) {
        this.localPassword = localPassword;
    }

    public boolean isAdmin() {
        return admin;
    }

    public void setAdmin(boolean admin) {
        this.admin = admin;
    }

    public boolean isOwner() {
        return owner;
    }

    public void setOwner(boolean owner) {
        this.owner = owner;
    }

    public boolean isEmailVerified() {
        return emailVerified;
    }

    public OffsetDateTime getEmailVerifiedAt() {
        return emailVerifiedAt;
    }

    public void markEmailVerified(OffsetDateTime verifiedAt) {
        if (!emailVerified) {
            this.emailVerified = true;
            this.emailVerifiedAt = verifiedAt;
        }
    }

    public boolean isSuspended() {
        return suspended;
    }

    public String getSuspendedReason() {
        return suspendedReason;
    }

    public void suspend(String reason) {
        this.suspended = true;
        this.suspendedReason = reason;
    }

    public void reinstate() {
        this.suspended = false;
        this.suspendedReason = null;
    }

    public boolean isTwoFactorEnabled() {
        return twoFactorEnabled;
    }

    public String getTwoFactorSecret() {
        return twoFactorSecret;
    }

    public void beginTwoFactorSetup(String pendingSecret) {
        this.twoFactorSecret = pendingSecret;
        this.twoFactorEnabled = false;
    }

    public void enableTwoFactor() {
        this.twoFactorEnabled = true;
    }

    public void clearTwoFactor() {
        this.twoFactorEnabled = false;
        this.twoFactorSecret = null;
    }

    public String getProviderId(OAuthProvider provider) {
        return switch (provider) {
            case GOOGLE -> googleId;
            case FACEBOOK -> facebookId;
        };
    }

    public void linkProvider(OAuthProvider provider, String subjectId) {
        switch (provider) {
            case GOOGLE -> this.googleId = subjectId;
            case FACEBOOK -> this.facebookId = subjectId;
        }
    }

    public OffsetDateTime getLastLoginAt() {
        return lastLoginAt;
    }

    public String getLastLoginIp() {
        return lastLoginIp;
    }

    public void recordLogin(OffsetDateTime at, String ipAddress) {
        this.lastLoginAt = at;
        this.lastLoginIp = ipAddress;
    }

    public List<PasswordChangeEvent> getPasswordHistory() {
        return passwordHistory;
    }

    public void recordPasswordChange(PasswordChangeEvent event) {
        passwordHistory.add(event);
    }
}
