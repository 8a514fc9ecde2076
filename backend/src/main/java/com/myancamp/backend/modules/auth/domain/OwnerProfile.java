package com.myancamp.backend.modules.auth.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.myancamp.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

/**
 * Campground owner record as seen by the auth module; only the status matters here.
 */
@Entity
@Table(name = "owner_profile")
public class OwnerProfile extends AbstractTimestampedEntity {

    @Id
    @Column(name = "user_id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID userId;

    @Column(name = "business_name", nullable = false, length = 150)
    private String businessName;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private OwnerStatus status;

    @Column(name = "suspended_at")
    private OffsetDateTime suspendedAt;

    @Column(name = "suspended_reason", length = 255)
    private String suspendedReason;

    protected OwnerProfile() {
    }

    public OwnerProfile(UUID userId, String businessName) {
        this.userId = userId;
        this.businessName = businessName;
        this.status = OwnerStatus.PENDING;
    }

    public UUID getUserId() {
        return userId;
    }

    public String getBusinessName() {
        return businessName;
    }

    public OwnerStatus getStatus() {
        return status;
    }

    public void setStatus(OwnerStatus status) {
        this.status = status;
    }

    public OffsetDateTime getSuspendedAt() {
        return suspendedAt;
    }

    public String getSuspendedReason() {
        return suspendedReason;
    }

    public void suspend(OffsetDateTime at, String reason) {
        this.status = OwnerStatus.SUSPENDED;
        this.suspendedAt = at;
        this.suspendedReason = reason;
    }

    public boolean isSuspended() {
        return status == OwnerStatus.SUSPENDED;
    }
}
