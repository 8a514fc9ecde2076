package com.myancamp.backend.modules.auth.domain;

public enum OwnerStatus {
    PENDING,
    VERIFIED,
    SUSPENDED
}
