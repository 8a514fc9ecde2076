package com.myancamp.backend.modules.auth.infrastructure.persistence;

import java.util.UUID;

import com.myancamp.backend.modules.auth.domain.OwnerProfile;

import org.springframework.data.jpa.repository.JpaRepository;

public interface OwnerProfileRepository extends JpaRepository<OwnerProfile, UUID> {
}
