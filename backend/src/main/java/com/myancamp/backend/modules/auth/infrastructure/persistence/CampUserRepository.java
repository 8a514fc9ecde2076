package com.myancamp.backend.modules.auth.infrastructure.persistence;

import java.util.Optional;
import java.util.UUID;

import com.myancamp.backend.modules.auth.domain.CampUser;

import org.springframework.data.jpa.repository.JpaRepository;

public interface CampUserRepository extends JpaRepository<CampUser, UUID> {

    Optional<CampUser> findByUsername(String username);

    Optional<CampUser> findByEmailIgnoreCase(String email);

    Optional<CampUser> findByGoogleId(String googleId);

    Optional<CampUser> findByFacebookId(String facebookId);

    boolean existsByUsernameIgnoreCase(String username);

    boolean existsByEmailIgnoreCase(String email);
}
