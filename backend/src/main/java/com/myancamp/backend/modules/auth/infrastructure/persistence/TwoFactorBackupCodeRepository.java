package com.myancamp.backend.modules.auth.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

import com.myancamp.backend.modules.auth.domain.TwoFactorBackupCode;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface TwoFactorBackupCodeRepository extends JpaRepository<TwoFactorBackupCode, UUID> {

    Optional<TwoFactorBackupCode> findFirstByUserIdAndCodeHashAndUsedFalse(UUID userId, String codeHash);

    long countByUserIdAndUsedFalse(UUID userId);

    @Modifying
    @Query("""
            update TwoFactorBackupCode bc
               set bc.used = true,
                   bc.usedAt = :now
             where bc.id = :id
               and bc.used = false
            """)
    int markUsedIfUnused(@Param("id") UUID id, @Param("now") OffsetDateTime now);

    @Modifying
    @Query("delete from TwoFactorBackupCode bc where bc.user.id = :userId")
    int deleteAllForUser(@Param("userId") UUID userId);
}
