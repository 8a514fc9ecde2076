package com.myancamp.backend.modules.auth.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

import com.myancamp.backend.modules.auth.domain.RefreshToken;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface RefreshTokenRepository extends JpaRepository<RefreshToken, UUID> {

    @Query("""
            select rt
              from RefreshToken rt
              join fetch rt.user
             where rt.tokenHash = :tokenHash
            """)
    Optional<RefreshToken> findByTokenHash(@Param("tokenHash") String tokenHash);

    /**
     * Single guard against double use: only the caller that flips {@code revoked} gets 1 back.
     */
    @Modifying
    @Query("""
            update RefreshToken rt
               set rt.revoked = true,
                   rt.revokedAt = :now,
                   rt.revokedReason = :reason
             where rt.tokenHash = :tokenHash
               and rt.revoked = false
               and rt.expiresAt > :now
            """)
    int revokeIfActive(@Param("tokenHash") String tokenHash,
                       @Param("now") OffsetDateTime now,
                       @Param("reason") String reason);

    @Modifying
    @Query("""
            update RefreshToken rt
               set rt.revoked = true,
                   rt.revokedAt = :now,
                   rt.revokedReason = :reason
             where rt.tokenHash = :tokenHash
               and rt.revoked = false
            """)
    int revokeByTokenHash(@Param("tokenHash") String tokenHash,
                          @Param("now") OffsetDateTime now,
                          @Param("reason") String reason);

    @Modifying
    @Query("""
            update RefreshToken rt
               set rt.revoked = true,
                   rt.revokedAt = :now,
                   rt.revokedReason = :reason
             where rt.user.id = :userId
               and rt.revoked = false
            """)
    int revokeAllForUser(@Param("userId") UUID userId,
                         @Param("now") OffsetDateTime now,
                         @Param("reason") String reason);
}
