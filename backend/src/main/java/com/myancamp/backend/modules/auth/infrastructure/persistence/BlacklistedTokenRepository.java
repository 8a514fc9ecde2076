package com.myancamp.backend.modules.auth.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.myancamp.backend.modules.auth.domain.BlacklistedToken;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface BlacklistedTokenRepository extends JpaRepository<BlacklistedToken, UUID> {

    boolean existsByTokenHash(String tokenHash);

    /**
     * Inserts the row unless the same token is already blacklisted. Returns 0 for the duplicate case.
     */
    @Modifying
    @Query(value = """
            insert into blacklisted_token
                   (id, token_hash, user_id, token_type, expires_at, reason, blacklisted_at, ip_address, user_agent)
            values (gen_random_uuid(), :tokenHash, :userId, :tokenType, :expiresAt, :reason, :blacklistedAt, :ipAddress, :userAgent)
            on conflict (token_hash) do nothing
            """, nativeQuery = true)
    int insertIfAbsent(@Param("tokenHash") String tokenHash,
                       @Param("userId") UUID userId,
                       @Param("tokenType") String tokenType,
                       @Param("expiresAt") OffsetDateTime expiresAt,
                       @Param("reason") String reason,
                       @Param("blacklistedAt") OffsetDateTime blacklistedAt,
                       @Param("ipAddress") String ipAddress,
                       @Param("userAgent") String userAgent);

    @Modifying
    @Query("delete from BlacklistedToken bt where bt.expiresAt <= :now")
    int deleteExpired(@Param("now") OffsetDateTime now);
}
