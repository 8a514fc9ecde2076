package com.myancamp.backend.modules.auth.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

import com.myancamp.backend.modules.auth.domain.SingleUseToken;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.NoRepositoryBean;
import org.springframework.data.repository.query.Param;

@NoRepositoryBean
public interface SingleUseTokenRepository<T extends SingleUseToken> extends JpaRepository<T, UUID> {

    @Query("select t from #{#entityName} t join fetch t.user where t.tokenHash = :tokenHash")
    Optional<T> findByTokenHash(@Param("tokenHash") String tokenHash);

    @Modifying
    @Query("""
            update #{#entityName} t
               set t.used = true,
                   t.usedAt = :now
             where t.user.id = :userId
               and t.used = false
            """)
    int invalidateOutstanding(@Param("userId") UUID userId, @Param("now") OffsetDateTime now);

    @Modifying
    @Query("""
            update #{#entityName} t
               set t.used = true,
                   t.usedAt = :now
             where t.tokenHash = :tokenHash
               and t.used = false
               and t.expiresAt > :now
            """)
    int markUsedIfUnused(@Param("tokenHash") String tokenHash, @Param("now") OffsetDateTime now);
}
