package com.myancamp.backend.modules.auth.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import com.myancamp.backend.modules.audit.application.AuditLogService;
import com.myancamp.backend.modules.audit.domain.AuditAction;
import com.myancamp.backend.modules.auth.domain.BlacklistReason;
import com.myancamp.backend.modules.auth.domain.BlacklistedToken;
import com.myancamp.backend.modules.auth.domain.CampUser;
import com.myancamp.backend.modules.auth.domain.RefreshToken;
import com.myancamp.backend.modules.auth.infrastructure.persistence.BlacklistedTokenRepository;
import com.myancamp.backend.modules.auth.infrastructure.persistence.RefreshTokenRepository;
import com.myancamp.backend.modules.auth.presentation.dto.TokenPairResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

/**
 * Refresh-token rotation and revocation plus the access-token blacklist.
 *
 * <p>Every exactly-once transition is a conditional update whose row count decides the winner;
 * there are no in-process locks, so any number of replicas may share the store.</p>
 */
@Service
@Transactional(noRollbackFor = ResponseStatusException.class)
public class RevocationService {

    private static final Logger log = LoggerFactory.getLogger(RevocationService.class);

    static final String REASON_ROTATED = "ROTATED";
    static final String REASON_LOGOUT = "LOGOUT";
    static final String REASON_LOGOUT_ALL = "LOGOUT_ALL";
    static final String REASON_USER_SUSPENDED = "USER_SUSPENDED";
    static final String REASON_PASSWORD_RESET = "PASSWORD_RESET";

    private final RefreshTokenRepository refreshTokenRepository;
    private final BlacklistedTokenRepository blacklistedTokenRepository;
    private final TokenIssuer tokenIssuer;
    private final AccountSuspensionChecker suspensionChecker;
    private final AuditLogService auditLogService;
    private final Clock clock;

    public RevocationService(
            RefreshTokenRepository refreshTokenRepository,
            BlacklistedTokenRepository blacklistedTokenRepository,
            TokenIssuer tokenIssuer,
            AccountSuspensionChecker suspensionChecker,
            AuditLogService auditLogService,
            Clock clock
    ) {
        this.refreshTokenRepository = refreshTokenRepository;
        this.blacklistedTokenRepository = blacklistedTokenRepository;
        this.tokenIssuer = tokenIssuer;
        this.suspensionChecker = suspensionChecker;
        this.auditLogService = auditLogService;
        this.clock = clock;
    }

    /**
     * Exchanges a live refresh token for a new pair. The presented token is revoked before the
     * new pair is issued, and of two racing callers only one sees the revoke succeed.
     */
    public RotationResult rotate(String refreshTokenValue, RequestMetadata meta) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        String tokenHash = TokenHashing.sha256Hex(refreshTokenValue);

        RefreshToken stored = findStored(tokenHash)
                .orElseThrow(() -> new AuthException(AuthErrorCode.TOKEN_INVALID, "Invalid refresh token"));

        CampUser user = stored.getUser();
        if (!stored.isActiveAt(now)) {
            if (stored.isRevoked()) {
                log.warn("Revoked refresh token presented again for user {} (revoked reason {})",
                        user.getId(), stored.getRevokedReason());
                auditLogService.recordUserEvent(AuditAction.REFRESH_TOKEN_REPLAY, user.getId(), meta.ipAddress(),
                        Map.of("revokedReason", String.valueOf(stored.getRevokedReason())));
            }
            throw new AuthException(AuthErrorCode.TOKEN_INVALID, "Invalid refresh token");
        }

        if (suspensionChecker.isSuspended(user)) {
            refreshTokenRepository.revokeByTokenHash(tokenHash, now, REASON_USER_SUSPENDED);
            throw new AuthException(AuthErrorCode.ACCOUNT_SUSPENDED);
        }

        int updated = refreshTokenRepository.revokeIfActive(tokenHash, now, REASON_ROTATED);
        if (updated == 0) {
            log.warn("Refresh token for user {} was rotated concurrently", user.getId());
            throw new AuthException(AuthErrorCode.TOKEN_INVALID, "Invalid refresh token");
        }

        TokenPairResponse tokens = tokenIssuer.issuePair(user, meta);
        return new RotationResult(user, tokens);
    }

    /**
     * Revokes one refresh token. Unknown or already revoked tokens are ignored.
     */
    public boolean revokeRefreshToken(String refreshTokenValue, String reason) {
        if (refreshTokenValue == null || refreshTokenValue.isBlank()) {
            return false;
        }
        OffsetDateTime now = OffsetDateTime.now(clock);
        return refreshTokenRepository.revokeByTokenHash(TokenHashing.sha256Hex(refreshTokenValue), now, reason) > 0;
    }

    public int revokeAllUserTokens(UUID userId, String reason) {
        int revoked = refreshTokenRepository.revokeAllForUser(userId, OffsetDateTime.now(clock), reason);
        log.info("Revoked {} refresh token(s) for user {} ({})", revoked, userId, reason);
        return revoked;
    }

    /**
     * Adds an access token to the blacklist until its own expiry. Returns false when it was
     * already there.
     */
    public boolean blacklistAccess(String accessToken, UUID userId, BlacklistReason reason, RequestMetadata meta) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        OffsetDateTime expiresAt = tokenIssuer.decodeExpiry(accessToken)
                .orElseGet(() -> now.plus(tokenIssuer.getAccessTtl()));
        if (!expiresAt.isAfter(now)) {
            return false;
        }
        int inserted = blacklistedTokenRepository.insertIfAbsent(
                TokenHashing.sha256Hex(accessToken),
                userId,
                BlacklistedToken.TYPE_ACCESS,
                expiresAt,
                reason.name(),
                now,
                meta.ipAddress(),
                meta.userAgent()
        );
        return inserted > 0;
    }

    public int pruneExpiredBlacklist() {
        return blacklistedTokenRepository.deleteExpired(OffsetDateTime.now(clock));
    }

    private Optional<RefreshToken> findStored(String tokenHash) {
        try {
            return refreshTokenRepository.findByTokenHash(tokenHash);
        } catch (DataAccessException ex) {
            log.error("Refresh token lookup failed; rejecting the token", ex);
            return Optional.empty();
        }
    }

    public record RotationResult(CampUser user, TokenPairResponse tokens) {
    }
}
