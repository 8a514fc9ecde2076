package com.myancamp.backend.modules.auth.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Optional;

import com.myancamp.backend.modules.audit.application.AuditLogService;
import com.myancamp.backend.modules.audit.domain.AuditAction;
import com.myancamp.backend.modules.auth.domain.BlacklistReason;
import com.myancamp.backend.modules.auth.domain.BlacklistedToken;
import com.myancamp.backend.modules.auth.domain.CampUser;
import com.myancamp.backend.modules.auth.domain.RefreshToken;
import com.myancamp.backend.modules.auth.infrastructure.persistence.BlacklistedTokenRepository;
import com.myancamp.backend.modules.auth.infrastructure.persistence.RefreshTokenRepository;
import com.myancamp.backend.modules.auth.presentation.dto.TokenPairResponse;
import com.myancamp.backend.support.TestCampUsers;

import org.assertj.core.api.ThrowableAssert.ThrowingCallable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.test.util.ReflectionTestUtils;

@ExtendWith(MockitoExtension.class)
class RevocationServiceTest {

    private static final OffsetDateTime NOW = OffsetDateTime.parse("2025-03-01T08:00:00Z");
    private static final String REFRESH = "a1b2c3";
    private static final String HASH = TokenHashing.sha256Hex(REFRESH);
    private static final RequestMetadata META = new RequestMetadata("198.51.100.4", "JUnit");

    @Mock
    private RefreshTokenRepository refreshTokenRepository;

    @Mock
    private BlacklistedTokenRepository blacklistedTokenRepository;

    @Mock
    private TokenIssuer tokenIssuer;

    @Mock
    private AccountSuspensionChecker suspensionChecker;

    @Mock
    private AuditLogService auditLogService;

    private RevocationService service;
    private CampUser user;

    @BeforeEach
    void setUp() {
        service = new RevocationService(refreshTokenRepository, blacklistedTokenRepository, tokenIssuer,
                suspensionChecker, auditLogService, Clock.fixed(NOW.toInstant(), ZoneOffset.UTC));
        user = TestCampUsers.user("kyaw");
    }

    @Test
    void rotationRevokesPresentedTokenThenIssuesNewPair() {
        when(refreshTokenRepository.findByTokenHash(HASH)).thenReturn(Optional.of(stored(false, NOW.plusDays(1))));
        when(refreshTokenRepository.revokeIfActive(HASH, NOW, RevocationService.REASON_ROTATED)).thenReturn(1);
        TokenPairResponse pair = new TokenPairResponse("access", "Bearer", 900, "refresh", 604800, NOW.plusDays(7), NOW);
        when(tokenIssuer.issuePair(user, META)).thenReturn(pair);

        RevocationService.RotationResult result = service.rotate(REFRESH, META);

        assertThat(result.user()).isSameAs(user);
        assertThat(result.tokens()).isSameAs(pair);
    }

    @Test
    void replayOfRevokedTokenIsAudited() {
        when(refreshTokenRepository.findByTokenHash(HASH)).thenReturn(Optional.of(stored(true, NOW.plusDays(1))));

        assertTokenInvalid(() -> service.rotate(REFRESH, META));
        verify(auditLogService).recordUserEvent(eq(AuditAction.REFRESH_TOKEN_REPLAY), eq(user.getId()), eq("198.51.100.4"), anyMap());
        verify(tokenIssuer, never()).issuePair(any(), any());
    }

    @Test
    void expiredTokenIsRejectedWithoutReplayAudit() {
        when(refreshTokenRepository.findByTokenHash(HASH)).thenReturn(Optional.of(stored(false, NOW.minusSeconds(1))));

        assertTokenInvalid(() -> service.rotate(REFRESH, META));
        verify(auditLogService, never()).recordUserEvent(any(), any(), any(), any());
    }

    @Test
    void suspendedUserLosesTheTokenAndGetsNoPair() {
        when(refreshTokenRepository.findByTokenHash(HASH)).thenReturn(Optional.of(stored(false, NOW.plusDays(1))));
        when(suspensionChecker.isSuspended(user)).thenReturn(true);

        assertThatThrownBy(() -> service.rotate(REFRESH, META))
                .isInstanceOfSatisfying(AuthException.class,
                        ex -> assertThat(ex.getErrorCode()).isEqualTo(AuthErrorCode.ACCOUNT_SUSPENDED));
        verify(refreshTokenRepository).revokeByTokenHash(HASH, NOW, RevocationService.REASON_USER_SUSPENDED);
        verify(tokenIssuer, never()).issuePair(any(), any());
    }

    @Test
    void losingConcurrentRotationIsRejected() {
        when(refreshTokenRepository.findByTokenHash(HASH)).thenReturn(Optional.of(stored(false, NOW.plusDays(1))));
        when(refreshTokenRepository.revokeIfActive(HASH, NOW, RevocationService.REASON_ROTATED)).thenReturn(0);

        assertTokenInvalid(() -> service.rotate(REFRESH, META));
        verify(tokenIssuer, never()).issuePair(any(), any());
    }

    @Test
    void storeFailureDuringLookupRejectsToken() {
        when(refreshTokenRepository.findByTokenHash(HASH)).thenThrow(new QueryTimeoutException("timeout"));

        assertTokenInvalid(() -> service.rotate(REFRESH, META));
    }

    @Test
    void blacklistKeepsEntryUntilTokenExpiry() {
        OffsetDateTime exp = NOW.plusMinutes(12);
        when(tokenIssuer.decodeExpiry("jwt")).thenReturn(Optional.of(exp));
        when(blacklistedTokenRepository.insertIfAbsent(eq(TokenHashing.sha256Hex("jwt")), eq(user.getId()),
                eq(BlacklistedToken.TYPE_ACCESS), eq(exp), eq(BlacklistReason.LOGOUT.name()), eq(NOW),
                eq("198.51.100.4"), eq("JUnit"))).thenReturn(1);

        assertThat(service.blacklistAccess("jwt", user.getId(), BlacklistReason.LOGOUT, META)).isTrue();
    }

    @Test
    void blankRefreshTokenIsIgnoredOnLogout() {
        assertThat(service.revokeRefreshToken("  ", RevocationService.REASON_LOGOUT)).isFalse();
        verify(refreshTokenRepository, never()).revokeByTokenHash(anyString(), any(), anyString());
    }

    private RefreshToken stored(boolean revoked, OffsetDateTime expiresAt) {
        RefreshToken token = new RefreshToken();
        token.setUser(user);
        token.setTokenHash(HASH);
        token.setIssuedAt(NOW.minusDays(1));
        token.setExpiresAt(expiresAt);
        if (revoked) {
            ReflectionTestUtils.setField(token, "revoked", true);
            ReflectionTestUtils.setField(token, "revokedReason", RevocationService.REASON_ROTATED);
        }
        return token;
    }

    private static void assertTokenInvalid(ThrowingCallable call) {
        assertThatThrownBy(call).isInstanceOfSatisfying(AuthException.class,
                ex -> assertThat(ex.getErrorCode()).isEqualTo(AuthErrorCode.TOKEN_INVALID));
    }
}
