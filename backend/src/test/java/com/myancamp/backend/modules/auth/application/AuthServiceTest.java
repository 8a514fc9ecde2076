package com.myancamp.backend.modules.auth.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Optional;

import com.myancamp.backend.modules.audit.application.AuditLogService;
import com.myancamp.backend.modules.auth.domain.BlacklistReason;
import com.myancamp.backend.modules.auth.domain.CampUser;
import com.myancamp.backend.modules.auth.infrastructure.persistence.CampUserRepository;
import com.myancamp.backend.modules.auth.presentation.dto.LoginResponse;
import com.myancamp.backend.modules.auth.presentation.dto.RegisterRequest;
import com.myancamp.backend.modules.auth.presentation.dto.TokenPairResponse;
import com.myancamp.backend.modules.auth.presentation.dto.TwoFactorLoginRequest;
import com.myancamp.backend.support.TestCampUsers;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;

@ExtendWith(MockitoExtension.class)
class AuthServiceTest {

    private static final Instant NOW = Instant.parse("2025-03-01T08:00:00Z");
    private static final RequestMetadata META = new RequestMetadata("198.51.100.4", "JUnit");
    private static final String PENDING_TOKEN = "pending.jwt.value";

    @Mock
    private CampUserRepository campUserRepository;

    @Mock
    private PasswordHasher passwordHasher;

    @Mock
    private PasswordPolicy passwordPolicy;

    @Mock
    private TokenIssuer tokenIssuer;

    @Mock
    private RevocationService revocationService;

    @Mock
    private AccessTokenAuthenticator accessTokenAuthenticator;

    @Mock
    private SingleUseTokenService singleUseTokenService;

    @Mock
    private TwoFactorService twoFactorService;

    @Mock
    private OAuthLinker oAuthLinker;

    @Mock
    private AccountSuspensionChecker suspensionChecker;

    @Mock
    private AuthNotificationService notificationService;

    @Mock
    private AuditLogService auditLogService;

    private AuthService authService;

    @BeforeEach
    void setUp() {
        authService = new AuthService(campUserRepository, passwordHasher, passwordPolicy, tokenIssuer,
                revocationService, accessTokenAuthenticator, singleUseTokenService, twoFactorService, oAuthLinker,
                suspensionChecker, notificationService, auditLogService, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void pendingTokenCompletesTwoFactorLoginOnlyOnce() {
        CampUser user = TestCampUsers.user("thiri");
        OffsetDateTime issuedAt = OffsetDateTime.ofInstant(NOW, ZoneOffset.UTC);
        AccessTokenClaims claims = new AccessTokenClaims(user.getId(), user.getUsername(), user.getEmail(),
                false, false, TokenIssuer.TYPE_TWO_FACTOR_PENDING, issuedAt, issuedAt.plusMinutes(10));
        when(accessTokenAuthenticator.authenticate(PENDING_TOKEN, TokenIssuer.TYPE_TWO_FACTOR_PENDING))
                .thenReturn(AccessTokenCheck.authenticated(claims));
        when(campUserRepository.findById(user.getId())).thenReturn(Optional.of(user));
        when(twoFactorService.completeChallenge(user, "123456", false))
                .thenReturn(new TwoFactorService.ChallengeResult(false, null));
        when(revocationService.blacklistAccess(PENDING_TOKEN, user.getId(), BlacklistReason.TWO_FACTOR_COMPLETED, META))
                .thenReturn(true, false);
        when(tokenIssuer.issuePair(user, META)).thenReturn(new TokenPairResponse("access", "Bearer", 900L,
                "refresh", 604_800L, issuedAt.plusDays(7), issuedAt));

        TwoFactorLoginRequest request = new TwoFactorLoginRequest(PENDING_TOKEN, "123456", false);
        LoginResponse first = authService.verifyTwoFactorLogin(request, META);

        assertThat(first.requiresTwoFactor()).isFalse();
        assertThat(first.tokens().accessToken()).isEqualTo("access");
        assertThatThrownBy(() -> authService.verifyTwoFactorLogin(request, META))
                .isInstanceOfSatisfying(AuthException.class,
                        ex -> assertThat(ex.getErrorCode()).isEqualTo(AuthErrorCode.TOKEN_INVALID));
        verify(tokenIssuer, times(1)).issuePair(user, META);
    }

    @Test
    void wrongTwoFactorCodeLeavesPendingTokenUsable() {
        CampUser user = TestCampUsers.user("aung");
        OffsetDateTime issuedAt = OffsetDateTime.ofInstant(NOW, ZoneOffset.UTC);
        AccessTokenClaims claims = new AccessTokenClaims(user.getId(), user.getUsername(), user.getEmail(),
                false, false, TokenIssuer.TYPE_TWO_FACTOR_PENDING, issuedAt, issuedAt.plusMinutes(10));
        when(accessTokenAuthenticator.authenticate(PENDING_TOKEN, TokenIssuer.TYPE_TWO_FACTOR_PENDING))
                .thenReturn(AccessTokenCheck.authenticated(claims));
        when(campUserRepository.findById(user.getId())).thenReturn(Optional.of(user));
        when(twoFactorService.completeChallenge(user, "000000", false))
                .thenThrow(new AuthException(AuthErrorCode.TWO_FACTOR_INVALID_CODE));

        assertThatThrownBy(() -> authService.verifyTwoFactorLogin(
                new TwoFactorLoginRequest(PENDING_TOKEN, "000000", false), META))
                .isInstanceOfSatisfying(AuthException.class,
                        ex -> assertThat(ex.getErrorCode()).isEqualTo(AuthErrorCode.TWO_FACTOR_INVALID_CODE));
        verify(revocationService, never()).blacklistAccess(anyString(), any(), any(), any());
    }

    @Test
    void registerReportsConcurrentDuplicateAsValidationError() {
        when(campUserRepository.existsByUsernameIgnoreCase("nilar")).thenReturn(false);
        when(campUserRepository.existsByEmailIgnoreCase("nilar@example.com")).thenReturn(false);
        when(passwordHasher.hash("Campfire1!")).thenReturn("{bcrypt}hash");
        when(campUserRepository.saveAndFlush(any(CampUser.class)))
                .thenThrow(new DataIntegrityViolationException("duplicate key value violates unique constraint"));

        assertThatThrownBy(() -> authService.register(
                new RegisterRequest("nilar", "nilar@example.com", "Campfire1!", null), META))
                .isInstanceOfSatisfying(DuplicateAccountException.class, ex -> {
                    assertThat(ex.getErrorCode()).isEqualTo(AuthErrorCode.VALIDATION_ERROR);
                    assertThat(ex.getCause()).isInstanceOf(DataIntegrityViolationException.class);
                });
        verify(singleUseTokenService, never()).generate(any(), any(), eq(META));
    }
}
