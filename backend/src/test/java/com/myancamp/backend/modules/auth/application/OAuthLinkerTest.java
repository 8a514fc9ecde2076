package com.myancamp.backend.modules.auth.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import com.myancamp.backend.modules.audit.application.AuditLogService;
import com.myancamp.backend.modules.audit.domain.AuditAction;
import com.myancamp.backend.modules.auth.domain.CampUser;
import com.myancamp.backend.modules.auth.domain.OAuthProvider;
import com.myancamp.backend.modules.auth.infrastructure.oauth.OAuthProfile;
import com.myancamp.backend.modules.auth.infrastructure.oauth.OAuthProviderClient;
import com.myancamp.backend.modules.auth.infrastructure.oauth.OAuthProviderException;
import com.myancamp.backend.modules.auth.infrastructure.persistence.CampUserRepository;
import com.myancamp.backend.support.TestCampUsers;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;

@ExtendWith(MockitoExtension.class)
class OAuthLinkerTest {

    // 1_740_816_001_234 ms: the last four digits feed the generated username
    private static final Instant NOW = Instant.ofEpochMilli(1_740_816_001_234L);
    private static final RequestMetadata META = new RequestMetadata("203.0.113.9", "JUnit");

    @Mock
    private CampUserRepository campUserRepository;

    @Mock
    private OAuthProviderClient googleClient;

    @Mock
    private PasswordHasher passwordHasher;

    @Mock
    private AuditLogService auditLogService;

    private OAuthLinker linker;

    @BeforeEach
    void setUp() {
        when(googleClient.provider()).thenReturn(OAuthProvider.GOOGLE);
        linker = new OAuthLinker(campUserRepository, List.of(googleClient), passwordHasher, auditLogService,
                new SecureRandom(), Clock.fixed(NOW, ZoneOffset.UTC));
        lenient().when(campUserRepository.saveAndFlush(any(CampUser.class))).thenAnswer(invocation -> invocation.getArgument(0));
        lenient().when(passwordHasher.hash(anyString())).thenReturn("{bcrypt}placeholder");
    }

    @Test
    void knownSubjectReturnsExistingAccount() {
        CampUser existing = TestCampUsers.user("mya");
        existing.linkProvider(OAuthProvider.GOOGLE, "g-1");
        when(campUserRepository.findByGoogleId("g-1")).thenReturn(Optional.of(existing));

        OAuthLinker.LinkResult result = linker.resolve(profile("g-1", "mya@example.com"), META);

        assertThat(result.outcome()).isEqualTo(OAuthLinker.LinkOutcome.EXISTING);
        assertThat(result.user()).isSameAs(existing);
        verify(campUserRepository, never()).findByEmailIgnoreCase(anyString());
    }

    @Test
    void emailMatchOnPasswordAccountIsRefused() {
        CampUser local = TestCampUsers.user("mya");
        when(campUserRepository.findByGoogleId("g-2")).thenReturn(Optional.empty());
        when(campUserRepository.findByEmailIgnoreCase("mya@example.com")).thenReturn(Optional.of(local));

        assertThatThrownBy(() -> linker.resolve(profile("g-2", "mya@example.com"), META))
                .isInstanceOfSatisfying(AuthException.class,
                        ex -> assertThat(ex.getErrorCode()).isEqualTo(AuthErrorCode.OAUTH_CONFLICT));
        assertThat(local.getProviderId(OAuthProvider.GOOGLE)).isNull();
        verify(auditLogService).recordUserEvent(eq(AuditAction.OAUTH_CONFLICT), eq(local.getId()), eq("203.0.113.9"), any());
    }

    @Test
    void emailMatchOnProviderOnlyAccountLinksIdentity() {
        CampUser oauthOnly = TestCampUsers.user("mya");
        oauthOnly.setLocalPassword(false);
        when(campUserRepository.findByGoogleId("g-3")).thenReturn(Optional.empty());
        when(campUserRepository.findByEmailIgnoreCase("mya@example.com")).thenReturn(Optional.of(oauthOnly));

        OAuthLinker.LinkResult result = linker.resolve(profile("g-3", "mya@example.com"), META);

        assertThat(result.outcome()).isEqualTo(OAuthLinker.LinkOutcome.LINKED);
        assertThat(oauthOnly.getProviderId(OAuthProvider.GOOGLE)).isEqualTo("g-3");
    }

    @Test
    void newIdentityCreatesVerifiedAccountWithoutLocalPassword() {
        when(campUserRepository.findByGoogleId("g-4")).thenReturn(Optional.empty());
        when(campUserRepository.findByEmailIgnoreCase("zaw.min@example.com")).thenReturn(Optional.empty());

        OAuthLinker.LinkResult result = linker.resolve(profile("g-4", "zaw.min@example.com"), META);

        CampUser created = result.user();
        assertThat(result.outcome()).isEqualTo(OAuthLinker.LinkOutcome.CREATED);
        assertThat(created.getUsername()).isEqualTo("zaw.min_1234");
        assertThat(created.hasLocalPassword()).isFalse();
        assertThat(created.isEmailVerified()).isTrue();
        assertThat(created.getProviderId(OAuthProvider.GOOGLE)).isEqualTo("g-4");
        verify(auditLogService).recordUserEvent(eq(AuditAction.OAUTH_ACCOUNT_CREATED), isNull(), anyString(), any());
    }

    @Test
    void missingEmailFallsBackToUnverifiedPlaceholder() {
        when(campUserRepository.findByGoogleId("g-5")).thenReturn(Optional.empty());

        CampUser created = linker.resolve(profile("g-5", null), META).user();

        assertThat(created.getEmail()).isEqualTo("google_g-5" + OAuthLinker.PLACEHOLDER_EMAIL_DOMAIN);
        assertThat(created.isEmailVerified()).isFalse();
    }

    @Test
    void concurrentlyCreatedIdentityIsReportedAsValidationError() {
        when(campUserRepository.findByGoogleId("g-6")).thenReturn(Optional.empty());
        when(campUserRepository.findByEmailIgnoreCase("khin@example.com")).thenReturn(Optional.empty());
        when(campUserRepository.saveAndFlush(any(CampUser.class)))
                .thenThrow(new DataIntegrityViolationException("uq_app_user_google_id"));

        assertThatThrownBy(() -> linker.resolve(profile("g-6", "khin@example.com"), META))
                .isInstanceOfSatisfying(DuplicateAccountException.class,
                        ex -> assertThat(ex.getErrorCode()).isEqualTo(AuthErrorCode.VALIDATION_ERROR));
        verify(auditLogService, never()).recordUserEvent(eq(AuditAction.OAUTH_ACCOUNT_CREATED), any(), anyString(), any());
    }

    @Test
    void takenUsernameGetsAnotherSuffix() {
        when(campUserRepository.existsByUsernameIgnoreCase("hla_1234")).thenReturn(true);

        String username = linker.generateUsername("hla@example.com");

        assertThat(username).startsWith("hla_").isNotEqualTo("hla_1234");
    }

    @Test
    void providerFailureBecomesGatewayError() {
        when(googleClient.exchangeCode("bad-code", "https://app/cb")).thenThrow(new OAuthProviderException("invalid_grant"));

        assertThatThrownBy(() -> linker.fetchProfile(OAuthProvider.GOOGLE, "bad-code", "https://app/cb"))
                .isInstanceOfSatisfying(AuthException.class,
                        ex -> assertThat(ex.getErrorCode()).isEqualTo(AuthErrorCode.OAUTH_PROVIDER_ERROR));
    }

    @Test
    void unconfiguredProviderIsRejected() {
        assertThatThrownBy(() -> linker.fetchProfile(OAuthProvider.FACEBOOK, "code", "https://app/cb"))
                .isInstanceOfSatisfying(AuthException.class,
                        ex -> assertThat(ex.getErrorCode()).isEqualTo(AuthErrorCode.VALIDATION_ERROR));
    }

    private static OAuthProfile profile(String subject, String email) {
        return new OAuthProfile(OAuthProvider.GOOGLE, subject, email, "Camper", null);
    }
}
