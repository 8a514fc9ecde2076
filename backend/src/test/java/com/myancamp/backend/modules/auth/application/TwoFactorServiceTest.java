package com.myancamp.backend.modules.auth.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.myancamp.backend.modules.auth.domain.CampUser;
import com.myancamp.backend.modules.auth.domain.TwoFactorBackupCode;
import com.myancamp.backend.modules.auth.infrastructure.persistence.TwoFactorBackupCodeRepository;
import com.myancamp.backend.support.TestCampUsers;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

@ExtendWith(MockitoExtension.class)
class TwoFactorServiceTest {

    private static final Instant NOW = Instant.parse("2025-03-01T08:00:00Z");

    @Mock
    private TwoFactorBackupCodeRepository backupCodeRepository;

    @Captor
    private ArgumentCaptor<List<TwoFactorBackupCode>> backupCodesCaptor;

    private TotpCodeGenerator totp;
    private TwoFactorService service;
    private CampUser user;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        totp = new TotpCodeGenerator(clock, new SecureRandom());
        service = new TwoFactorService(totp, backupCodeRepository, new SecureRandom(), clock, "MyanCamp", 10);
        user = TestCampUsers.user("nilar");
    }

    @Test
    void setupStoresPendingSecretAndBuildsOtpauthUrl() {
        TwoFactorService.TwoFactorSetup setup = service.initiateSetup(user);

        assertThat(user.getTwoFactorSecret()).isEqualTo(setup.secret());
        assertThat(user.isTwoFactorEnabled()).isFalse();
        assertThat(setup.otpauthUrl())
                .startsWith("otpauth://totp/MyanCamp:nilar?secret=" + setup.secret())
                .contains("issuer=MyanCamp")
                .contains("digits=6")
                .contains("period=30");
    }

    @Test
    void confirmWithValidCodeEnablesAndIssuesHashedBackupCodes() {
        service.initiateSetup(user);
        String code = totp.codeAt(user.getTwoFactorSecret(), NOW.getEpochSecond());

        List<String> backupCodes = service.confirmSetup(user, code);

        assertThat(user.isTwoFactorEnabled()).isTrue();
        assertThat(backupCodes).hasSize(10).allMatch(value -> value.matches("[0-9A-F]{4}-[0-9A-F]{4}"));
        assertThat(backupCodes).doesNotHaveDuplicates();

        verify(backupCodeRepository).deleteAllForUser(user.getId());
        verify(backupCodeRepository).saveAll(backupCodesCaptor.capture());
        String firstHash = TokenHashing.sha256Hex(TwoFactorService.normalizeBackupCode(backupCodes.get(0)));
        assertThat(backupCodesCaptor.getValue()).extracting(TwoFactorBackupCode::getCodeHash).contains(firstHash);
    }

    @Test
    void confirmWithWrongCodeLeavesTwoFactorDisabled() {
        service.initiateSetup(user);

        assertThatThrownBy(() -> service.confirmSetup(user, "000000"))
                .isInstanceOfSatisfying(AuthException.class,
                        ex -> assertThat(ex.getErrorCode()).isEqualTo(AuthErrorCode.TWO_FACTOR_INVALID_CODE));
        assertThat(user.isTwoFactorEnabled()).isFalse();
    }

    @Test
    void confirmWithoutSetupIsRejected() {
        assertThatThrownBy(() -> service.confirmSetup(user, "123456"))
                .isInstanceOfSatisfying(AuthException.class,
                        ex -> assertThat(ex.getErrorCode()).isEqualTo(AuthErrorCode.VALIDATION_ERROR));
    }

    @Test
    void backupCodeIsBurnedOnceAndReportsRemaining() {
        enableTwoFactor();
        TwoFactorBackupCode stored = new TwoFactorBackupCode(user, TokenHashing.sha256Hex("ABCD1234"), null);
        ReflectionTestUtils.setField(stored, "id", UUID.randomUUID());
        when(backupCodeRepository.findFirstByUserIdAndCodeHashAndUsedFalse(user.getId(), TokenHashing.sha256Hex("ABCD1234")))
                .thenReturn(Optional.of(stored));
        when(backupCodeRepository.markUsedIfUnused(eq(stored.getId()), any())).thenReturn(1);
        when(backupCodeRepository.countByUserIdAndUsedFalse(user.getId())).thenReturn(9L);

        TwoFactorService.ChallengeResult result = service.completeChallenge(user, "abcd-1234", true);

        assertThat(result.usedBackupCode()).isTrue();
        assertThat(result.remainingBackupCodes()).isEqualTo(9L);
    }

    @Test
    void unknownBackupCodeFailsWithoutSideEffects() {
        enableTwoFactor();
        when(backupCodeRepository.findFirstByUserIdAndCodeHashAndUsedFalse(eq(user.getId()), anyString()))
                .thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.completeChallenge(user, "FFFF-0000", true))
                .isInstanceOf(AuthException.class);
        verify(backupCodeRepository, never()).markUsedIfUnused(any(), any());
    }

    @Test
    void totpChallengeAcceptsCurrentCode() {
        enableTwoFactor();
        String code = totp.codeAt(user.getTwoFactorSecret(), NOW.getEpochSecond());

        TwoFactorService.ChallengeResult result = service.completeChallenge(user, code, false);

        assertThat(result.usedBackupCode()).isFalse();
        assertThat(result.remainingBackupCodes()).isNull();
    }

    @Test
    void disableRequiresValidCodeAndWipesBackupCodes() {
        enableTwoFactor();
        String code = totp.codeAt(user.getTwoFactorSecret(), NOW.getEpochSecond());

        service.disable(user, code);

        assertThat(user.isTwoFactorEnabled()).isFalse();
        assertThat(user.getTwoFactorSecret()).isNull();
        verify(backupCodeRepository).deleteAllForUser(user.getId());
    }

    @Test
    void normalizeStripsSeparatorsAndUppercases() {
        assertThat(TwoFactorService.normalizeBackupCode(" ab12-cd34 ")).isEqualTo("AB12CD34");
        assertThat(TwoFactorService.normalizeBackupCode(null)).isEmpty();
    }

    private void enableTwoFactor() {
        user.beginTwoFactorSetup(totp.generateSecret());
        user.enableTwoFactor();
    }
}
