package com.myancamp.backend.modules.auth.application;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

import com.myancamp.backend.modules.auth.domain.CampUser;
import com.myancamp.backend.modules.auth.domain.TwoFactorBackupCode;
import com.myancamp.backend.modules.auth.infrastructure.persistence.TwoFactorBackupCodeRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

/**
 * TOTP enrolment and verification. Lifecycle per user: disabled, setup initiated (secret stored
 * but not enabled), enabled, and back to disabled.
 */
@Service
@Transactional(noRollbackFor = ResponseStatusException.class)
public class TwoFactorService {

    private static final Logger log = LoggerFactory.getLogger(TwoFactorService.class);
    private static final int BACKUP_CODE_BYTES = 4;

    private final TotpCodeGenerator totpCodeGenerator;
    private final TwoFactorBackupCodeRepository backupCodeRepository;
    private final SecureRandom secureRandom;
    private final Clock clock;
    private final String issuer;
    private final int backupCodeCount;

    public TwoFactorService(
            TotpCodeGenerator totpCodeGenerator,
            TwoFactorBackupCodeRepository backupCodeRepository,
            SecureRandom secureRandom,
            Clock clock,
            @Value("${auth.two-factor.issuer:MyanCamp}") String issuer,
            @Value("${auth.two-factor.backup-code-count:10}") int backupCodeCount
    ) {
        this.totpCodeGenerator = totpCodeGenerator;
        this.backupCodeRepository = backupCodeRepository;
        this.secureRandom = secureRandom;
        this.clock = clock;
        this.issuer = issuer;
        this.backupCodeCount = backupCodeCount;
    }

    public TwoFactorSetup initiateSetup(CampUser user) {
        if (user.isTwoFactorEnabled()) {
            throw new AuthException(AuthErrorCode.VALIDATION_ERROR, "Two-factor authentication is already enabled");
        }
        String secret = totpCodeGenerator.generateSecret();
        user.beginTwoFactorSetup(secret);
        log.info("Two-factor setup initiated for user {}", user.getId());
        return new TwoFactorSetup(secret, otpauthUrl(user.getUsername(), secret));
    }

    /**
     * Enables two-factor authentication and returns the plaintext backup codes. They are not
     * retrievable afterwards.
     */
    public List<String> confirmSetup(CampUser user, String code) {
        if (user.isTwoFactorEnabled()) {
            throw new AuthException(AuthErrorCode.VALIDATION_ERROR, "Two-factor authentication is already enabled");
        }
        if (user.getTwoFactorSecret() == null) {
            throw new AuthException(AuthErrorCode.VALIDATION_ERROR, "Two-factor setup has not been initiated");
        }
        if (!totpCodeGenerator.verify(user.getTwoFactorSecret(), code)) {
            throw new AuthException(AuthErrorCode.TWO_FACTOR_INVALID_CODE);
        }

        user.enableTwoFactor();
        List<String> backupCodes = replaceBackupCodes(user);
        log.info("Two-factor authentication enabled for user {}", user.getId());
        return backupCodes;
    }

    /**
     * Second step of a login. A backup code is burned only when it matches; a failed attempt
     * changes nothing.
     */
    public ChallengeResult completeChallenge(CampUser user, String code, boolean useBackupCode) {
        if (!user.isTwoFactorEnabled() || user.getTwoFactorSecret() == null) {
            throw new AuthException(AuthErrorCode.VALIDATION_ERROR, "Two-factor authentication is not enabled");
        }
        if (useBackupCode) {
            if (!consumeBackupCode(user, code)) {
                throw new AuthException(AuthErrorCode.TWO_FACTOR_INVALID_CODE, "Invalid backup code");
            }
            long remaining = remainingBackupCodes(user);
            return new ChallengeResult(true, remaining);
        }
        if (!totpCodeGenerator.verify(user.getTwoFactorSecret(), code)) {
            throw new AuthException(AuthErrorCode.TWO_FACTOR_INVALID_CODE);
        }
        return new ChallengeResult(false, null);
    }

    public void disable(CampUser user, String code) {
        if (!user.isTwoFactorEnabled()) {
            throw new AuthException(AuthErrorCode.VALIDATION_ERROR, "Two-factor authentication is not enabled");
        }
        if (!totpCodeGenerator.verify(user.getTwoFactorSecret(), code)) {
            throw new AuthException(AuthErrorCode.TWO_FACTOR_INVALID_CODE);
        }
        user.clearTwoFactor();
        backupCodeRepository.deleteAllForUser(user.getId());
        log.info("Two-factor authentication disabled for user {}", user.getId());
    }

    public long remainingBackupCodes(CampUser user) {
        return backupCodeRepository.countByUserIdAndUsedFalse(user.getId());
    }

    boolean consumeBackupCode(CampUser user, String code) {
        String normalized = normalizeBackupCode(code);
        if (normalized.isEmpty()) {
            return false;
        }
        Optional<TwoFactorBackupCode> match = backupCodeRepository
                .findFirstByUserIdAndCodeHashAndUsedFalse(user.getId(), TokenHashing.sha256Hex(normalized));
        if (match.isEmpty()) {
            return false;
        }
        return backupCodeRepository.markUsedIfUnused(match.get().getId(), OffsetDateTime.now(clock)) == 1;
    }

    static String normalizeBackupCode(String code) {
        if (code == null) {
            return "";
        }
        return code.replaceAll("[\\s-]", "").toUpperCase(Locale.ROOT);
    }

    private List<String> replaceBackupCodes(CampUser user) {
        backupCodeRepository.deleteAllForUser(user.getId());
        OffsetDateTime now = OffsetDateTime.now(clock);
        HexFormat hex = HexFormat.of().withUpperCase();
        List<String> plainCodes = new ArrayList<>(backupCodeCount);
        List<TwoFactorBackupCode> entities = new ArrayList<>(backupCodeCount);
        for (int i = 0; i < backupCodeCount; i++) {
            byte[] bytes = new byte[BACKUP_CODE_BYTES];
            secureRandom.nextBytes(bytes);
            String raw = hex.formatHex(bytes);
            plainCodes.add(raw.substring(0, 4) + "-" + raw.substring(4));
            entities.add(new TwoFactorBackupCode(user, TokenHashing.sha256Hex(raw), now));
        }
        backupCodeRepository.saveAll(entities);
        return plainCodes;
    }

    private String otpauthUrl(String accountName, String secret) {
        String encodedIssuer = encode(issuer);
        return "otpauth://totp/" + encodedIssuer + ":" + encode(accountName)
                + "?secret=" + secret
                + "&issuer=" + encodedIssuer
                + "&algorithm=SHA1&digits=" + TotpCodeGenerator.CODE_DIGITS
                + "&period=" + TotpCodeGenerator.TIME_STEP_SECONDS;
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }

    public record TwoFactorSetup(String secret, String otpauthUrl) {
    }

    public record ChallengeResult(boolean usedBackupCode, Long remainingBackupCodes) {
    }
}
