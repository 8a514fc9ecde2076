package com.myancamp.backend.modules.auth.application;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.InvalidKeyException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.time.Clock;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;

import org.apache.commons.codec.binary.Base32;
import org.springframework.stereotype.Component;

/**
 * RFC 6238 TOTP: HMAC-SHA1, 30 second step, 6 digits.
 */
@Component
public class TotpCodeGenerator {

    static final int SECRET_BYTES = 20;
    static final int TIME_STEP_SECONDS = 30;
    static final int CODE_DIGITS = 6;
    static final int WINDOW = 1;

    private static final String ALGORITHM = "HmacSHA1";
    private static final int[] POWERS_OF_TEN = {1, 10, 100, 1_000, 10_000, 100_000, 1_000_000};

    private final Clock clock;
    private final SecureRandom secureRandom;

    public TotpCodeGenerator(Clock clock, SecureRandom secureRandom) {
        this.clock = clock;
        this.secureRandom = secureRandom;
    }

    public String generateSecret() {
        byte[] secretBytes = new byte[SECRET_BYTES];
        secureRandom.nextBytes(secretBytes);
        return new Base32().encodeToString(secretBytes).replace("=", "");
    }

    /**
     * Accepts the code of the current step or of one step on either side.
     */
    public boolean verify(String base32Secret, String code) {
        if (base32Secret == null || code == null) {
            return false;
        }
        String candidate = code.trim();
        if (candidate.length() != CODE_DIGITS || !candidate.chars().allMatch(Character::isDigit)) {
            return false;
        }
        long currentStep = clock.instant().getEpochSecond() / TIME_STEP_SECONDS;
        byte[] candidateBytes = candidate.getBytes(StandardCharsets.US_ASCII);
        boolean matched = false;
        for (int offset = -WINDOW; offset <= WINDOW; offset++) {
            String expected = codeForStep(base32Secret, currentStep + offset);
            matched |= MessageDigest.isEqual(expected.getBytes(StandardCharsets.US_ASCII), candidateBytes);
        }
        return matched;
    }

    public String codeAt(String base32Secret, long epochSeconds) {
        return codeForStep(base32Secret, epochSeconds / TIME_STEP_SECONDS);
    }

    private String codeForStep(String base32Secret, long step) {
        byte[] key = new Base32().decode(base32Secret);
        byte[] counter = ByteBuffer.allocate(Long.BYTES).putLong(step).array();
        byte[] hash;
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(new SecretKeySpec(key, ALGORITHM));
            hash = mac.doFinal(counter);
        } catch (NoSuchAlgorithmException | InvalidKeyException e) {
            throw new IllegalStateException("Unable to compute TOTP code", e);
        }

        int offset = hash[hash.length - 1] & 0x0F;
        int binary = ((hash[offset] & 0x7F) << 24)
                | ((hash[offset + 1] & 0xFF) << 16)
                | ((hash[offset + 2] & 0xFF) << 8)
                | (hash[offset + 3] & 0xFF);
        int otp = binary % POWERS_OF_TEN[CODE_DIGITS];
        return String.format("%0" + CODE_DIGITS + "d", otp);
    }
}
