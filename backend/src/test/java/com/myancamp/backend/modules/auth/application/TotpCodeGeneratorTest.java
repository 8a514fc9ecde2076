package com.myancamp.backend.modules.auth.application;

import static org.assertj.core.api.Assertions.assertThat;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import org.apache.commons.codec.binary.Base32;
import org.junit.jupiter.api.Test;

class TotpCodeGeneratorTest {

    // RFC 6238 appendix B seed "12345678901234567890"
    private static final String RFC_SECRET = "GEZDGNBVGY3TQOJQGEZDGNBVGY3TQOJQ";

    @Test
    void codeAtMatchesRfcVectors() {
        TotpCodeGenerator generator = generatorAt(0);

        assertThat(generator.codeAt(RFC_SECRET, 59)).isEqualTo("287082");
        assertThat(generator.codeAt(RFC_SECRET, 1111111109)).isEqualTo("081804");
        assertThat(generator.codeAt(RFC_SECRET, 1234567890)).isEqualTo("005924");
    }

    @Test
    void verifyAcceptsAdjacentStepsOnly() {
        long now = 1_700_000_000L;
        TotpCodeGenerator generator = generatorAt(now);

        assertThat(generator.verify(RFC_SECRET, generator.codeAt(RFC_SECRET, now))).isTrue();
        assertThat(generator.verify(RFC_SECRET, generator.codeAt(RFC_SECRET, now - 30))).isTrue();
        assertThat(generator.verify(RFC_SECRET, generator.codeAt(RFC_SECRET, now + 30))).isTrue();
        assertThat(generator.verify(RFC_SECRET, generator.codeAt(RFC_SECRET, now - 90))).isFalse();
    }

    @Test
    void verifyRejectsMalformedInput() {
        TotpCodeGenerator generator = generatorAt(59);

        assertThat(generator.verify(RFC_SECRET, null)).isFalse();
        assertThat(generator.verify(null, "287082")).isFalse();
        assertThat(generator.verify(RFC_SECRET, "28708")).isFalse();
        assertThat(generator.verify(RFC_SECRET, "28708a")).isFalse();
        assertThat(generator.verify(RFC_SECRET, " 287082 ")).isTrue();
    }

    @Test
    void generatedSecretIsUnpaddedBase32OfTwentyBytes() {
        String secret = generatorAt(0).generateSecret();

        assertThat(secret).matches("[A-Z2-7]+");
        assertThat(new Base32().decode(secret)).hasSize(TotpCodeGenerator.SECRET_BYTES);
    }

    private static TotpCodeGenerator generatorAt(long epochSeconds) {
        Clock clock = Clock.fixed(Instant.ofEpochSecond(epochSeconds), ZoneOffset.UTC);
        return new TotpCodeGenerator(clock, new SecureRandom());
    }
}
