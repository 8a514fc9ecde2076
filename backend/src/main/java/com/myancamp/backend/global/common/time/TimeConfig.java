package com.myancamp.backend.global.common.time;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.ZoneOffset;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Shared time and randomness sources. Every token expiry and TOTP step is computed from the
 * injected {@link Clock}, so tests can pin time with {@code Clock.fixed}.
 */
@Configuration
public class TimeConfig {

    @Bean
    public Clock utcClock() {
        return Clock.system(ZoneOffset.UTC);
    }

    @Bean
    public SecureRandom secureRandom() {
        return new SecureRandom();
    }
}
