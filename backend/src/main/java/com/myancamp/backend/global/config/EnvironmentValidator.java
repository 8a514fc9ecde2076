package com.myancamp.backend.global.config;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * Fails startup when auth settings are missing or unsafe.
 */
@Component
public class EnvironmentValidator {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentValidator.class);

    static final String DEV_JWT_SECRET = "dev-jwt-secret-change-me-before-deploying-myancamp";
    private static final int MIN_SECRET_BYTES = 32;
    private static final Duration MIN_ACCESS_TTL = Duration.ofMinutes(1);
    private static final Duration MAX_ACCESS_TTL = Duration.ofHours(24);

    private static final String[] REQUIRED_PROPERTIES = {
            "spring.datasource.url",
            "auth.jwt.secret",
            "auth.jwt.access-ttl",
            "auth.jwt.refresh-ttl",
            "app.client-url",
            "app.cors.allowed-origins"
    };

    private final Environment environment;

    public EnvironmentValidator(Environment environment) {
        this.environment = environment;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void validateEnvironment() {
        List<String> problems = new ArrayList<>();

        for (String key : REQUIRED_PROPERTIES) {
            String value = environment.getProperty(key);
            if (value == null || value.isBlank()) {
                problems.add(key + ": missing");
            }
        }

        Optional.ofNullable(environment.getProperty("auth.jwt.secret"))
                .filter(secret -> !secret.isBlank())
                .ifPresent(secret -> {
                    if (secret.equals(DEV_JWT_SECRET) && !isDevProfile()) {
                        problems.add("auth.jwt.secret: replace the development default with a random value");
                    }
                    if (secretLength(secret) < MIN_SECRET_BYTES) {
                        problems.add("auth.jwt.secret: must be at least " + MIN_SECRET_BYTES + " bytes");
                    }
                });

        try {
            Duration accessTtl = environment.getProperty("auth.jwt.access-ttl", Duration.class);
            if (accessTtl != null && (accessTtl.compareTo(MIN_ACCESS_TTL) < 0 || accessTtl.compareTo(MAX_ACCESS_TTL) > 0)) {
                problems.add("auth.jwt.access-ttl: must be between 1m and 24h");
            }
        } catch (IllegalArgumentException ex) {
            problems.add("auth.jwt.access-ttl: not a duration");
        }

        if (!problems.isEmpty()) {
            problems.forEach(problem -> log.error("Invalid configuration - {}", problem));
            throw new IllegalStateException("Environment validation failed: " + String.join("; ", problems));
        }

        log.info("Environment validation passed");
    }

    private boolean isDevProfile() {
        for (String profile : environment.getActiveProfiles()) {
            if ("dev".equals(profile) || "test".equals(profile)) {
                return true;
            }
        }
        return false;
    }

    private static int secretLength(String secret) {
        try {
            return Base64.getDecoder().decode(secret).length;
        } catch (IllegalArgumentException ex) {
            return secret.getBytes(StandardCharsets.UTF_8).length;
        }
    }
}
