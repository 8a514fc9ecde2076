package com.myancamp.backend.modules.auth.infrastructure.jwt;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * HMAC key and issuer shared by every token the backend signs.
 * The secret may be Base64 or a raw string; either way it must carry at least 256 bits.
 */
@Component
public class JwtSigningKeyProvider {

    private static final String HMAC_SHA_256 = "HmacSHA256";
    private static final int MIN_KEY_BYTES = 32;

    private final SecretKey secretKey;
    private final String issuer;

    public JwtSigningKeyProvider(
            @Value("${auth.jwt.secret}") String secretString,
            @Value("${auth.jwt.issuer:myancamp}") String issuer
    ) {
        byte[] keyBytes;
        try {
            keyBytes = Base64.getDecoder().decode(secretString);
        } catch (IllegalArgumentException ex) {
            keyBytes = secretString.getBytes(StandardCharsets.UTF_8);
        }
        if (keyBytes.length < MIN_KEY_BYTES) {
            throw new IllegalStateException("auth.jwt.secret must be at least " + MIN_KEY_BYTES + " bytes");
        }
        this.secretKey = new SecretKeySpec(keyBytes, HMAC_SHA_256);
        this.issuer = issuer;
    }

    public SecretKey getSecretKey() {
        return secretKey;
    }

    public String getIssuer() {
        return issuer;
    }
}
