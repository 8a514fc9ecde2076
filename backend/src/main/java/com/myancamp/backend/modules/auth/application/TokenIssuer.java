package com.myancamp.backend.modules.auth.application;

import java.io.IOException;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Base64;
import java.util.Date;
import java.util.Optional;
import java.util.UUID;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.myancamp.backend.modules.auth.domain.CampUser;
import com.myancamp.backend.modules.auth.domain.RefreshToken;
import com.myancamp.backend.modules.auth.infrastructure.jwt.JwtSigningKeyProvider;
import com.myancamp.backend.modules.auth.infrastructure.persistence.RefreshTokenRepository;
import com.myancamp.backend.modules.auth.presentation.dto.TokenPairResponse;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.Jwts.SIG;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Issues the signed access token, the short-lived two-factor challenge token and the opaque
 * refresh token. Refresh tokens are persisted as hashes and verified by lookup only.
 */
@Service
public class TokenIssuer {

    public static final String TYPE_ACCESS = "access";
    public static final String TYPE_TWO_FACTOR_PENDING = "two_factor_pending";

    static final String CLAIM_USERNAME = "username";
    static final String CLAIM_EMAIL = "email";
    static final String CLAIM_IS_ADMIN = "isAdmin";
    static final String CLAIM_IS_OWNER = "isOwner";
    static final String CLAIM_TOKEN_TYPE = "tokenType";

    private static final int REFRESH_TOKEN_BYTES = 40;

    private final JwtSigningKeyProvider keyProvider;
    private final RefreshTokenRepository refreshTokenRepository;
    private final ObjectMapper objectMapper;
    private final SecureRandom secureRandom;
    private final Clock clock;
    private final Duration accessTtl;
    private final Duration twoFactorTtl;
    private final Duration refreshTtl;

    public TokenIssuer(
            JwtSigningKeyProvider keyProvider,
            RefreshTokenRepository refreshTokenRepository,
            ObjectMapper objectMapper,
            SecureRandom secureRandom,
            Clock clock,
            @Value("${auth.jwt.access-ttl:15m}") Duration accessTtl,
            @Value("${auth.jwt.two-factor-ttl:10m}") Duration twoFactorTtl,
            @Value("${auth.jwt.refresh-ttl:7d}") Duration refreshTtl
    ) {
        this.keyProvider = keyProvider;
        this.refreshTokenRepository = refreshTokenRepository;
        this.objectMapper = objectMapper;
        this.secureRandom = secureRandom;
        this.clock = clock;
        this.accessTtl = accessTtl;
        this.twoFactorTtl = twoFactorTtl;
        this.refreshTtl = refreshTtl;
    }

    public IssuedToken issueAccess(CampUser user) {
        return sign(user, TYPE_ACCESS, accessTtl);
    }

    public IssuedToken issueTwoFactorChallenge(CampUser user) {
        return sign(user, TYPE_TWO_FACTOR_PENDING, twoFactorTtl);
    }

    public IssuedToken issueRefresh(CampUser user, RequestMetadata meta) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        OffsetDateTime expiresAt = now.plus(refreshTtl);
        String value = TokenHashing.randomHex(secureRandom, REFRESH_TOKEN_BYTES);

        RefreshToken refreshToken = new RefreshToken();
        refreshToken.setUser(user);
        refreshToken.setTokenHash(TokenHashing.sha256Hex(value));
        refreshToken.setIssuedAt(now);
        refreshToken.setExpiresAt(expiresAt);
        refreshToken.setIpAddress(meta.ipAddress());
        refreshToken.setUserAgent(meta.userAgent());
        refreshTokenRepository.save(refreshToken);

        return new IssuedToken(value, now, expiresAt);
    }

    public TokenPairResponse issuePair(CampUser user, RequestMetadata meta) {
        IssuedToken access = issueAccess(user);
        IssuedToken refresh = issueRefresh(user, meta);
        return new TokenPairResponse(
                access.value(),
                TokenPairResponse.DEFAULT_TOKEN_TYPE,
                accessTtl.toSeconds(),
                refresh.value(),
                refreshTtl.toSeconds(),
                refresh.expiresAt(),
                access.issuedAt()
        );
    }

    /**
     * Verifies signature, issuer, expiry and token type.
     *
     * @throws AuthException {@code TOKEN_EXPIRED} for an expired token, {@code TOKEN_INVALID} otherwise
     */
    public AccessTokenClaims parseAccessToken(String token, String expectedType) {
        Claims claims;
        try {
            claims = Jwts.parser()
                    .verifyWith(keyProvider.getSecretKey())
                    .requireIssuer(keyProvider.getIssuer())
                    .clock(() -> Date.from(clock.instant()))
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();
        } catch (ExpiredJwtException e) {
            throw new AuthException(AuthErrorCode.TOKEN_EXPIRED, "Token has expired", e);
        } catch (JwtException | IllegalArgumentException e) {
            throw new AuthException(AuthErrorCode.TOKEN_INVALID, "Token is invalid", e);
        }

        try {
            String tokenType = claims.get(CLAIM_TOKEN_TYPE, String.class);
            if (!expectedType.equals(tokenType)) {
                throw new AuthException(AuthErrorCode.TOKEN_INVALID, "Token is invalid");
            }
            if (claims.getSubject() == null || claims.getIssuedAt() == null || claims.getExpiration() == null) {
                throw new AuthException(AuthErrorCode.TOKEN_INVALID, "Token is invalid");
            }
            return new AccessTokenClaims(
                    UUID.fromString(claims.getSubject()),
                    claims.get(CLAIM_USERNAME, String.class),
                    claims.get(CLAIM_EMAIL, String.class),
                    Boolean.TRUE.equals(claims.get(CLAIM_IS_ADMIN, Boolean.class)),
                    Boolean.TRUE.equals(claims.get(CLAIM_IS_OWNER, Boolean.class)),
                    tokenType,
                    OffsetDateTime.ofInstant(claims.getIssuedAt().toInstant(), ZoneOffset.UTC),
                    OffsetDateTime.ofInstant(claims.getExpiration().toInstant(), ZoneOffset.UTC)
            );
        } catch (JwtException | IllegalArgumentException e) {
            throw new AuthException(AuthErrorCode.TOKEN_INVALID, "Token is invalid", e);
        }
    }

    /**
     * Reads {@code exp} from the payload without checking the signature. Only used to bound how
     * long a blacklist row is kept.
     */
    public Optional<OffsetDateTime> decodeExpiry(String token) {
        if (token == null) {
            return Optional.empty();
        }
        String[] parts = token.split("\\.");
        if (parts.length < 2) {
            return Optional.empty();
        }
        try {
            byte[] payload = Base64.getUrlDecoder().decode(parts[1]);
            JsonNode exp = objectMapper.readTree(payload).get("exp");
            if (exp == null || !exp.canConvertToLong()) {
                return Optional.empty();
            }
            return Optional.of(OffsetDateTime.ofInstant(Instant.ofEpochSecond(exp.asLong()), ZoneOffset.UTC));
        } catch (IllegalArgumentException | IOException e) {
            return Optional.empty();
        }
    }

    public Duration getAccessTtl() {
        return accessTtl;
    }

    public Duration getTwoFactorTtl() {
        return twoFactorTtl;
    }

    public Duration getRefreshTtl() {
        return refreshTtl;
    }

    private IssuedToken sign(CampUser user, String tokenType, Duration ttl) {
        Instant now = clock.instant();
        Instant expiry = now.plus(ttl);

        String token = Jwts.builder()
                .id(UUID.randomUUID().toString())
                .issuer(keyProvider.getIssuer())
                .subject(user.getId().toString())
                .issuedAt(Date.from(now))
                .expiration(Date.from(expiry))
                .claim(CLAIM_USERNAME, user.getUsername())
                .claim(CLAIM_EMAIL, user.getEmail())
                .claim(CLAIM_IS_ADMIN, user.isAdmin())
                .claim(CLAIM_IS_OWNER, user.isOwner())
                .claim(CLAIM_TOKEN_TYPE, tokenType)
                .signWith(keyProvider.getSecretKey(), SIG.HS256)
                .compact();

        return new IssuedToken(
                token,
                OffsetDateTime.ofInstant(now, ZoneOffset.UTC),
                OffsetDateTime.ofInstant(expiry, ZoneOffset.UTC)
        );
    }

    public record IssuedToken(String value, OffsetDateTime issuedAt, OffsetDateTime expiresAt) {
    }
}
