package com.myancamp.backend.modules.auth.application;

import com.myancamp.backend.modules.auth.infrastructure.persistence.BlacklistedTokenRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

@Component
public class AccessTokenAuthenticator {

    private static final Logger log = LoggerFactory.getLogger(AccessTokenAuthenticator.class);

    private final TokenIssuer tokenIssuer;
    private final BlacklistedTokenRepository blacklistedTokenRepository;

    public AccessTokenAuthenticator(TokenIssuer tokenIssuer, BlacklistedTokenRepository blacklistedTokenRepository) {
        this.tokenIssuer = tokenIssuer;
        this.blacklistedTokenRepository = blacklistedTokenRepository;
    }

    public AccessTokenCheck authenticate(String token) {
        return authenticate(token, TokenIssuer.TYPE_ACCESS);
    }

    public AccessTokenCheck authenticate(String token, String expectedType) {
        AccessTokenClaims claims;
        try {
            claims = tokenIssuer.parseAccessToken(token, expectedType);
        } catch (AuthException ex) {
            return AccessTokenCheck.rejected(ex.getErrorCode() == AuthErrorCode.TOKEN_EXPIRED
                    ? AccessTokenCheck.Outcome.EXPIRED
                    : AccessTokenCheck.Outcome.INVALID);
        }

        try {
            if (blacklistedTokenRepository.existsByTokenHash(TokenHashing.sha256Hex(token))) {
                return AccessTokenCheck.rejected(AccessTokenCheck.Outcome.REVOKED);
            }
        } catch (DataAccessException ex) {
            log.error("Blacklist lookup failed for user {}; rejecting the token", claims.userId(), ex);
            return AccessTokenCheck.rejected(AccessTokenCheck.Outcome.STORE_UNAVAILABLE);
        }
        return AccessTokenCheck.authenticated(claims);
    }
}
