package com.myancamp.backend.modules.auth.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.myancamp.backend.modules.auth.infrastructure.persistence.BlacklistedTokenRepository;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

@ExtendWith(MockitoExtension.class)
class AccessTokenAuthenticatorTest {

    private static final String TOKEN = "header.payload.signature";

    @Mock
    private TokenIssuer tokenIssuer;

    @Mock
    private BlacklistedTokenRepository blacklistedTokenRepository;

    private AccessTokenAuthenticator authenticator;
    private AccessTokenClaims claims;

    @BeforeEach
    void setUp() {
        authenticator = new AccessTokenAuthenticator(tokenIssuer, blacklistedTokenRepository);
        OffsetDateTime now = OffsetDateTime.parse("2025-03-01T08:00:00Z");
        claims = new AccessTokenClaims(UUID.randomUUID(), "ma_hnin", "hnin@example.com", false, false,
                TokenIssuer.TYPE_ACCESS, now, now.plusMinutes(15));
    }

    @Test
    void validTokenNotOnBlacklistAuthenticates() {
        when(tokenIssuer.parseAccessToken(TOKEN, TokenIssuer.TYPE_ACCESS)).thenReturn(claims);
        when(blacklistedTokenRepository.existsByTokenHash(TokenHashing.sha256Hex(TOKEN))).thenReturn(false);

        AccessTokenCheck check = authenticator.authenticate(TOKEN);

        assertThat(check.isAuthenticated()).isTrue();
        assertThat(check.claims()).isEqualTo(claims);
    }

    @Test
    void blacklistedTokenIsRevoked() {
        when(tokenIssuer.parseAccessToken(TOKEN, TokenIssuer.TYPE_ACCESS)).thenReturn(claims);
        when(blacklistedTokenRepository.existsByTokenHash(TokenHashing.sha256Hex(TOKEN))).thenReturn(true);

        assertThat(authenticator.authenticate(TOKEN).outcome()).isEqualTo(AccessTokenCheck.Outcome.REVOKED);
    }

    @Test
    void blacklistOutageFailsClosed() {
        when(tokenIssuer.parseAccessToken(TOKEN, TokenIssuer.TYPE_ACCESS)).thenReturn(claims);
        when(blacklistedTokenRepository.existsByTokenHash(anyString()))
                .thenThrow(new DataAccessResourceFailureException("connection refused"));

        AccessTokenCheck check = authenticator.authenticate(TOKEN);

        assertThat(check.outcome()).isEqualTo(AccessTokenCheck.Outcome.STORE_UNAVAILABLE);
        assertThat(check.claims()).isNull();
    }

    @Test
    void expiredTokenSkipsBlacklistLookup() {
        when(tokenIssuer.parseAccessToken(TOKEN, TokenIssuer.TYPE_ACCESS))
                .thenThrow(new AuthException(AuthErrorCode.TOKEN_EXPIRED));

        assertThat(authenticator.authenticate(TOKEN).outcome()).isEqualTo(AccessTokenCheck.Outcome.EXPIRED);
        verify(blacklistedTokenRepository, never()).existsByTokenHash(anyString());
    }

    @Test
    void malformedTokenIsInvalid() {
        when(tokenIssuer.parseAccessToken(TOKEN, TokenIssuer.TYPE_ACCESS))
                .thenThrow(new AuthException(AuthErrorCode.TOKEN_INVALID));

        assertThat(authenticator.authenticate(TOKEN).outcome()).isEqualTo(AccessTokenCheck.Outcome.INVALID);
    }
}
