package com.myancamp.backend.modules.auth.application;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Optional;

import com.myancamp.backend.modules.auth.domain.CampUser;
import com.myancamp.backend.modules.auth.domain.EmailVerificationToken;
import com.myancamp.backend.modules.auth.domain.PasswordResetToken;
import com.myancamp.backend.modules.auth.domain.SingleUseToken;
import com.myancamp.backend.modules.auth.domain.SingleUseTokenKind;
import com.myancamp.backend.modules.auth.infrastructure.persistence.EmailVerificationTokenRepository;
import com.myancamp.backend.modules.auth.infrastructure.persistence.PasswordResetTokenRepository;
import com.myancamp.backend.modules.auth.infrastructure.persistence.SingleUseTokenRepository;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

/**
 * Email-verification and password-reset tokens. A user holds at most one live token of each kind:
 * issuing a new one marks every earlier unused one as used.
 */
@Service
@Transactional(noRollbackFor = ResponseStatusException.class)
public class SingleUseTokenService {

    private static final int TOKEN_BYTES = 32;

    private final EmailVerificationTokenRepository emailVerificationTokenRepository;
    private final PasswordResetTokenRepository passwordResetTokenRepository;
    private final SecureRandom secureRandom;
    private final Clock clock;
    private final String clientUrl;

    public SingleUseTokenService(
            EmailVerificationTokenRepository emailVerificationTokenRepository,
            PasswordResetTokenRepository passwordResetTokenRepository,
            SecureRandom secureRandom,
            Clock clock,
            @Value("${app.client-url:http://localhost:5173}") String clientUrl
    ) {
        this.emailVerificationTokenRepository = emailVerificationTokenRepository;
        this.passwordResetTokenRepository = passwordResetTokenRepository;
        this.secureRandom = secureRandom;
        this.clock = clock;
        this.clientUrl = clientUrl.endsWith("/") ? clientUrl.substring(0, clientUrl.length() - 1) : clientUrl;
    }

    public IssuedSingleUseToken generate(SingleUseTokenKind kind, CampUser user, RequestMetadata meta) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        SingleUseTokenRepository<? extends SingleUseToken> repository = repositoryFor(kind);
        repository.invalidateOutstanding(user.getId(), now);

        String value = TokenHashing.randomHex(secureRandom, TOKEN_BYTES);
        SingleUseToken token = newToken(kind);
        token.setUser(user);
        token.setEmail(user.getEmail());
        token.setTokenHash(TokenHashing.sha256Hex(value));
        token.setIssuedAt(now);
        token.setExpiresAt(now.plus(kind.getTtl()));
        token.setIpAddress(meta.ipAddress());
        token.setUserAgent(meta.userAgent());
        save(kind, token);

        return new IssuedSingleUseToken(kind, value, token.getExpiresAt());
    }

    /**
     * Resolves a live token. Distinguishes used, expired and unknown values.
     */
    public SingleUseToken verify(SingleUseTokenKind kind, String value) {
        if (value == null || value.isBlank()) {
            throw new AuthException(AuthErrorCode.TOKEN_INVALID, "Token is required");
        }
        OffsetDateTime now = OffsetDateTime.now(clock);
        Optional<? extends SingleUseToken> found = repositoryFor(kind).findByTokenHash(TokenHashing.sha256Hex(value));
        if (found.isEmpty()) {
            throw new AuthException(AuthErrorCode.TOKEN_INVALID, "Invalid or unknown token");
        }
        SingleUseToken token = found.get();
        if (token.isUsed()) {
            throw new AuthException(AuthErrorCode.TOKEN_ALREADY_USED);
        }
        if (token.isExpiredAt(now)) {
            throw new AuthException(AuthErrorCode.TOKEN_EXPIRED);
        }
        return token;
    }

    /**
     * Flips the token to used. Only one caller can win; the loser gets {@code TOKEN_ALREADY_USED}.
     */
    public void consume(SingleUseTokenKind kind, String value) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        int updated = repositoryFor(kind).markUsedIfUnused(TokenHashing.sha256Hex(value), now);
        if (updated == 0) {
            throw new AuthException(AuthErrorCode.TOKEN_ALREADY_USED);
        }
    }

    /**
     * Owner of a token in any state. Used to answer repeated clicks on an already used link.
     */
    public Optional<CampUser> findOwner(SingleUseTokenKind kind, String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        return repositoryFor(kind).findByTokenHash(TokenHashing.sha256Hex(value)).map(SingleUseToken::getUser);
    }

    public String buildLink(SingleUseTokenKind kind, String value) {
        return clientUrl + kind.getClientPath() + "?token=" + URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    private SingleUseTokenRepository<? extends SingleUseToken> repositoryFor(SingleUseTokenKind kind) {
        return switch (kind) {
            case EMAIL_VERIFICATION -> emailVerificationTokenRepository;
            case PASSWORD_RESET -> passwordResetTokenRepository;
        };
    }

    private SingleUseToken newToken(SingleUseTokenKind kind) {
        return switch (kind) {
            case EMAIL_VERIFICATION -> new EmailVerificationToken();
            case PASSWORD_RESET -> new PasswordResetToken();
        };
    }

    private void save(SingleUseTokenKind kind, SingleUseToken token) {
        switch (kind) {
            case EMAIL_VERIFICATION -> emailVerificationTokenRepository.save((EmailVerificationToken) token);
            case PASSWORD_RESET -> passwordResetTokenRepository.save((PasswordResetToken) token);
        }
    }

    public record IssuedSingleUseToken(SingleUseTokenKind kind, String value, OffsetDateTime expiresAt) {
    }
}
