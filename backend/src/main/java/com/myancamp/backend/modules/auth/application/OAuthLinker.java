package com.myancamp.backend.modules.auth.application;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import com.myancamp.backend.modules.audit.application.AuditLogService;
import com.myancamp.backend.modules.audit.domain.AuditAction;
import com.myancamp.backend.modules.auth.domain.CampUser;
import com.myancamp.backend.modules.auth.domain.OAuthProvider;
import com.myancamp.backend.modules.auth.infrastructure.oauth.OAuthProfile;
import com.myancamp.backend.modules.auth.infrastructure.oauth.OAuthProviderClient;
import com.myancamp.backend.modules.auth.infrastructure.oauth.OAuthProviderException;
import com.myancamp.backend.modules.auth.infrastructure.persistence.CampUserRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

/**
 * Maps an external identity onto a local account: by provider id, then by email, otherwise a new
 * account. An email match on an account that has its own password is never linked implicitly.
 */
@Service
@Transactional(noRollbackFor = ResponseStatusException.class, rollbackFor = DuplicateAccountException.class)
public class OAuthLinker {

    private static final Logger log = LoggerFactory.getLogger(OAuthLinker.class);

    static final String PLACEHOLDER_EMAIL_DOMAIN = "@placeholder.invalid";
    private static final int PLACEHOLDER_PASSWORD_BYTES = 16;
    private static final int USERNAME_BASE_MAX_LENGTH = 40;
    private static final int USERNAME_ATTEMPTS = 5;

    private final CampUserRepository campUserRepository;
    private final Map<OAuthProvider, OAuthProviderClient> clients;
    private final PasswordHasher passwordHasher;
    private final AuditLogService auditLogService;
    private final SecureRandom secureRandom;
    private final Clock clock;

    public OAuthLinker(
            CampUserRepository campUserRepository,
            List<OAuthProviderClient> providerClients,
            PasswordHasher passwordHasher,
            AuditLogService auditLogService,
            SecureRandom secureRandom,
            Clock clock
    ) {
        this.campUserRepository = campUserRepository;
        this.clients = new EnumMap<>(OAuthProvider.class);
        providerClients.forEach(client -> clients.put(client.provider(), client));
        this.passwordHasher = passwordHasher;
        this.auditLogService = auditLogService;
        this.secureRandom = secureRandom;
        this.clock = clock;
    }

    public OAuthProfile fetchProfile(OAuthProvider provider, String code, String redirectUri) {
        OAuthProviderClient client = clients.get(provider);
        if (client == null) {
            throw new AuthException(AuthErrorCode.VALIDATION_ERROR, "Unsupported OAuth provider");
        }
        try {
            String providerAccessToken = client.exchangeCode(code, redirectUri);
            return client.fetchProfile(providerAccessToken);
        } catch (OAuthProviderException ex) {
            log.warn("{} OAuth exchange failed: {}", provider, ex.getMessage());
            throw new AuthException(AuthErrorCode.OAUTH_PROVIDER_ERROR,
                    "Failed to authenticate with " + displayName(provider), ex);
        }
    }

    public LinkResult resolve(OAuthProfile profile, RequestMetadata meta) {
        OAuthProvider provider = profile.provider();
        Optional<CampUser> bySubject = findBySubject(provider, profile.subjectId());
        if (bySubject.isPresent()) {
            return new LinkResult(bySubject.get(), LinkOutcome.EXISTING);
        }

        if (hasText(profile.email())) {
            Optional<CampUser> byEmail = campUserRepository.findByEmailIgnoreCase(profile.email());
            if (byEmail.isPresent()) {
                CampUser existing = byEmail.get();
                if (existing.hasLocalPassword()) {
                    auditLogService.recordUserEvent(AuditAction.OAUTH_CONFLICT, existing.getId(), meta.ipAddress(),
                            Map.of("provider", provider.name()));
                    throw new AuthException(AuthErrorCode.OAUTH_CONFLICT);
                }
                existing.linkProvider(provider, profile.subjectId());
                saveAndFlush(existing);
                auditLogService.recordUserEvent(AuditAction.OAUTH_ACCOUNT_LINKED, existing.getId(), meta.ipAddress(),
                        Map.of("provider", provider.name()));
                log.info("Linked {} identity to user {}", provider, existing.getId());
                return new LinkResult(existing, LinkOutcome.LINKED);
            }
        }

        CampUser created = createAccount(profile);
        auditLogService.recordUserEvent(AuditAction.OAUTH_ACCOUNT_CREATED, created.getId(), meta.ipAddress(),
                Map.of("provider", provider.name()));
        log.info("Created user {} from {} identity", created.getId(), provider);
        return new LinkResult(created, LinkOutcome.CREATED);
    }

    private Optional<CampUser> findBySubject(OAuthProvider provider, String subjectId) {
        return switch (provider) {
            case GOOGLE -> campUserRepository.findByGoogleId(subjectId);
            case FACEBOOK -> campUserRepository.findByFacebookId(subjectId);
        };
    }

    private CampUser createAccount(OAuthProfile profile) {
        boolean providerSuppliedEmail = hasText(profile.email());
        String email = providerSuppliedEmail
                ? profile.email()
                : placeholderPrefix(profile.provider()) + "_" + profile.subjectId() + PLACEHOLDER_EMAIL_DOMAIN;

        CampUser user = new CampUser();
        user.setUsername(generateUsername(email));
        user.setEmail(email);
        user.setPasswordHash(passwordHasher.hash(TokenHashing.randomHex(secureRandom, PLACEHOLDER_PASSWORD_BYTES)));
        user.setLocalPassword(false);
        user.linkProvider(profile.provider(), profile.subjectId());
        if (providerSuppliedEmail) {
            user.markEmailVerified(OffsetDateTime.now(clock));
        }
        return saveAndFlush(user);
    }

    private CampUser saveAndFlush(CampUser user) {
        try {
            return campUserRepository.saveAndFlush(user);
        } catch (DataIntegrityViolationException ex) {
            throw new DuplicateAccountException("This identity was linked by another request, please retry", ex);
        }
    }

    String generateUsername(String email) {
        String localPart = email.substring(0, Math.max(email.indexOf('@'), 0))
                .replaceAll("[^A-Za-z0-9._]", "");
        if (localPart.isEmpty()) {
            localPart = "camper";
        }
        if (localPart.length() > USERNAME_BASE_MAX_LENGTH) {
            localPart = localPart.substring(0, USERNAME_BASE_MAX_LENGTH);
        }
        String millis = Long.toString(clock.millis());
        String candidate = localPart + "_" + millis.substring(millis.length() - 4);
        for (int attempt = 0; attempt < USERNAME_ATTEMPTS && campUserRepository.existsByUsernameIgnoreCase(candidate); attempt++) {
            candidate = localPart + "_" + String.format("%04d", secureRandom.nextInt(10_000));
        }
        if (campUserRepository.existsByUsernameIgnoreCase(candidate)) {
            candidate = localPart + "_" + TokenHashing.randomHex(secureRandom, 4);
        }
        return candidate;
    }

    private static String placeholderPrefix(OAuthProvider provider) {
        return switch (provider) {
            case GOOGLE -> "google";
            case FACEBOOK -> "fb";
        };
    }

    private static String displayName(OAuthProvider provider) {
        String name = provider.name().toLowerCase(Locale.ROOT);
        return Character.toUpperCase(name.charAt(0)) + name.substring(1);
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    public enum LinkOutcome {
        EXISTING,
        LINKED,
        CREATED
    }

    public record LinkResult(CampUser user, LinkOutcome outcome) {
    }
}
