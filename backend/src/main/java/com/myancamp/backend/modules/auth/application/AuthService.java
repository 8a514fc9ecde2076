package com.myancamp.backend.modules.auth.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import com.myancamp.backend.modules.audit.application.AuditLogService;
import com.myancamp.backend.modules.audit.domain.AuditAction;
import com.myancamp.backend.modules.auth.domain.BlacklistReason;
import com.myancamp.backend.modules.auth.domain.CampUser;
import com.myancamp.backend.modules.auth.domain.OAuthProvider;
import com.myancamp.backend.modules.auth.domain.PasswordChangeEvent;
import com.myancamp.backend.modules.auth.domain.SingleUseToken;
import com.myancamp.backend.modules.auth.domain.SingleUseTokenKind;
import com.myancamp.backend.modules.auth.infrastructure.oauth.OAuthProfile;
import com.myancamp.backend.modules.auth.infrastructure.persistence.CampUserRepository;
import com.myancamp.backend.modules.auth.presentation.dto.AuthStatusResponse;
import com.myancamp.backend.modules.auth.presentation.dto.EmailVerificationResponse;
import com.myancamp.backend.modules.auth.presentation.dto.ForgotPasswordRequest;
import com.myancamp.backend.modules.auth.presentation.dto.LoginRequest;
import com.myancamp.backend.modules.auth.presentation.dto.LoginResponse;
import com.myancamp.backend.modules.auth.presentation.dto.LogoutRequest;
import com.myancamp.backend.modules.auth.presentation.dto.MessageResponse;
import com.myancamp.backend.modules.auth.presentation.dto.OAuthLoginRequest;
import com.myancamp.backend.modules.auth.presentation.dto.RefreshRequest;
import com.myancamp.backend.modules.auth.presentation.dto.RegisterRequest;
import com.myancamp.backend.modules.auth.presentation.dto.RegisterResponse;
import com.myancamp.backend.modules.auth.presentation.dto.ResetPasswordRequest;
import com.myancamp.backend.modules.auth.presentation.dto.TokenPairResponse;
import com.myancamp.backend.modules.auth.presentation.dto.TwoFactorEnabledResponse;
import com.myancamp.backend.modules.auth.presentation.dto.TwoFactorLoginRequest;
import com.myancamp.backend.modules.auth.presentation.dto.TwoFactorSetupResponse;
import com.myancamp.backend.modules.auth.presentation.dto.UserProfileResponse;
import com.myancamp.backend.modules.auth.presentation.dto.UserSummaryResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

/**
 * Entry point for every authentication flow. Controllers talk only to this class.
 *
 * <p>Rejections are {@link AuthException}s and do not roll back: a revoked token or a freshly
 * issued verification token stays committed even though the request fails. The exception is
 * {@link DuplicateAccountException}, which rolls back the insert that collided.</p>
 */
@Service
@Transactional(noRollbackFor = ResponseStatusException.class, rollbackFor = DuplicateAccountException.class)
public class AuthService {

    private static final Logger log = LoggerFactory.getLogger(AuthService.class);

    static final String MSG_REGISTERED =
            "Registration successful. Please check your email to verify your account before logging in.";
    static final String MSG_NOT_VERIFIED =
            "Please verify your email address. A new verification email has been sent.";
    static final String MSG_RESET_REQUESTED =
            "If your email is registered, you will receive a password reset link shortly.";
    static final String MSG_EMAIL_VERIFIED = "Email verified successfully";
    static final String MSG_DUPLICATE_ACCOUNT = "A user with that email or username already exists";
    static final String MSG_ALREADY_VERIFIED = "Email already verified. You can now login to your account.";

    private final CampUserRepository campUserRepository;
    private final PasswordHasher passwordHasher;
    private final PasswordPolicy passwordPolicy;
    private final TokenIssuer tokenIssuer;
    private final RevocationService revocationService;
    private final AccessTokenAuthenticator accessTokenAuthenticator;
    private final SingleUseTokenService singleUseTokenService;
    private final TwoFactorService twoFactorService;
    private final OAuthLinker oAuthLinker;
    private final AccountSuspensionChecker suspensionChecker;
    private final AuthNotificationService notificationService;
    private final AuditLogService auditLogService;
    private final Clock clock;

    public AuthService(
            CampUserRepository campUserRepository,
            PasswordHasher passwordHasher,
            PasswordPolicy passwordPolicy,
            TokenIssuer tokenIssuer,
            RevocationService revocationService,
            AccessTokenAuthenticator accessTokenAuthenticator,
            SingleUseTokenService singleUseTokenService,
            TwoFactorService twoFactorService,
            OAuthLinker oAuthLinker,
            AccountSuspensionChecker suspensionChecker,
            AuthNotificationService notificationService,
            AuditLogService auditLogService,
            Clock clock
    ) {
        this.campUserRepository = campUserRepository;
        this.passwordHasher = passwordHasher;
        this.passwordPolicy = passwordPolicy;
        this.tokenIssuer = tokenIssuer;
        this.revocationService = revocationService;
        this.accessTokenAuthenticator = accessTokenAuthenticator;
        this.singleUseTokenService = singleUseTokenService;
        this.twoFactorService = twoFactorService;
        this.oAuthLinker = oAuthLinker;
        this.suspensionChecker = suspensionChecker;
        this.notificationService = notificationService;
        this.auditLogService = auditLogService;
        this.clock = clock;
    }

    public RegisterResponse register(RegisterRequest request, RequestMetadata meta) {
        passwordPolicy.validate(request.password());
        String email = request.email().trim();
        String username = request.username().trim();
        if (campUserRepository.existsByUsernameIgnoreCase(username) || campUserRepository.existsByEmailIgnoreCase(email)) {
            throw new AuthException(AuthErrorCode.VALIDATION_ERROR, MSG_DUPLICATE_ACCOUNT);
        }

        CampUser user = new CampUser();
        user.setUsername(username);
        user.setEmail(email);
        user.setPhone(request.phone());
        user.setPasswordHash(passwordHasher.hash(request.password()));
        user.setLocalPassword(true);
        try {
            campUserRepository.saveAndFlush(user);
        } catch (DataIntegrityViolationException ex) {
            throw new DuplicateAccountException(MSG_DUPLICATE_ACCOUNT, ex);
        }

        auditLogService.recordUserEvent(AuditAction.USER_REGISTERED, user.getId(), meta.ipAddress(), null);
        log.info("Registered user {}", user.getId());
        sendVerification(user, meta);
        return new RegisterResponse(UserSummaryResponse.from(user), MSG_REGISTERED);
    }

    /**
     * Checks run in a fixed order: credentials, suspension, email verification, then the
     * two-factor gate.
     */
    public LoginResponse login(LoginRequest request, RequestMetadata meta) {
        CampUser user = campUserRepository.findByUsername(request.username().trim())
                .orElseThrow(() -> new AuthException(AuthErrorCode.INVALID_CREDENTIALS));

        if (!passwordHasher.matches(request.password(), user.getPasswordHash())) {
            auditLogService.recordUserEvent(AuditAction.LOGIN_FAILED, user.getId(), meta.ipAddress(), null);
            throw new AuthException(AuthErrorCode.INVALID_CREDENTIALS);
        }

        suspensionChecker.ensureNotSuspended(user);

        if (!user.isEmailVerified()) {
            sendVerification(user, meta);
            throw new AuthException(AuthErrorCode.ACCOUNT_NOT_VERIFIED, MSG_NOT_VERIFIED);
        }

        if (user.isTwoFactorEnabled()) {
            return beginTwoFactorChallenge(user);
        }
        return completeLogin(user, meta, null);
    }

    public LoginResponse refresh(RefreshRequest request, RequestMetadata meta) {
        RevocationService.RotationResult rotation = revocationService.rotate(request.refreshToken(), meta);
        return LoginResponse.authenticated(rotation.tokens(), UserSummaryResponse.from(rotation.user()));
    }

    /**
     * Revokes the refresh token and, when a bearer token accompanies the request, blacklists it.
     * Unknown tokens get the same answer so token validity is not disclosed.
     */
    public MessageResponse logout(LogoutRequest request, String bearerToken, RequestMetadata meta) {
        revocationService.revokeRefreshToken(request.refreshToken(), RevocationService.REASON_LOGOUT);
        if (bearerToken != null) {
            AccessTokenCheck check = accessTokenAuthenticator.authenticate(bearerToken);
            if (check.isAuthenticated()) {
                UUID userId = check.claims().userId();
                revocationService.blacklistAccess(bearerToken, userId, BlacklistReason.LOGOUT, meta);
                auditLogService.recordUserEvent(AuditAction.LOGOUT, userId, meta.ipAddress(), null);
            }
        }
        return new MessageResponse("Logged out successfully");
    }

    public MessageResponse logoutAll(UUID userId, String bearerToken, RequestMetadata meta) {
        int revoked = revocationService.revokeAllUserTokens(userId, RevocationService.REASON_LOGOUT_ALL);
        if (bearerToken != null) {
            revocationService.blacklistAccess(bearerToken, userId, BlacklistReason.LOGOUT_ALL, meta);
        }
        auditLogService.recordUserEvent(AuditAction.LOGOUT_ALL, userId, meta.ipAddress(), Map.of("revokedRefreshTokens", revoked));
        return new MessageResponse("Logged out from all devices successfully");
    }

    public EmailVerificationResponse verifyEmail(String token, RequestMetadata meta) {
        SingleUseToken verification;
        try {
            verification = singleUseTokenService.verify(SingleUseTokenKind.EMAIL_VERIFICATION, token);
        } catch (AuthException ex) {
            if (ex.getErrorCode() == AuthErrorCode.TOKEN_ALREADY_USED) {
                Optional<CampUser> owner = singleUseTokenService.findOwner(SingleUseTokenKind.EMAIL_VERIFICATION, token);
                if (owner.isPresent() && owner.get().isEmailVerified()) {
                    return new EmailVerificationResponse(MSG_ALREADY_VERIFIED, UserSummaryResponse.from(owner.get()));
                }
            }
            throw ex;
        }

        CampUser user = verification.getUser();
        boolean alreadyVerified = user.isEmailVerified();
        user.markEmailVerified(OffsetDateTime.now(clock));
        singleUseTokenService.consume(SingleUseTokenKind.EMAIL_VERIFICATION, token);

        if (alreadyVerified) {
            return new EmailVerificationResponse(MSG_ALREADY_VERIFIED, UserSummaryResponse.from(user));
        }
        auditLogService.recordUserEvent(AuditAction.EMAIL_VERIFIED, user.getId(), meta.ipAddress(), null);
        notificationService.sendWelcomeEmail(user);
        return new EmailVerificationResponse(MSG_EMAIL_VERIFIED, UserSummaryResponse.from(user));
    }

    public MessageResponse resendVerification(UUID userId, RequestMetadata meta) {
        CampUser user = requireUser(userId);
        if (user.isEmailVerified()) {
            throw new AuthException(AuthErrorCode.VALIDATION_ERROR, "Email is already verified");
        }
        sendVerification(user, meta);
        return new MessageResponse("Verification email sent successfully");
    }

    /**
     * Same response whether or not the address belongs to an account.
     */
    public MessageResponse requestPasswordReset(ForgotPasswordRequest request, RequestMetadata meta) {
        Optional<CampUser> found = campUserRepository.findByEmailIgnoreCase(request.email().trim());
        if (found.isPresent()) {
            CampUser user = found.get();
            SingleUseTokenService.IssuedSingleUseToken issued =
                    singleUseTokenService.generate(SingleUseTokenKind.PASSWORD_RESET, user, meta);
            notificationService.sendPasswordResetEmail(user,
                    singleUseTokenService.buildLink(SingleUseTokenKind.PASSWORD_RESET, issued.value()));
            auditLogService.recordUserEvent(AuditAction.PASSWORD_RESET_REQUESTED, user.getId(), meta.ipAddress(), null);
        } else {
            log.debug("Password reset requested for an unknown address");
        }
        return new MessageResponse(MSG_RESET_REQUESTED);
    }

    /**
     * Sets the new password, consumes the token and signs the user out everywhere. Writing the
     * hash before consuming keeps a retried request harmless.
     */
    public MessageResponse resetPassword(ResetPasswordRequest request, RequestMetadata meta) {
        passwordPolicy.validate(request.password());
        SingleUseToken resetToken = singleUseTokenService.verify(SingleUseTokenKind.PASSWORD_RESET, request.token());

        CampUser user = resetToken.getUser();
        user.setPasswordHash(passwordHasher.hash(request.password()));
        user.setLocalPassword(true);
        user.recordPasswordChange(new PasswordChangeEvent(
                OffsetDateTime.now(clock), PasswordChangeEvent.REASON_RESET, meta.ipAddress(), meta.userAgent()));
        singleUseTokenService.consume(SingleUseTokenKind.PASSWORD_RESET, request.token());
        revocationService.revokeAllUserTokens(user.getId(), RevocationService.REASON_PASSWORD_RESET);

        auditLogService.recordUserEvent(AuditAction.PASSWORD_RESET, user.getId(), meta.ipAddress(), null);
        notificationService.sendPasswordChangedEmail(user);
        return new MessageResponse("Password has been reset successfully. You can now log in with your new password.");
    }

    public TwoFactorSetupResponse setupTwoFactor(UUID userId) {
        CampUser user = requireUser(userId);
        TwoFactorService.TwoFactorSetup setup = twoFactorService.initiateSetup(user);
        return new TwoFactorSetupResponse(setup.secret(), setup.otpauthUrl(),
                "Add the secret or otpauth URL to your authenticator app, then confirm with a code");
    }

    public TwoFactorEnabledResponse confirmTwoFactor(UUID userId, String code, RequestMetadata meta) {
        CampUser user = requireUser(userId);
        List<String> backupCodes = twoFactorService.confirmSetup(user, code);
        auditLogService.recordUserEvent(AuditAction.TWO_FACTOR_ENABLED, user.getId(), meta.ipAddress(), null);
        notificationService.sendTwoFactorChangedEmail(user, true);
        return new TwoFactorEnabledResponse("Two-factor authentication enabled successfully", backupCodes);
    }

    public LoginResponse verifyTwoFactorLogin(TwoFactorLoginRequest request, RequestMetadata meta) {
        AccessTokenCheck check = accessTokenAuthenticator.authenticate(
                request.twoFactorToken(), TokenIssuer.TYPE_TWO_FACTOR_PENDING);
        if (!check.isAuthenticated()) {
            throw new AuthException(check.outcome() == AccessTokenCheck.Outcome.EXPIRED
                    ? AuthErrorCode.TOKEN_EXPIRED
                    : AuthErrorCode.TOKEN_INVALID);
        }

        CampUser user = requireUser(check.claims().userId());
        suspensionChecker.ensureNotSuspended(user);

        TwoFactorService.ChallengeResult result =
                twoFactorService.completeChallenge(user, request.code(), request.useBackupCode());
        if (result.usedBackupCode()) {
            auditLogService.recordUserEvent(AuditAction.TWO_FACTOR_BACKUP_CODE_USED, user.getId(), meta.ipAddress(),
                    Map.of("remaining", result.remainingBackupCodes()));
        }
        // the pending token is good for one completion; a concurrent completion loses the insert
        if (!revocationService.blacklistAccess(request.twoFactorToken(), user.getId(),
                BlacklistReason.TWO_FACTOR_COMPLETED, meta)) {
            throw new AuthException(AuthErrorCode.TOKEN_INVALID);
        }
        return completeLogin(user, meta, result.remainingBackupCodes());
    }

    public MessageResponse disableTwoFactor(UUID userId, String code, RequestMetadata meta) {
        CampUser user = requireUser(userId);
        twoFactorService.disable(user, code);
        auditLogService.recordUserEvent(AuditAction.TWO_FACTOR_DISABLED, user.getId(), meta.ipAddress(), null);
        notificationService.sendTwoFactorChangedEmail(user, false);
        return new MessageResponse("Two-factor authentication disabled successfully");
    }

    public LoginResponse oauthLogin(String providerName, OAuthLoginRequest request, RequestMetadata meta) {
        OAuthProvider provider = OAuthProvider.fromPath(providerName)
                .orElseThrow(() -> new AuthException(AuthErrorCode.VALIDATION_ERROR, "Unsupported OAuth provider"));
        OAuthProfile profile = oAuthLinker.fetchProfile(provider, request.code(), request.redirectUri());
        CampUser user = oAuthLinker.resolve(profile, meta).user();

        suspensionChecker.ensureNotSuspended(user);
        if (user.isTwoFactorEnabled()) {
            return beginTwoFactorChallenge(user);
        }
        return completeLogin(user, meta, null);
    }

    @Transactional(readOnly = true)
    public AuthStatusResponse authStatus(Optional<UUID> userId) {
        return userId.flatMap(campUserRepository::findById)
                .map(user -> new AuthStatusResponse(true, UserSummaryResponse.from(user), user.isEmailVerified(), false))
                .orElseGet(AuthStatusResponse::anonymous);
    }

    @Transactional(readOnly = true)
    public UserProfileResponse loadProfile(UUID userId) {
        CampUser user = requireUser(userId);
        List<String> roles = new ArrayList<>();
        roles.add("USER");
        if (user.isOwner()) {
            roles.add("OWNER");
        }
        if (user.isAdmin()) {
            roles.add("ADMIN");
        }
        List<String> linkedProviders = new ArrayList<>();
        for (OAuthProvider provider : OAuthProvider.values()) {
            if (user.getProviderId(provider) != null) {
                linkedProviders.add(provider.name());
            }
        }
        return new UserProfileResponse(
                user.getId(),
                user.getUsername(),
                user.getEmail(),
                user.getPhone(),
                roles,
                user.isAdmin(),
                user.isOwner(),
                user.isEmailVerified(),
                user.getEmailVerifiedAt(),
                user.isTwoFactorEnabled(),
                linkedProviders,
                user.getLastLoginAt(),
                user.getCreatedAt(),
                user.getUpdatedAt()
        );
    }

    private LoginResponse beginTwoFactorChallenge(CampUser user) {
        TokenIssuer.IssuedToken challenge = tokenIssuer.issueTwoFactorChallenge(user);
        log.info("Two-factor challenge issued for user {}", user.getId());
        return LoginResponse.twoFactorChallenge(
                challenge.value(), tokenIssuer.getTwoFactorTtl().toSeconds(), UserSummaryResponse.from(user));
    }

    private LoginResponse completeLogin(CampUser user, RequestMetadata meta, Long remainingBackupCodes) {
        user.recordLogin(OffsetDateTime.now(clock), meta.ipAddress());
        TokenPairResponse tokens = tokenIssuer.issuePair(user, meta);
        auditLogService.recordUserEvent(AuditAction.LOGIN_SUCCEEDED, user.getId(), meta.ipAddress(), null);
        return LoginResponse.authenticated(tokens, UserSummaryResponse.from(user), remainingBackupCodes);
    }

    private void sendVerification(CampUser user, RequestMetadata meta) {
        SingleUseTokenService.IssuedSingleUseToken issued =
                singleUseTokenService.generate(SingleUseTokenKind.EMAIL_VERIFICATION, user, meta);
        notificationService.sendVerificationEmail(user,
                singleUseTokenService.buildLink(SingleUseTokenKind.EMAIL_VERIFICATION, issued.value()));
    }

    private CampUser requireUser(UUID userId) {
        return campUserRepository.findById(userId)
                .orElseThrow(() -> new AuthException(AuthErrorCode.USER_NOT_FOUND));
    }
}
