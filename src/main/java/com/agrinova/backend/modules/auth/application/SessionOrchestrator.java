package com.agrinova.backend.modules.auth.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.agrinova.backend.global.error.ProblemException;
import com.agrinova.backend.modules.auth.application.JwtTokenService.OfflineAccess;
import com.agrinova.backend.modules.auth.application.JwtTokenService.RotatedTokens;
import com.agrinova.backend.modules.auth.domain.AppUser;
import com.agrinova.backend.modules.auth.domain.AuthException;
import com.agrinova.backend.modules.auth.domain.AuthFailureKind;
import com.agrinova.backend.modules.auth.domain.ClientPlatform;
import com.agrinova.backend.modules.auth.domain.HashingSaturatedException;
import com.agrinova.backend.modules.auth.domain.IssuedTokens;
import com.agrinova.backend.modules.auth.domain.PasswordPolicy;
import com.agrinova.backend.modules.auth.domain.RateLimitedException;
import com.agrinova.backend.modules.auth.domain.SessionState;
import com.agrinova.backend.modules.auth.domain.TokenClaims;
import com.agrinova.backend.modules.auth.domain.TokenKind;
import com.agrinova.backend.modules.auth.domain.VerifiedIdentity;
import com.agrinova.backend.modules.auth.infrastructure.persistence.AppUserRepository;
import com.agrinova.backend.modules.device.application.DeviceBindingValidator;
import com.agrinova.backend.modules.device.domain.DeviceValidationResult;
import com.agrinova.backend.modules.rbac.application.AdministrationScope;
import com.agrinova.backend.modules.rbac.application.PermissionResolver;
import com.agrinova.backend.modules.rbac.domain.EffectivePermissions;
import com.agrinova.backend.modules.security.application.AuthRateLimiter;
import com.agrinova.backend.modules.security.application.SecurityEventCommand;
import com.agrinova.backend.modules.security.application.SecurityEventLogger;
import com.agrinova.backend.modules.security.domain.SecurityEventType;
import com.agrinova.backend.modules.security.domain.SecurityOutcome;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.annotation.Transactional;

/**
 * Composes credential verification, device binding, token issuance, permission resolution, rate limiting
 * and security logging into the session flows. Holds no per-client state; each call walks the
 * {@link SessionState} machine from the state implied by its inputs. Nothing is retried here.
 */
@Service
public class SessionOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(SessionOrchestrator.class);
    private static final String PASSWORD_OPERATION = "password";

    private final AuthRateLimiter rateLimiter;
    private final CredentialVerifier credentialVerifier;
    private final DeviceBindingValidator deviceBindingValidator;
    private final JwtTokenService tokenService;
    private final PermissionResolver permissionResolver;
    private final AdministrationScope administrationScope;
    private final SecurityEventLogger securityEventLogger;
    private final AppUserRepository appUserRepository;
    private final Clock clock;

    public SessionOrchestrator(
            AuthRateLimiter rateLimiter,
            CredentialVerifier credentialVerifier,
            DeviceBindingValidator deviceBindingValidator,
            JwtTokenService tokenService,
            PermissionResolver permissionResolver,
            AdministrationScope administrationScope,
            SecurityEventLogger securityEventLogger,
            AppUserRepository appUserRepository,
            Clock clock
    ) {
        this.rateLimiter = rateLimiter;
        this.credentialVerifier = credentialVerifier;
        this.deviceBindingValidator = deviceBindingValidator;
        this.tokenService = tokenService;
        this.permissionResolver = permissionResolver;
        this.administrationScope = administrationScope;
        this.securityEventLogger = securityEventLogger;
        this.appUserRepository = appUserRepository;
        this.clock = clock;
    }

    public SessionResult login(LoginCommand command) {
        SessionState state = SessionState.ANONYMOUS.transitionTo(SessionState.AUTHENTICATING);
        ClientPlatform platform = command.platform();
        String deviceId = command.device() != null
                ? DeviceBindingValidator.normalizeDeviceId(command.device().deviceId())
                : null;
        try {
            rateLimiter.acquireLoginAttempt(command.identifier(), command.sourceAddress());
            VerifiedIdentity identity;
            try {
                identity = credentialVerifier.verify(command.identifier(), command.secret());
            } catch (HashingSaturatedException ex) {
                // overload is not a failed attempt
                rateLimiter.releaseLoginAttempt(command.identifier(), command.sourceAddress());
                throw ex;
            }

            String boundDeviceId = null;
            if (platform.isMobile()) {
                DeviceContext device = command.device();
                DeviceValidationResult binding = deviceBindingValidator.validate(identity.userId(),
                        device.deviceId(), device.fingerprint(), platform);
                boundDeviceId = binding.deviceId();
            }

            IssuedTokens tokens = tokenService.issue(identity, boundDeviceId, platform, command.offline());
            EffectivePermissions permissions = permissionResolver.resolve(identity.userId());
            rateLimiter.releaseLoginAttempts(command.identifier(), command.sourceAddress());

            securityEventLogger.record(SecurityEventCommand.of(SecurityEventType.LOGIN_SUCCESS, SecurityOutcome.SUCCESS)
                    .withIdentifier(command.identifier())
                    .withUser(identity.userId())
                    .withDevice(boundDeviceId)
                    .withSource(command.sourceAddress())
                    .withDetail(Map.of("platform", platform.name(), "lineageId", tokens.lineageId().toString())));
            state.transitionTo(SessionState.AUTHENTICATED);
            return SessionResult.authenticated(identity, tokens, permissions);
        } catch (RateLimitedException ex) {
            return SessionResult.rateLimited(state.transitionTo(SessionState.ANONYMOUS), ex.getRetryAfterSeconds());
        } catch (AuthException ex) {
            securityEventLogger.record(SecurityEventCommand.of(SecurityEventType.LOGIN_FAILURE, SecurityOutcome.FAILURE)
                    .withIdentifier(command.identifier())
                    .withDevice(deviceId)
                    .withSource(command.sourceAddress())
                    .withDetail(Map.of("reason", ex.getKind().name(), "platform", platform.name())));
            return SessionResult.failed(state.transitionTo(SessionState.ANONYMOUS), ex.getKind());
        } catch (DataAccessException | TransactionException ex) {
            reportStoreFailure("login", ex, command.sourceAddress());
            return SessionResult.failed(state.transitionTo(SessionState.ANONYMOUS), AuthFailureKind.STORE_UNAVAILABLE);
        }
    }

    public SessionResult refresh(String refreshToken, String sourceAddress) {
        SessionState state = SessionState.AUTHENTICATED.transitionTo(SessionState.REFRESHING);
        try {
            RotatedTokens rotated = tokenService.refresh(refreshToken);
            EffectivePermissions permissions = permissionResolver.resolve(rotated.identity().userId());
            securityEventLogger.record(SecurityEventCommand.of(SecurityEventType.TOKEN_REFRESHED, SecurityOutcome.SUCCESS)
                    .withUser(rotated.identity().userId())
                    .withSource(sourceAddress)
                    .withDetail(Map.of("lineageId", rotated.tokens().lineageId().toString())));
            state.transitionTo(SessionState.AUTHENTICATED);
            return SessionResult.authenticated(rotated.identity(), rotated.tokens(), permissions);
        } catch (AuthException ex) {
            securityEventLogger.record(SecurityEventCommand.of(SecurityEventType.TOKEN_REFRESH_REJECTED, SecurityOutcome.DENIED)
                    .withSource(sourceAddress)
                    .withDetail(Map.of("reason", ex.getKind().name())));
            return SessionResult.failed(state.transitionTo(SessionState.REVOKED_OR_EXPIRED), ex.getKind());
        } catch (DataAccessException | TransactionException ex) {
            // the presented tokens were not consumed, so the client may retry with them
            reportStoreFailure("refresh", ex, sourceAddress);
            return SessionResult.failed(state.transitionTo(SessionState.AUTHENTICATED), AuthFailureKind.STORE_UNAVAILABLE);
        }
    }

    /**
     * Checks an offline token for air-gapped use. No tokens are issued and no lineage changes.
     */
    public SessionResult validateOffline(String offlineToken, String sourceAddress) {
        try {
            OfflineAccess access = tokenService.validateOffline(offlineToken);
            EffectivePermissions permissions = permissionResolver.resolve(access.identity().userId());
            securityEventLogger.record(SecurityEventCommand.of(SecurityEventType.OFFLINE_ACCESS_VALIDATED, SecurityOutcome.SUCCESS)
                    .withUser(access.identity().userId())
                    .withDevice(access.claims().deviceId())
                    .withSource(sourceAddress)
                    .withDetail(Map.of("lineageId", access.claims().lineageId().toString())));
            return SessionResult.authenticated(access.identity(), null, permissions);
        } catch (AuthException ex) {
            securityEventLogger.record(SecurityEventCommand.of(SecurityEventType.OFFLINE_ACCESS_REJECTED, SecurityOutcome.DENIED)
                    .withSource(sourceAddress)
                    .withDetail(Map.of("reason", ex.getKind().name(), "operation", "validate")));
            return SessionResult.failed(SessionState.AUTHENTICATED.transitionTo(SessionState.REVOKED_OR_EXPIRED),
                    ex.getKind());
        } catch (DataAccessException | TransactionException ex) {
            reportStoreFailure("offline-validate", ex, sourceAddress);
            return SessionResult.failed(SessionState.AUTHENTICATED, AuthFailureKind.STORE_UNAVAILABLE);
        }
    }

    /**
     * Exchanges an offline token for a fresh token set on the same device and ends the offline token's lineage.
     */
    public SessionResult renewOffline(String offlineToken, DeviceContext device, String sourceAddress) {
        SessionState state = SessionState.AUTHENTICATED.transitionTo(SessionState.REFRESHING);
        String deviceId = device != null ? device.deviceId() : null;
        String fingerprint = device != null ? device.fingerprint() : null;
        try {
            RotatedTokens renewed = tokenService.renewOffline(offlineToken, deviceId, fingerprint);
            EffectivePermissions permissions = permissionResolver.resolve(renewed.identity().userId());
            securityEventLogger.record(SecurityEventCommand.of(SecurityEventType.OFFLINE_RENEWED, SecurityOutcome.SUCCESS)
                    .withUser(renewed.identity().userId())
                    .withDevice(DeviceBindingValidator.normalizeDeviceId(deviceId))
                    .withSource(sourceAddress)
                    .withDetail(Map.of("lineageId", renewed.tokens().lineageId().toString())));
            state.transitionTo(SessionState.AUTHENTICATED);
            return SessionResult.authenticated(renewed.identity(), renewed.tokens(), permissions);
        } catch (AuthException ex) {
            securityEventLogger.record(SecurityEventCommand.of(SecurityEventType.OFFLINE_ACCESS_REJECTED, SecurityOutcome.DENIED)
                    .withDevice(DeviceBindingValidator.normalizeDeviceId(deviceId))
                    .withSource(sourceAddress)
                    .withDetail(Map.of("reason", ex.getKind().name(), "operation", "renew")));
            return SessionResult.failed(state.transitionTo(SessionState.REVOKED_OR_EXPIRED), ex.getKind());
        } catch (DataAccessException | TransactionException ex) {
            reportStoreFailure("offline-renew", ex, sourceAddress);
            return SessionResult.failed(state.transitionTo(SessionState.AUTHENTICATED), AuthFailureKind.STORE_UNAVAILABLE);
        }
    }

    /**
     * Per-request flow for clients holding a token pair: a valid access token stays authenticated, an expired
     * one is exchanged through the refresh token when present.
     */
    public SessionResult resume(String accessToken, String refreshToken, String sourceAddress) {
        try {
            AuthenticatedSession session = authenticate(accessToken);
            AppUser user = appUserRepository.findWithRoleById(session.claims().userId())
                    .orElseThrow(() -> new AuthException(AuthFailureKind.REVOKED));
            return SessionResult.authenticated(VerifiedIdentity.from(user), null, session.permissions());
        } catch (AuthException ex) {
            if (ex.getKind() == AuthFailureKind.EXPIRED && refreshToken != null && !refreshToken.isBlank()) {
                return refresh(refreshToken, sourceAddress);
            }
            return SessionResult.failed(SessionState.AUTHENTICATED.transitionTo(SessionState.REVOKED_OR_EXPIRED),
                    ex.getKind());
        } catch (DataAccessException | TransactionException ex) {
            reportStoreFailure("resume", ex, sourceAddress);
            return SessionResult.failed(SessionState.AUTHENTICATED, AuthFailureKind.STORE_UNAVAILABLE);
        }
    }

    /**
     * Validates an access token, re-checks its device binding and resolves current permissions.
     *
     * @throws AuthException when the token or its device is not acceptable
     */
    public AuthenticatedSession authenticate(String accessToken) {
        TokenClaims claims = tokenService.validate(accessToken, TokenKind.ACCESS);
        if (claims.isDeviceBound()) {
            deviceBindingValidator.requireActive(claims.userId(), claims.deviceId());
        }
        EffectivePermissions permissions = permissionResolver.resolve(claims.userId());
        return new AuthenticatedSession(claims, permissions);
    }

    public AuthorizationDecision authorize(String accessToken, String requiredPermission) {
        AuthenticatedSession session;
        try {
            session = authenticate(accessToken);
        } catch (AuthException ex) {
            securityEventLogger.record(SecurityEventCommand.of(SecurityEventType.TOKEN_REJECTED, SecurityOutcome.DENIED)
                    .withDetail(Map.of("reason", ex.getKind().name())));
            return AuthorizationDecision.deny(ex.getKind());
        } catch (DataAccessException | TransactionException ex) {
            reportStoreFailure("authorize", ex, null);
            return AuthorizationDecision.deny(AuthFailureKind.STORE_UNAVAILABLE);
        }

        TokenClaims claims = session.claims();
        if (session.permissions().allows(requiredPermission)) {
            securityEventLogger.record(SecurityEventCommand.of(SecurityEventType.AUTHORIZATION_ALLOWED, SecurityOutcome.SUCCESS)
                    .withUser(claims.userId())
                    .withDevice(claims.deviceId())
                    .withDetail(Map.of("permission", String.valueOf(requiredPermission))));
            return AuthorizationDecision.allow();
        }
        securityEventLogger.record(SecurityEventCommand.of(SecurityEventType.AUTHORIZATION_DENIED, SecurityOutcome.DENIED)
                .withUser(claims.userId())
                .withDevice(claims.deviceId())
                .withDetail(Map.of("permission", String.valueOf(requiredPermission))));
        return AuthorizationDecision.deny(AuthFailureKind.PERMISSION_DENIED);
    }

    /**
     * Ends the lineage of the presented access token. Expired but authentic tokens are accepted and repeating
     * the call is harmless.
     *
     * @return the session state after logout
     */
    public SessionState logout(String accessToken, String sourceAddress) {
        TokenClaims claims = tokenService.validateIgnoringExpiry(accessToken, TokenKind.ACCESS);
        boolean revoked = tokenService.revokeLineage(claims.lineageId(), JwtTokenService.REASON_LOGOUT);
        if (revoked) {
            securityEventLogger.record(SecurityEventCommand.of(SecurityEventType.LOGOUT, SecurityOutcome.SUCCESS)
                    .withUser(claims.userId())
                    .withDevice(claims.deviceId())
                    .withSource(sourceAddress)
                    .withDetail(Map.of("lineageId", claims.lineageId().toString())));
        }
        return SessionState.AUTHENTICATED.transitionTo(SessionState.ANONYMOUS);
    }

    /**
     * Administrative logout-all, limited to users the actor may manage.
     */
    public int forceLogoutAll(UUID targetUserId, UUID actorId) {
        administrationScope.requireManageableUser(administrationScope.requireActor(actorId), targetUserId);
        return logoutAllDevices(targetUserId, actorId);
    }

    public int logoutAllDevices(UUID userId, UUID actorId) {
        int revoked = tokenService.revokeAllForUser(userId, JwtTokenService.REASON_LOGOUT_ALL);
        securityEventLogger.record(SecurityEventCommand.of(SecurityEventType.LOGOUT_ALL, SecurityOutcome.SUCCESS)
                .withUser(userId)
                .withDetail(Map.of("revokedLineages", revoked, "actorId", String.valueOf(actorId))));
        return revoked;
    }

    /**
     * Replaces the password after re-verifying the current one, then revokes every lineage of the user.
     */
    @Transactional
    public int changePassword(UUID userId, String currentSecret, String newSecret, String sourceAddress) {
        rateLimiter.checkMutation(userId, PASSWORD_OPERATION);
        AppUser user = appUserRepository.findById(userId)
                .orElseThrow(() -> new AuthException(AuthFailureKind.INVALID_CREDENTIALS));

        if (!user.isActive() || !credentialVerifier.matches(currentSecret, user.getPasswordHash())) {
            securityEventLogger.record(SecurityEventCommand.of(SecurityEventType.PASSWORD_CHANGE_REJECTED, SecurityOutcome.FAILURE)
                    .withUser(userId)
                    .withSource(sourceAddress)
                    .withDetail(Map.of("reason", AuthFailureKind.INVALID_CREDENTIALS.name())));
            throw new AuthException(AuthFailureKind.INVALID_CREDENTIALS);
        }
        List<String> violations = PasswordPolicy.violations(newSecret);
        if (!violations.isEmpty()) {
            throw new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, "PASSWORD_POLICY_VIOLATION",
                    "Password " + String.join("; ", violations));
        }
        if (credentialVerifier.matches(newSecret, user.getPasswordHash())) {
            throw new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, "PASSWORD_REUSED",
                    "New password must differ from the current one");
        }

        user.setPasswordHash(credentialVerifier.hash(newSecret));
        user.setPasswordChangedAt(OffsetDateTime.now(clock));
        appUserRepository.save(user);

        int revoked = tokenService.revokeAllForUser(userId, JwtTokenService.REASON_PASSWORD_CHANGED);
        securityEventLogger.record(SecurityEventCommand.of(SecurityEventType.PASSWORD_CHANGED, SecurityOutcome.SUCCESS)
                .withUser(userId)
                .withSource(sourceAddress)
                .withDetail(Map.of("revokedLineages", revoked)));
        return revoked;
    }

    private void reportStoreFailure(String operation, RuntimeException ex, String sourceAddress) {
        log.error("Auth store unavailable during {}", operation, ex);
        securityEventLogger.record(SecurityEventCommand.of(SecurityEventType.STORE_UNAVAILABLE, SecurityOutcome.FAILURE)
                .withSource(sourceAddress)
                .withDetail(Map.of("operation", operation)));
    }
}
