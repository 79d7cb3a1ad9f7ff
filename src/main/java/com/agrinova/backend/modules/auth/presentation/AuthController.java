package com.agrinova.backend.modules.auth.presentation;

import com.agrinova.backend.global.security.AuthenticatedPrincipal;
import com.agrinova.backend.global.security.BearerTokens;
import com.agrinova.backend.global.web.ClientAddressResolver;
import com.agrinova.backend.modules.auth.application.AuthorizationDecision;
import com.agrinova.backend.modules.auth.application.DeviceContext;
import com.agrinova.backend.modules.auth.application.LoginCommand;
import com.agrinova.backend.modules.auth.application.SessionOrchestrator;
import com.agrinova.backend.modules.auth.application.SessionResult;
import com.agrinova.backend.modules.auth.domain.AuthException;
import com.agrinova.backend.modules.auth.domain.AuthFailureKind;
import com.agrinova.backend.modules.auth.domain.ClientPlatform;
import com.agrinova.backend.modules.auth.presentation.dto.AuthorizeRequest;
import com.agrinova.backend.modules.auth.presentation.dto.AuthorizeResponse;
import com.agrinova.backend.modules.auth.presentation.dto.ChangePasswordRequest;
import com.agrinova.backend.modules.auth.presentation.dto.LoginRequest;
import com.agrinova.backend.modules.auth.presentation.dto.LoginResponse;
import com.agrinova.backend.modules.auth.presentation.dto.OfflineTokenRequest;
import com.agrinova.backend.modules.auth.presentation.dto.RefreshRequest;
import com.agrinova.backend.modules.auth.presentation.dto.SessionUserResponse;
import com.agrinova.backend.modules.auth.presentation.dto.SessionsRevokedResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;

import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Tag(name = "Auth")
public class AuthController {

    private final SessionOrchestrator sessionOrchestrator;

    public AuthController(SessionOrchestrator sessionOrchestrator) {
        this.sessionOrchestrator = sessionOrchestrator;
    }

    @Operation(summary = "Login", description = "Verifies credentials, binds mobile devices on first use and issues tokens.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Authenticated"),
            @ApiResponse(responseCode = "401", description = "Invalid credentials"),
            @ApiResponse(responseCode = "403", description = "Device mismatch or revoked"),
            @ApiResponse(responseCode = "429", description = "Too many attempts")
    })
    @PostMapping("/auth/login")
    public ResponseEntity<LoginResponse> login(@Valid @RequestBody LoginRequest request,
                                               HttpServletRequest servletRequest) {
        ClientPlatform platform = ClientPlatform.from(request.platform());
        LoginCommand command = new LoginCommand(
                request.identifier(),
                request.password(),
                ClientAddressResolver.resolve(servletRequest),
                new DeviceContext(request.deviceId(), request.deviceFingerprint(), platform),
                request.offline()
        );
        SessionResult result = sessionOrchestrator.login(command).orThrow();
        return ResponseEntity.ok(LoginResponse.from(result));
    }

    @Operation(summary = "Rotate refresh token")
    @PostMapping("/auth/refresh")
    public ResponseEntity<LoginResponse> refresh(@Valid @RequestBody RefreshRequest request,
                                                 HttpServletRequest servletRequest) {
        SessionResult result = sessionOrchestrator
                .refresh(request.refreshToken(), ClientAddressResolver.resolve(servletRequest))
                .orThrow();
        return ResponseEntity.ok(LoginResponse.from(result));
    }

    @Operation(summary = "Validate offline token", description = "Air-gapped check; issues nothing.")
    @PostMapping("/auth/offline/validate")
    public ResponseEntity<SessionUserResponse> validateOffline(@Valid @RequestBody OfflineTokenRequest request,
                                                               HttpServletRequest servletRequest) {
        SessionResult result = sessionOrchestrator
                .validateOffline(request.offlineToken(), ClientAddressResolver.resolve(servletRequest))
                .orThrow();
        return ResponseEntity.ok(SessionUserResponse.from(result.identity(), result.permissions()));
    }

    @Operation(summary = "Renew from offline token",
            description = "Issues a new token set for the bound device and revokes the offline token's session.")
    @PostMapping("/auth/offline/renew")
    public ResponseEntity<LoginResponse> renewOffline(@Valid @RequestBody OfflineTokenRequest request,
                                                      HttpServletRequest servletRequest) {
        DeviceContext device = new DeviceContext(request.deviceId(), request.deviceFingerprint(), null);
        SessionResult result = sessionOrchestrator
                .renewOffline(request.offlineToken(), device, ClientAddressResolver.resolve(servletRequest))
                .orThrow();
        return ResponseEntity.ok(LoginResponse.from(result));
    }

    @Operation(summary = "Logout", description = "Revokes the session of the presented access token, expired or not.")
    @PostMapping("/auth/logout")
    public ResponseEntity<Void> logout(
            @RequestHeader(name = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            HttpServletRequest servletRequest
    ) {
        String token = BearerTokens.extract(authorization)
                .orElseThrow(() -> new AuthException(AuthFailureKind.MALFORMED));
        sessionOrchestrator.logout(token, ClientAddressResolver.resolve(servletRequest));
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "Logout from every device")
    @PostMapping("/auth/logout-all")
    public ResponseEntity<SessionsRevokedResponse> logoutAll(@AuthenticationPrincipal AuthenticatedPrincipal principal) {
        int revoked = sessionOrchestrator.logoutAllDevices(principal.userId(), principal.userId());
        return ResponseEntity.ok(new SessionsRevokedResponse(revoked));
    }

    @Operation(summary = "Check a permission", description = "Answers allow or deny for the bearer of the access token.")
    @PostMapping("/auth/authorize")
    public ResponseEntity<AuthorizeResponse> authorize(
            @RequestHeader(name = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @Valid @RequestBody AuthorizeRequest request
    ) {
        AuthorizationDecision decision = BearerTokens.extract(authorization)
                .map(token -> sessionOrchestrator.authorize(token, request.permission()))
                .orElseGet(() -> AuthorizationDecision.deny(AuthFailureKind.MALFORMED));
        if (decision.allowed()) {
            return ResponseEntity.ok(AuthorizeResponse.from(decision));
        }
        return ResponseEntity.status(decision.reason().getStatus()).body(AuthorizeResponse.from(decision));
    }

    @Operation(summary = "Change password", description = "Revokes every session of the user on success.")
    @PostMapping("/auth/password")
    public ResponseEntity<SessionsRevokedResponse> changePassword(
            @AuthenticationPrincipal AuthenticatedPrincipal principal,
            @Valid @RequestBody ChangePasswordRequest request,
            HttpServletRequest servletRequest
    ) {
        int revoked = sessionOrchestrator.changePassword(principal.userId(), request.currentPassword(),
                request.newPassword(), ClientAddressResolver.resolve(servletRequest));
        return ResponseEntity.ok(new SessionsRevokedResponse(revoked));
    }
}
