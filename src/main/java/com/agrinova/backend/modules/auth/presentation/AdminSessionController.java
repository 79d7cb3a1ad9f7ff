package com.agrinova.backend.modules.auth.presentation;

import java.util.UUID;

import com.agrinova.backend.global.security.AuthenticatedPrincipal;
import com.agrinova.backend.modules.auth.application.SessionOrchestrator;
import com.agrinova.backend.modules.auth.presentation.dto.SessionsRevokedResponse;

import io.swagger.v3.oas.annotations.Operation;

import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/admin/users")
public class AdminSessionController {

    private final SessionOrchestrator sessionOrchestrator;

    public AdminSessionController(SessionOrchestrator sessionOrchestrator) {
        this.sessionOrchestrator = sessionOrchestrator;
    }

    @Operation(summary = "Force logout", description = "Revokes every session of a user the caller may manage.")
    @PreAuthorize("hasAuthority('user:manage')")
    @PostMapping("/{userId}/logout-all")
    public ResponseEntity<SessionsRevokedResponse> logoutAll(
            @PathVariable UUID userId,
            @AuthenticationPrincipal AuthenticatedPrincipal principal
    ) {
        int revoked = sessionOrchestrator.forceLogoutAll(userId, principal.userId());
        return ResponseEntity.ok(new SessionsRevokedResponse(revoked));
    }
}
