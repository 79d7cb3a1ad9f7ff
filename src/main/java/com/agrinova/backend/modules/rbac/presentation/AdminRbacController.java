package com.agrinova.backend.modules.rbac.presentation;

import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;

import com.agrinova.backend.global.security.AuthenticatedPrincipal;
import com.agrinova.backend.modules.rbac.application.PermissionResolver;
import com.agrinova.backend.modules.rbac.application.RbacAdminService;
import com.agrinova.backend.modules.rbac.application.RbacAdminService.CreateRoleCommand;
import com.agrinova.backend.modules.rbac.application.RbacAdminService.OverrideCommand;
import com.agrinova.backend.modules.rbac.domain.RbacStatistics;
import com.agrinova.backend.modules.rbac.domain.Role;
import com.agrinova.backend.modules.rbac.domain.UserPermissionOverride;
import com.agrinova.backend.modules.rbac.presentation.dto.ActiveFlagRequest;
import com.agrinova.backend.modules.rbac.presentation.dto.CreatePermissionRequest;
import com.agrinova.backend.modules.rbac.presentation.dto.CreateRoleRequest;
import com.agrinova.backend.modules.rbac.presentation.dto.OverrideRequest;
import com.agrinova.backend.modules.rbac.presentation.dto.OverrideResponse;
import com.agrinova.backend.modules.rbac.presentation.dto.PermissionResponse;
import com.agrinova.backend.modules.rbac.presentation.dto.RolePermissionsRequest;
import com.agrinova.backend.modules.rbac.presentation.dto.RolePermissionsResponse;
import com.agrinova.backend.modules.rbac.presentation.dto.RoleResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;

import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/admin/rbac")
@PreAuthorize("hasAuthority('rbac:manage')")
@Tag(name = "RBAC administration")
public class AdminRbacController {

    private final PermissionResolver permissionResolver;
    private final RbacAdminService rbacAdminService;

    public AdminRbacController(PermissionResolver permissionResolver, RbacAdminService rbacAdminService) {
        this.permissionResolver = permissionResolver;
        this.rbacAdminService = rbacAdminService;
    }

    @Operation(summary = "RBAC statistics")
    @GetMapping("/statistics")
    public ResponseEntity<RbacStatistics> statistics() {
        return ResponseEntity.ok(permissionResolver.statistics());
    }

    @GetMapping("/overrides")
    public ResponseEntity<List<OverrideResponse>> listOverrides(
            @RequestParam("userId") UUID userId,
            @AuthenticationPrincipal AuthenticatedPrincipal principal
    ) {
        return ResponseEntity.ok(rbacAdminService.listOverrides(userId, principal.userId()).stream()
                .map(OverrideResponse::from).toList());
    }

    @Operation(summary = "Grant or deny a permission for one user", description = "Deny wins over grant and baseline.")
    @PostMapping("/overrides")
    public ResponseEntity<OverrideResponse> upsertOverride(
            @Valid @RequestBody OverrideRequest request,
            @AuthenticationPrincipal AuthenticatedPrincipal principal
    ) {
        OverrideCommand command = new OverrideCommand(request.userId(), request.permission(), request.expiresAt(),
                request.reason());
        UserPermissionOverride override = request.isGrant()
                ? rbacAdminService.grantOverride(command, principal.userId())
                : rbacAdminService.denyOverride(command, principal.userId());
        return ResponseEntity.ok(OverrideResponse.from(override));
    }

    @DeleteMapping("/overrides")
    public ResponseEntity<Void> removeOverride(
            @RequestParam("userId") UUID userId,
            @RequestParam("permission") String permission,
            @AuthenticationPrincipal AuthenticatedPrincipal principal
    ) {
        rbacAdminService.removeOverride(userId, permission, principal.userId());
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/roles")
    public ResponseEntity<RoleResponse> createRole(
            @Valid @RequestBody CreateRoleRequest request,
            @AuthenticationPrincipal AuthenticatedPrincipal principal
    ) {
        List<String> permissions = request.permissions() == null ? List.of() : request.permissions();
        Role role = rbacAdminService.createRole(new CreateRoleCommand(request.name(), request.displayName(),
                request.description(), request.noAccess(), request.level(), permissions), principal.userId());
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(RoleResponse.from(role, List.copyOf(new TreeSet<>(permissions))));
    }

    @PatchMapping("/roles/{name}")
    public ResponseEntity<RoleResponse> setRoleActive(
            @PathVariable String name,
            @Valid @RequestBody ActiveFlagRequest request,
            @AuthenticationPrincipal AuthenticatedPrincipal principal
    ) {
        Role role = rbacAdminService.setRoleActive(name, request.active(), principal.userId());
        return ResponseEntity.ok(RoleResponse.from(role, List.of()));
    }

    @PostMapping("/roles/{name}/permissions")
    public ResponseEntity<RolePermissionsResponse> assignRolePermissions(
            @PathVariable String name,
            @Valid @RequestBody RolePermissionsRequest request,
            @AuthenticationPrincipal AuthenticatedPrincipal principal
    ) {
        Set<String> result = rbacAdminService.assignRolePermissions(name, request.permissions(), principal.userId());
        return ResponseEntity.ok(new RolePermissionsResponse(name, List.copyOf(new TreeSet<>(result))));
    }

    @DeleteMapping("/roles/{name}/permissions")
    public ResponseEntity<RolePermissionsResponse> removeRolePermissions(
            @PathVariable String name,
            @Valid @RequestBody RolePermissionsRequest request,
            @AuthenticationPrincipal AuthenticatedPrincipal principal
    ) {
        Set<String> result = rbacAdminService.removeRolePermissions(name, request.permissions(), principal.userId());
        return ResponseEntity.ok(new RolePermissionsResponse(name, List.copyOf(new TreeSet<>(result))));
    }

    @PostMapping("/permissions")
    public ResponseEntity<PermissionResponse> createPermission(
            @Valid @RequestBody CreatePermissionRequest request,
            @AuthenticationPrincipal AuthenticatedPrincipal principal
    ) {
        return ResponseEntity.status(HttpStatus.CREATED).body(PermissionResponse.from(
                rbacAdminService.createPermission(request.resource(), request.action(), request.description(),
                        principal.userId())));
    }

    @PatchMapping("/permissions/{name}")
    public ResponseEntity<PermissionResponse> setPermissionActive(
            @PathVariable String name,
            @Valid @RequestBody ActiveFlagRequest request,
            @AuthenticationPrincipal AuthenticatedPrincipal principal
    ) {
        return ResponseEntity.ok(PermissionResponse.from(
                rbacAdminService.setPermissionActive(name, request.active(), principal.userId())));
    }
}
