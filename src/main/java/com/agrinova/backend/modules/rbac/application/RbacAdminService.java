package com.agrinova.backend.modules.rbac.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.regex.Pattern;

import com.agrinova.backend.global.error.ProblemException;
import com.agrinova.backend.modules.auth.domain.AppUser;
import com.agrinova.backend.modules.rbac.domain.Permission;
import com.agrinova.backend.modules.rbac.domain.Role;
import com.agrinova.backend.modules.rbac.domain.RolePermission;
import com.agrinova.backend.modules.rbac.domain.UserPermissionOverride;
import com.agrinova.backend.modules.rbac.infrastructure.persistence.PermissionRepository;
import com.agrinova.backend.modules.rbac.infrastructure.persistence.RolePermissionRepository;
import com.agrinova.backend.modules.rbac.infrastructure.persistence.RoleRepository;
import com.agrinova.backend.modules.rbac.infrastructure.persistence.UserPermissionOverrideRepository;
import com.agrinova.backend.modules.security.application.AuthRateLimiter;
import com.agrinova.backend.modules.security.application.SecurityEventCommand;
import com.agrinova.backend.modules.security.application.SecurityEventLogger;
import com.agrinova.backend.modules.security.domain.SecurityEventType;
import com.agrinova.backend.modules.security.domain.SecurityOutcome;

import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class RbacAdminService {

    static final String OPERATION = "rbac";
    private static final Pattern NAME_SEGMENT = Pattern.compile("[a-z][a-z0-9_-]{0,49}");
    private static final Pattern ROLE_NAME = Pattern.compile("[A-Z][A-Z0-9_]{1,49}");

    private final RoleRepository roleRepository;
    private final PermissionRepository permissionRepository;
    private final RolePermissionRepository rolePermissionRepository;
    private final UserPermissionOverrideRepository overrideRepository;
    private final AdministrationScope administrationScope;
    private final AuthRateLimiter rateLimiter;
    private final SecurityEventLogger securityEventLogger;
    private final Clock clock;

    public RbacAdminService(
            RoleRepository roleRepository,
            PermissionRepository permissionRepository,
            RolePermissionRepository rolePermissionRepository,
            UserPermissionOverrideRepository overrideRepository,
            AdministrationScope administrationScope,
            AuthRateLimiter rateLimiter,
            SecurityEventLogger securityEventLogger,
            Clock clock
    ) {
        this.roleRepository = roleRepository;
        this.permissionRepository = permissionRepository;
        this.rolePermissionRepository = rolePermissionRepository;
        this.overrideRepository = overrideRepository;
        this.administrationScope = administrationScope;
        this.rateLimiter = rateLimiter;
        this.securityEventLogger = securityEventLogger;
        this.clock = clock;
    }

    public UserPermissionOverride grantOverride(OverrideCommand command, UUID actorId) {
        return upsertOverride(command, true, actorId);
    }

    public UserPermissionOverride denyOverride(OverrideCommand command, UUID actorId) {
        return upsertOverride(command, false, actorId);
    }

    public int removeOverride(UUID userId, String permissionName, UUID actorId) {
        rateLimiter.checkMutation(actorId, OPERATION);
        administrationScope.requireManageableUser(administrationScope.requireActor(actorId), userId);
        Permission permission = requirePermission(permissionName);
        int removed = overrideRepository.deleteOverrides(userId, permission.getId());
        if (removed > 0) {
            recordChange(SecurityEventType.PERMISSION_OVERRIDE_CHANGED, actorId, Map.of(
                    "action", "remove",
                    "targetUserId", userId.toString(),
                    "permission", permission.getName()));
        }
        return removed;
    }

    @Transactional(readOnly = true)
    public List<UserPermissionOverride> listOverrides(UUID userId, UUID actorId) {
        administrationScope.requireManageableUser(administrationScope.requireActor(actorId), userId);
        return overrideRepository.findAllByUserId(userId);
    }

    public Set<String> assignRolePermissions(String roleName, Collection<String> permissionNames, UUID actorId) {
        rateLimiter.checkMutation(actorId, OPERATION);
        AppUser actor = administrationScope.requireActor(actorId);
        Role role = requireRole(roleName);
        administrationScope.requireManageableRole(actor, role);
        List<Permission> permissions = requirePermissions(permissionNames);
        administrationScope.requireHeldPermissions(actor, names(permissions));
        Set<String> current = new HashSet<>(rolePermissionRepository.findPermissionNames(role.getId()));
        for (Permission permission : permissions) {
            if (current.add(permission.getName())) {
                rolePermissionRepository.save(new RolePermission(role, permission));
            }
        }
        recordChange(SecurityEventType.ROLE_CHANGED, actorId, Map.of(
                "action", "assign_permissions",
                "role", role.getName(),
                "permissions", permissions.stream().map(Permission::getName).sorted().toList()));
        return current;
    }

    /**
     * Removes permissions from a role. Refuses to leave a role with an empty baseline unless it is
     * flagged {@code no_access}.
     */
    public Set<String> removeRolePermissions(String roleName, Collection<String> permissionNames, UUID actorId) {
        rateLimiter.checkMutation(actorId, OPERATION);
        Role role = requireRole(roleName);
        administrationScope.requireManageableRole(administrationScope.requireActor(actorId), role);
        List<Permission> permissions = requirePermissions(permissionNames);
        Set<String> remaining = new HashSet<>(rolePermissionRepository.findPermissionNames(role.getId()));
        if (permissions.isEmpty()) {
            return remaining;
        }
        permissions.forEach(permission -> remaining.remove(permission.getName()));
        if (remaining.isEmpty() && !role.isNoAccess()) {
            throw new ProblemException(HttpStatus.CONFLICT, "ROLE_BASELINE_EMPTY",
                    "A role must keep at least one permission unless it is flagged no_access");
        }
        rolePermissionRepository.deleteByRoleIdAndPermissionIds(role.getId(),
                permissions.stream().map(Permission::getId).toList());
        recordChange(SecurityEventType.ROLE_CHANGED, actorId, Map.of(
                "action", "remove_permissions",
                "role", role.getName(),
                "permissions", permissions.stream().map(Permission::getName).sorted().toList()));
        return remaining;
    }

    /**
     * Creates a custom role below the actor's level. A role without permissions must be flagged
     * {@code noAccess}.
     */
    public Role createRole(CreateRoleCommand command, UUID actorId) {
        rateLimiter.checkMutation(actorId, OPERATION);
        AppUser actor = administrationScope.requireActor(actorId);
        int level = command.level() != null ? command.level() : Role.DEFAULT_LEVEL;
        administrationScope.requireAssignableLevel(actor, level);
        String name = command.name() == null ? "" : command.name().trim().toUpperCase(Locale.ROOT);
        if (!ROLE_NAME.matcher(name).matches()) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "INVALID_ROLE_NAME");
        }
        if (roleRepository.findByNameIgnoreCase(name).isPresent()) {
            throw new ProblemException(HttpStatus.CONFLICT, "ROLE_ALREADY_EXISTS");
        }
        Collection<String> requested = command.permissions() == null ? List.of() : command.permissions();
        if (requested.isEmpty() && !command.noAccess()) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "ROLE_BASELINE_EMPTY",
                    "A role must have at least one permission unless it is flagged no_access");
        }
        List<Permission> permissions = requirePermissions(requested);
        administrationScope.requireHeldPermissions(actor, names(permissions));

        Role role = new Role();
        role.setName(name);
        role.setDisplayName(command.displayName() != null && !command.displayName().isBlank()
                ? command.displayName().trim()
                : name);
        role.setDescription(command.description());
        role.setSystem(false);
        role.setActive(true);
        role.setNoAccess(command.noAccess());
        role.setLevel(level);
        roleRepository.save(role);
        for (Permission permission : permissions) {
            rolePermissionRepository.save(new RolePermission(role, permission));
        }
        recordChange(SecurityEventType.ROLE_CHANGED, actorId, Map.of("action", "create", "role", name, "level", level));
        return role;
    }

    public Role setRoleActive(String roleName, boolean active, UUID actorId) {
        rateLimiter.checkMutation(actorId, OPERATION);
        Role role = requireRole(roleName);
        administrationScope.requireManageableRole(administrationScope.requireActor(actorId), role);
        if (role.isSystem()) {
            throw new ProblemException(HttpStatus.CONFLICT, "SYSTEM_ROLE_IMMUTABLE");
        }
        role.setActive(active);
        recordChange(SecurityEventType.ROLE_CHANGED, actorId, Map.of(
                "action", active ? "activate" : "deactivate",
                "role", role.getName()));
        return role;
    }

    public Permission createPermission(String resource, String action, String description, UUID actorId) {
        rateLimiter.checkMutation(actorId, OPERATION);
        administrationScope.requireSuperAdmin(administrationScope.requireActor(actorId));
        String normalizedResource = resource == null ? "" : resource.trim().toLowerCase(Locale.ROOT);
        String normalizedAction = action == null ? "" : action.trim().toLowerCase(Locale.ROOT);
        if (!NAME_SEGMENT.matcher(normalizedResource).matches() || !NAME_SEGMENT.matcher(normalizedAction).matches()) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "INVALID_PERMISSION_NAME");
        }
        String name = Permission.nameOf(normalizedResource, normalizedAction);
        if (permissionRepository.existsByName(name)) {
            throw new ProblemException(HttpStatus.CONFLICT, "PERMISSION_ALREADY_EXISTS");
        }
        Permission permission = new Permission();
        permission.assign(normalizedResource, normalizedAction);
        permission.setDescription(description);
        permission.setActive(true);
        permissionRepository.save(permission);
        recordChange(SecurityEventType.ROLE_CHANGED, actorId, Map.of("action", "create_permission", "permission", name));
        return permission;
    }

    public Permission setPermissionActive(String permissionName, boolean active, UUID actorId) {
        rateLimiter.checkMutation(actorId, OPERATION);
        administrationScope.requireSuperAdmin(administrationScope.requireActor(actorId));
        Permission permission = requirePermission(permissionName);
        permission.setActive(active);
        recordChange(SecurityEventType.ROLE_CHANGED, actorId, Map.of(
                "action", active ? "activate_permission" : "deactivate_permission",
                "permission", permission.getName()));
        return permission;
    }

    private UserPermissionOverride upsertOverride(OverrideCommand command, boolean granted, UUID actorId) {
        rateLimiter.checkMutation(actorId, OPERATION);
        AppUser actor = administrationScope.requireActor(actorId);
        administrationScope.requireManageableUser(actor, command.userId());
        Permission permission = requirePermission(command.permission());
        if (granted) {
            administrationScope.requireHeldPermissions(actor, List.of(permission.getName()));
        }
        OffsetDateTime now = OffsetDateTime.now(clock);
        if (command.expiresAt() != null && !command.expiresAt().isAfter(now)) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "OVERRIDE_EXPIRY_IN_PAST",
                    "expiresAt must be in the future");
        }

        UserPermissionOverride override = overrideRepository
                .findOverride(command.userId(), permission.getId(), granted)
                .orElseGet(UserPermissionOverride::new);
        override.setUserId(command.userId());
        override.setPermission(permission);
        override.setGranted(granted);
        override.setExpiresAt(command.expiresAt());
        override.setAssignedBy(actorId);
        override.setReason(command.reason());
        overrideRepository.save(override);

        Map<String, Object> detail = new HashMap<>();
        detail.put("action", granted ? "grant" : "deny");
        detail.put("targetUserId", command.userId().toString());
        detail.put("permission", permission.getName());
        if (command.expiresAt() != null) {
            detail.put("expiresAt", command.expiresAt().toString());
        }
        recordChange(SecurityEventType.PERMISSION_OVERRIDE_CHANGED, actorId, detail);
        return override;
    }

    private Role requireRole(String roleName) {
        if (roleName == null || roleName.isBlank()) {
            throw new ProblemException(HttpStatus.NOT_FOUND, "ROLE_NOT_FOUND");
        }
        return roleRepository.findByNameIgnoreCase(roleName.trim())
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "ROLE_NOT_FOUND"));
    }

    private Permission requirePermission(String permissionName) {
        if (permissionName == null || permissionName.isBlank()) {
            throw new ProblemException(HttpStatus.NOT_FOUND, "PERMISSION_NOT_FOUND");
        }
        return permissionRepository.findByName(permissionName.trim())
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "PERMISSION_NOT_FOUND"));
    }

    private List<Permission> requirePermissions(Collection<String> names) {
        Set<String> requested = new HashSet<>();
        for (String name : names) {
            if (name != null && !name.isBlank()) {
                requested.add(name.trim());
            }
        }
        if (requested.isEmpty()) {
            return List.of();
        }
        List<Permission> found = permissionRepository.findByNameIn(requested);
        if (found.size() != requested.size()) {
            throw new ProblemException(HttpStatus.NOT_FOUND, "PERMISSION_NOT_FOUND");
        }
        return found;
    }

    private static List<String> names(List<Permission> permissions) {
        return permissions.stream().map(Permission::getName).toList();
    }

    private void recordChange(SecurityEventType type, UUID actorId, Map<String, Object> detail) {
        securityEventLogger.record(SecurityEventCommand.of(type, SecurityOutcome.SUCCESS)
                .withUser(actorId)
                .withDetail(detail));
    }

    public record OverrideCommand(UUID userId, String permission, OffsetDateTime expiresAt, String reason) {
    }

    public record CreateRoleCommand(
            String name,
            String displayName,
            String description,
            boolean noAccess,
            Integer level,
            List<String> permissions
    ) {
    }
}
