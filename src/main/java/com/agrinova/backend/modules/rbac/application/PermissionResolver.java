package com.agrinova.backend.modules.rbac.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import com.agrinova.backend.modules.auth.domain.AppUser;
import com.agrinova.backend.modules.auth.infrastructure.persistence.AppUserRepository;
import com.agrinova.backend.modules.rbac.domain.EffectivePermissions;
import com.agrinova.backend.modules.rbac.domain.RbacStatistics;
import com.agrinova.backend.modules.rbac.domain.Role;
import com.agrinova.backend.modules.rbac.domain.UserPermissionOverride;
import com.agrinova.backend.modules.rbac.infrastructure.persistence.PermissionRepository;
import com.agrinova.backend.modules.rbac.infrastructure.persistence.RolePermissionRepository;
import com.agrinova.backend.modules.rbac.infrastructure.persistence.RoleRepository;
import com.agrinova.backend.modules.rbac.infrastructure.persistence.UserPermissionOverrideRepository;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Effective permissions = role baseline ∪ active grants − active denies.
 * Recomputed from the store on every call; nothing is cached.
 */
@Service
@Transactional(readOnly = true)
public class PermissionResolver {

    private final AppUserRepository appUserRepository;
    private final RoleRepository roleRepository;
    private final PermissionRepository permissionRepository;
    private final RolePermissionRepository rolePermissionRepository;
    private final UserPermissionOverrideRepository overrideRepository;
    private final Clock clock;

    public PermissionResolver(
            AppUserRepository appUserRepository,
            RoleRepository roleRepository,
            PermissionRepository permissionRepository,
            RolePermissionRepository rolePermissionRepository,
            UserPermissionOverrideRepository overrideRepository,
            Clock clock
    ) {
        this.appUserRepository = appUserRepository;
        this.roleRepository = roleRepository;
        this.permissionRepository = permissionRepository;
        this.rolePermissionRepository = rolePermissionRepository;
        this.overrideRepository = overrideRepository;
        this.clock = clock;
    }

    public EffectivePermissions resolve(UUID userId) {
        AppUser user = appUserRepository.findWithRoleById(userId).orElse(null);
        if (user == null || !user.isActive()) {
            return EffectivePermissions.none();
        }
        Role role = user.getRole();
        List<String> baseline = role.isActive()
                ? rolePermissionRepository.findActivePermissionNames(role.getId())
                : List.of();

        OffsetDateTime now = OffsetDateTime.now(clock);
        List<String> grants = new ArrayList<>();
        List<String> denies = new ArrayList<>();
        for (UserPermissionOverride override : overrideRepository.findActiveOverrides(userId, now)) {
            if (!override.isActiveAt(now)) {
                continue;
            }
            if (override.isGranted()) {
                grants.add(override.getPermission().getName());
            } else {
                denies.add(override.getPermission().getName());
            }
        }
        return EffectivePermissions.compute(baseline, grants, denies);
    }

    public boolean hasPermission(UUID userId, String permission) {
        return resolve(userId).allows(permission);
    }

    public RbacStatistics statistics() {
        OffsetDateTime now = OffsetDateTime.now(clock);
        long totalRoles = roleRepository.count();
        long totalOverrides = overrideRepository.count();
        return new RbacStatistics(
                totalRoles,
                roleRepository.countByActiveTrue(),
                roleRepository.countBySystemTrue(),
                roleRepository.countBySystemFalse(),
                permissionRepository.count(),
                permissionRepository.countByActiveTrue(),
                rolePermissionRepository.count(),
                totalOverrides,
                overrideRepository.countActive(now),
                overrideRepository.countExpired(now)
        );
    }
}
