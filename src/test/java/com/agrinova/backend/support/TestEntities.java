package com.agrinova.backend.support;

import java.lang.reflect.Field;
import java.time.OffsetDateTime;
import java.util.Map;
import java.util.UUID;

import com.agrinova.backend.modules.auth.domain.AppUser;
import com.agrinova.backend.modules.auth.domain.AppUserStatus;
import com.agrinova.backend.modules.rbac.domain.Permission;
import com.agrinova.backend.modules.rbac.domain.Role;
import com.agrinova.backend.modules.rbac.domain.UserPermissionOverride;

/**
 * Builders for detached entities used by unit tests. Identifiers are assigned by reflection since they are
 * normally generated on persist.
 */
public final class TestEntities {

    private static final Map<String, Integer> SEEDED_LEVELS = Map.of(
            "SUPER_ADMIN", 1,
            "AREA_MANAGER", 2,
            "COMPANY_ADMIN", 3,
            "MANAGER", 4,
            "ASISTEN", 5,
            "MANDOR", 6,
            "SATPAM", 7
    );

    private TestEntities() {
    }

    public static Role role(String name) {
        Role role = new Role();
        role.setName(name);
        role.setDisplayName(name);
        role.setSystem(SEEDED_LEVELS.containsKey(name));
        role.setActive(true);
        role.setLevel(SEEDED_LEVELS.getOrDefault(name, Role.DEFAULT_LEVEL));
        setId(role, UUID.nameUUIDFromBytes(("role:" + name).getBytes()));
        return role;
    }

    public static AppUser user(UUID id, String username, Role role, UUID companyId) {
        AppUser user = user(id, username, role);
        user.setCompanyId(companyId);
        return user;
    }

    public static AppUser user(UUID id, String username, Role role) {
        AppUser user = new AppUser();
        user.setUsername(username);
        user.setEmail(username + "@agrinova.local");
        user.setFullName(username);
        user.setPasswordHash("argon2-hash-" + username);
        user.setRole(role);
        user.setStatus(AppUserStatus.ACTIVE);
        setId(user, id);
        return user;
    }

    public static Permission permission(String name) {
        String[] parts = name.split(":", 2);
        Permission permission = new Permission();
        permission.assign(parts[0], parts[1]);
        permission.setActive(true);
        setId(permission, UUID.nameUUIDFromBytes(("permission:" + name).getBytes()));
        return permission;
    }

    public static UserPermissionOverride override(UUID userId, String permission, boolean granted,
                                                  OffsetDateTime expiresAt) {
        UserPermissionOverride override = new UserPermissionOverride();
        override.setUserId(userId);
        override.setPermission(permission(permission));
        override.setGranted(granted);
        override.setExpiresAt(expiresAt);
        setId(override, UUID.randomUUID());
        return override;
    }

    public static void setId(Object entity, UUID id) {
        try {
            Field idField = entity.getClass().getDeclaredField("id");
            idField.setAccessible(true);
            idField.set(entity, id);
        } catch (ReflectiveOperationException ex) {
            throw new IllegalStateException(ex);
        }
    }
}
