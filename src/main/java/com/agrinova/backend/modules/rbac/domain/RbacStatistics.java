package com.agrinova.backend.modules.rbac.domain;

public record RbacStatistics(
        long totalRoles,
        long activeRoles,
        long systemRoles,
        long customRoles,
        long totalPermissions,
        long activePermissions,
        long rolePermissionMappings,
        long totalOverrides,
        long activeOverrides,
        long expiredOverrides
) {
}
