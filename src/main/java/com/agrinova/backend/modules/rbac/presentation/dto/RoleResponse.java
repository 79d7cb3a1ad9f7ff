package com.agrinova.backend.modules.rbac.presentation.dto;

import java.util.List;
import java.util.UUID;

import com.agrinova.backend.modules.rbac.domain.Role;

public record RoleResponse(
        UUID roleId,
        String name,
        String displayName,
        boolean system,
        boolean active,
        boolean noAccess,
        int level,
        List<String> permissions
) {

    public static RoleResponse from(Role role, List<String> permissions) {
        return new RoleResponse(role.getId(), role.getName(), role.getDisplayName(), role.isSystem(),
                role.isActive(), role.isNoAccess(), role.getLevel(), permissions);
    }
}
