package com.agrinova.backend.modules.rbac.presentation.dto;

import java.util.UUID;

import com.agrinova.backend.modules.rbac.domain.Permission;

public record PermissionResponse(UUID permissionId, String name, String resource, String action, boolean active) {

    public static PermissionResponse from(Permission permission) {
        return new PermissionResponse(permission.getId(), permission.getName(), permission.getResource(),
                permission.getAction(), permission.isActive());
    }
}
