package com.agrinova.backend.modules.rbac.presentation.dto;

import java.util.List;

public record RolePermissionsResponse(String role, List<String> permissions) {
}
