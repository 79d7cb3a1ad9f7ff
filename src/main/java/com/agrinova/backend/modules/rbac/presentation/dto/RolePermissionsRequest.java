package com.agrinova.backend.modules.rbac.presentation.dto;

import java.util.List;

import jakarta.validation.constraints.NotEmpty;

public record RolePermissionsRequest(@NotEmpty(message = "permissions must not be empty") List<String> permissions) {
}
