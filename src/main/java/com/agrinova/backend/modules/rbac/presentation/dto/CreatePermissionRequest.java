package com.agrinova.backend.modules.rbac.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record CreatePermissionRequest(
        @NotBlank(message = "resource is required") @Size(max = 50) String resource,
        @NotBlank(message = "action is required") @Size(max = 50) String action,
        @Size(max = 255) String description
) {
}
