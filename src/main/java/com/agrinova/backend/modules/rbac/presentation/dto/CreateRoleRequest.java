package com.agrinova.backend.modules.rbac.presentation.dto;

import java.util.List;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record CreateRoleRequest(
        @NotBlank(message = "name is required") @Size(max = 50) String name,
        @Size(max = 100) String displayName,
        @Size(max = 255) String description,
        boolean noAccess,
        @Min(value = 2, message = "level 1 is reserved") @Max(99) Integer level,
        List<String> permissions
) {
}
