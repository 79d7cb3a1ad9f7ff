package com.agrinova.backend.modules.rbac.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.agrinova.backend.modules.rbac.domain.UserPermissionOverride;

public record OverrideResponse(
        UUID overrideId,
        UUID userId,
        String permission,
        String effect,
        OffsetDateTime expiresAt,
        UUID assignedBy,
        String reason,
        OffsetDateTime createdAt
) {

    public static OverrideResponse from(UserPermissionOverride override) {
        return new OverrideResponse(
                override.getId(),
                override.getUserId(),
                override.getPermission().getName(),
                override.isGranted() ? "GRANT" : "DENY",
                override.getExpiresAt(),
                override.getAssignedBy(),
                override.getReason(),
                override.getCreatedAt()
        );
    }
}
