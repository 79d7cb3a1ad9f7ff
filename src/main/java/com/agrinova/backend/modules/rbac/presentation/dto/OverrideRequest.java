package com.agrinova.backend.modules.rbac.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

public record OverrideRequest(
        @NotNull(message = "userId is required") UUID userId,
        @NotBlank(message = "permission is required") String permission,
        @NotBlank @Pattern(regexp = "GRANT|DENY", message = "effect must be GRANT or DENY") String effect,
        OffsetDateTime expiresAt,
        @Size(max = 255) String reason
) {

    public boolean isGrant() {
        return "GRANT".equals(effect);
    }
}
