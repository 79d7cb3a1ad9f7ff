package com.agrinova.backend.modules.auth.presentation.dto;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import com.agrinova.backend.modules.auth.domain.AppUser;
import com.agrinova.backend.modules.rbac.domain.EffectivePermissions;

public record UserProfileResponse(
        UUID userId,
        String username,
        String fullName,
        String email,
        String role,
        String roleDisplayName,
        UUID companyId,
        List<String> permissions,
        OffsetDateTime passwordChangedAt,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {

    public static UserProfileResponse from(AppUser user, EffectivePermissions permissions) {
        return new UserProfileResponse(
                user.getId(),
                user.getUsername(),
                user.getFullName(),
                user.getEmail(),
                user.getRole().getName(),
                user.getRole().getDisplayName(),
                user.getCompanyId(),
                List.copyOf(permissions.names()),
                user.getPasswordChangedAt(),
                user.getCreatedAt(),
                user.getUpdatedAt()
        );
    }
}
