package com.agrinova.backend.modules.auth.presentation.dto;

import java.util.List;
import java.util.UUID;

import com.agrinova.backend.modules.auth.domain.VerifiedIdentity;
import com.agrinova.backend.modules.rbac.domain.EffectivePermissions;

public record SessionUserResponse(
        UUID userId,
        String username,
        String fullName,
        String email,
        String role,
        UUID companyId,
        List<String> permissions
) {

    public static SessionUserResponse from(VerifiedIdentity identity, EffectivePermissions permissions) {
        return new SessionUserResponse(
                identity.userId(),
                identity.username(),
                identity.fullName(),
                identity.email(),
                identity.role(),
                identity.companyId(),
                List.copyOf(permissions.names())
        );
    }
}
