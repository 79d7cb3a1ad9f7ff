package com.agrinova.backend.modules.auth.domain;

import java.util.UUID;

public record VerifiedIdentity(
        UUID userId,
        String username,
        String email,
        String fullName,
        String role,
        UUID companyId
) {

    public static VerifiedIdentity from(AppUser user) {
        return new VerifiedIdentity(
                user.getId(),
                user.getUsername(),
                user.getEmail(),
                user.getFullName(),
                user.getRole().getName(),
                user.getCompanyId()
        );
    }
}
