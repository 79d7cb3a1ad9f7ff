package com.agrinova.backend.global.security;

import java.util.Set;
import java.util.UUID;

public record AuthenticatedPrincipal(
        UUID userId,
        String role,
        UUID companyId,
        String deviceId,
        UUID lineageId,
        Set<String> permissions
) {
}
