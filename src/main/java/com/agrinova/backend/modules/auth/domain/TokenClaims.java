package com.agrinova.backend.modules.auth.domain;

import java.time.Instant;
import java.util.UUID;

public record TokenClaims(
        UUID tokenId,
        TokenKind kind,
        UUID userId,
        UUID lineageId,
        String deviceId,
        String role,
        UUID companyId,
        Instant issuedAt,
        Instant expiresAt
) {

    public boolean isDeviceBound() {
        return deviceId != null;
    }
}
