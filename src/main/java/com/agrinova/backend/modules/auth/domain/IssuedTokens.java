package com.agrinova.backend.modules.auth.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Tokens minted for one lineage. {@code offlineToken} is only present for mobile logins that asked for it.
 */
public record IssuedTokens(
        String accessToken,
        String refreshToken,
        String offlineToken,
        long expiresIn,
        long refreshExpiresIn,
        UUID lineageId,
        OffsetDateTime issuedAt
) {
}
