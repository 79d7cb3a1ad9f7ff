package com.agrinova.backend.modules.auth.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.agrinova.backend.modules.auth.domain.IssuedTokens;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record TokenPairResponse(
        String accessToken,
        String tokenType,
        long expiresIn,
        String refreshToken,
        long refreshExpiresIn,
        String offlineToken,
        UUID sessionId,
        OffsetDateTime issuedAt
) {
    public static final String DEFAULT_TOKEN_TYPE = "Bearer";

    public static TokenPairResponse from(IssuedTokens tokens) {
        return new TokenPairResponse(
                tokens.accessToken(),
                DEFAULT_TOKEN_TYPE,
                tokens.expiresIn(),
                tokens.refreshToken(),
                tokens.refreshExpiresIn(),
                tokens.offlineToken(),
                tokens.lineageId(),
                tokens.issuedAt()
        );
    }
}
