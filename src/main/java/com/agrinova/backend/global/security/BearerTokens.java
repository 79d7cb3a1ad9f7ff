package com.agrinova.backend.global.security;

import java.util.Optional;

import org.springframework.util.StringUtils;

public final class BearerTokens {

    private static final String BEARER_PREFIX = "Bearer ";

    private BearerTokens() {
    }

    /**
     * Extracts the token from an {@code Authorization} header value. The scheme is matched case-insensitively.
     */
    public static Optional<String> extract(String authorizationHeader) {
        if (!StringUtils.hasText(authorizationHeader)
                || authorizationHeader.length() <= BEARER_PREFIX.length()
                || !authorizationHeader.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            return Optional.empty();
        }
        String token = authorizationHeader.substring(BEARER_PREFIX.length()).trim();
        return token.isEmpty() ? Optional.empty() : Optional.of(token);
    }
}
