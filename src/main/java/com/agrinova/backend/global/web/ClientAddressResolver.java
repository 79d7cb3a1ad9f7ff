package com.agrinova.backend.global.web;

import jakarta.servlet.http.HttpServletRequest;

import org.springframework.util.StringUtils;

/**
 * Source address used for rate limiting and security events: the first {@code X-Forwarded-For} hop when the
 * proxy sets one, the socket peer otherwise.
 */
public final class ClientAddressResolver {

    static final String FORWARDED_FOR_HEADER = "X-Forwarded-For";

    private ClientAddressResolver() {
    }

    public static String resolve(HttpServletRequest request) {
        String forwarded = request.getHeader(FORWARDED_FOR_HEADER);
        if (StringUtils.hasText(forwarded)) {
            String first = forwarded.split(",", 2)[0].trim();
            if (!first.isEmpty()) {
                return first;
            }
        }
        return request.getRemoteAddr();
    }
}
