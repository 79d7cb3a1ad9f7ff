package com.agrinova.backend.global.web;

import java.io.IOException;
import java.util.List;
import java.util.UUID;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Opens the logging context of a request: request id and client address here, the authenticated user and
 * session lineage once the bearer token is accepted (see {@link #bindSession}). Everything is cleared when
 * the request leaves the chain so pooled threads never carry another caller's identity.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class RequestIdFilter extends OncePerRequestFilter {

    public static final String REQUEST_ID_HEADER = "X-Request-Id";
    public static final String REQUEST_ID_MDC_KEY = "requestId";
    public static final String CLIENT_ADDRESS_MDC_KEY = "clientAddress";
    public static final String USER_ID_MDC_KEY = "userId";
    public static final String LINEAGE_ID_MDC_KEY = "lineageId";

    private static final List<String> MDC_KEYS = List.of(REQUEST_ID_MDC_KEY, CLIENT_ADDRESS_MDC_KEY, USER_ID_MDC_KEY,
            LINEAGE_ID_MDC_KEY);
    private static final int MAX_REQUEST_ID_LENGTH = 64;

    @Override
    protected void doFilterInternal(@NonNull HttpServletRequest request,
                                    @NonNull HttpServletResponse response,
                                    @NonNull FilterChain filterChain) throws ServletException, IOException {
        String requestId = resolveRequestId(request);
        MDC.put(REQUEST_ID_MDC_KEY, requestId);
        MDC.put(CLIENT_ADDRESS_MDC_KEY, ClientAddressResolver.resolve(request));
        request.setAttribute(REQUEST_ID_HEADER, requestId);
        response.setHeader(REQUEST_ID_HEADER, requestId);
        try {
            filterChain.doFilter(request, response);
        } finally {
            MDC_KEYS.forEach(MDC::remove);
        }
    }

    /**
     * Adds the authenticated caller to the current logging context.
     */
    public static void bindSession(UUID userId, UUID lineageId) {
        MDC.put(USER_ID_MDC_KEY, String.valueOf(userId));
        MDC.put(LINEAGE_ID_MDC_KEY, String.valueOf(lineageId));
    }

    public static void unbindSession() {
        MDC.remove(USER_ID_MDC_KEY);
        MDC.remove(LINEAGE_ID_MDC_KEY);
    }

    /**
     * @return the id of the request being served, or {@code null} outside a request
     */
    public static String currentRequestId() {
        return MDC.get(REQUEST_ID_MDC_KEY);
    }

    private String resolveRequestId(HttpServletRequest request) {
        String header = request.getHeader(REQUEST_ID_HEADER);
        if (StringUtils.hasText(header)) {
            String trimmed = header.trim();
            if (trimmed.length() <= MAX_REQUEST_ID_LENGTH && trimmed.chars().allMatch(RequestIdFilter::isSafe)) {
                return trimmed;
            }
        }
        return UUID.randomUUID().toString();
    }

    // keeps client-chosen ids from forging log lines
    private static boolean isSafe(int ch) {
        return Character.isLetterOrDigit(ch) || ch == '-' || ch == '_' || ch == '.' || ch == ':';
    }
}
