package com.agrinova.backend.global.error;

import java.util.Locale;

import com.agrinova.backend.global.web.RequestIdFilter;

import org.springframework.http.HttpStatus;

/**
 * RFC 7807 style error body. {@code code} is the stable machine-readable reason clients branch on;
 * {@code requestId} matches the {@code X-Request-Id} response header and the server log lines of the call.
 */
public record ProblemResponse(
        String type,
        String title,
        int status,
        String detail,
        String instance,
        String code,
        String requestId
) {

    private static final String TYPE_PREFIX = "https://agrinova.app/errors/";

    public static ProblemResponse of(HttpStatus httpStatus, String code, String detail, String instance) {
        String resolvedCode = (code != null && !code.isBlank()) ? code : httpStatus.name();
        String slug = resolvedCode.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9\\-_.]+", "-");
        String resolvedDetail = (detail != null && !detail.isBlank()) ? detail : httpStatus.getReasonPhrase();
        return new ProblemResponse(TYPE_PREFIX + slug, httpStatus.getReasonPhrase(), httpStatus.value(),
                resolvedDetail, instance, resolvedCode, RequestIdFilter.currentRequestId());
    }
}
