package com.agrinova.backend.modules.auth.domain;

import org.springframework.http.HttpStatus;

/**
 * Client-visible authentication and authorization failure categories.
 * The detail text is deliberately generic and never names an identity or a permission.
 */
public enum AuthFailureKind {

    INVALID_CREDENTIALS(HttpStatus.UNAUTHORIZED, "Invalid credentials"),
    DEVICE_MISMATCH(HttpStatus.FORBIDDEN, "Device verification failed"),
    DEVICE_REVOKED(HttpStatus.FORBIDDEN, "Device access has been revoked"),
    RATE_LIMITED(HttpStatus.TOO_MANY_REQUESTS, "Too many attempts, try again later"),
    EXPIRED(HttpStatus.UNAUTHORIZED, "Token expired"),
    MALFORMED(HttpStatus.UNAUTHORIZED, "Token is not valid"),
    WRONG_KIND(HttpStatus.UNAUTHORIZED, "Token is not valid for this operation"),
    REVOKED(HttpStatus.UNAUTHORIZED, "Session has been revoked"),
    PERMISSION_DENIED(HttpStatus.FORBIDDEN, "Permission denied"),
    STORE_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE, "Authentication store unavailable");

    private final HttpStatus status;
    private final String defaultDetail;

    AuthFailureKind(HttpStatus status, String defaultDetail) {
        this.status = status;
        this.defaultDetail = defaultDetail;
    }

    public HttpStatus getStatus() {
        return status;
    }

    public String getDefaultDetail() {
        return defaultDetail;
    }
}
