package com.agrinova.backend.modules.security.domain;

/**
 * Security-relevant decisions. Non-persistent types are written to the log only.
 */
public enum SecurityEventType {

    LOGIN_SUCCESS(SecuritySeverity.INFO, true),
    LOGIN_FAILURE(SecuritySeverity.WARNING, true),
    LOGIN_RATE_LIMITED(SecuritySeverity.WARNING, true),
    CREDENTIAL_HASHING_SATURATED(SecuritySeverity.ERROR, true),
    DEVICE_BOUND(SecuritySeverity.INFO, true),
    DEVICE_MISMATCH(SecuritySeverity.CRITICAL, true),
    DEVICE_REVOKED_ACCESS(SecuritySeverity.WARNING, true),
    DEVICE_REVOKED(SecuritySeverity.INFO, true),
    DEVICE_UNBOUND(SecuritySeverity.INFO, true),
    TOKEN_REFRESHED(SecuritySeverity.INFO, true),
    TOKEN_REFRESH_REJECTED(SecuritySeverity.WARNING, true),
    TOKEN_REJECTED(SecuritySeverity.WARNING, true),
    OFFLINE_ACCESS_VALIDATED(SecuritySeverity.INFO, true),
    OFFLINE_ACCESS_REJECTED(SecuritySeverity.WARNING, true),
    OFFLINE_RENEWED(SecuritySeverity.INFO, true),
    AUTHORIZATION_ALLOWED(SecuritySeverity.INFO, false),
    AUTHORIZATION_DENIED(SecuritySeverity.WARNING, true),
    LOGOUT(SecuritySeverity.INFO, true),
    LOGOUT_ALL(SecuritySeverity.INFO, true),
    PASSWORD_CHANGED(SecuritySeverity.INFO, true),
    PASSWORD_CHANGE_REJECTED(SecuritySeverity.WARNING, true),
    MUTATION_RATE_LIMITED(SecuritySeverity.WARNING, true),
    PERMISSION_OVERRIDE_CHANGED(SecuritySeverity.INFO, true),
    ROLE_CHANGED(SecuritySeverity.INFO, true),
    STORE_UNAVAILABLE(SecuritySeverity.ERROR, true);

    private final SecuritySeverity defaultSeverity;
    private final boolean persistent;

    SecurityEventType(SecuritySeverity defaultSeverity, boolean persistent) {
        this.defaultSeverity = defaultSeverity;
        this.persistent = persistent;
    }

    public SecuritySeverity getDefaultSeverity() {
        return defaultSeverity;
    }

    public boolean isPersistent() {
        return persistent;
    }
}
