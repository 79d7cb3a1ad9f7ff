package com.agrinova.backend.modules.auth.application;

import com.agrinova.backend.modules.auth.domain.AuthFailureKind;

/**
 * Allow or deny. A denial carries only a failure category, never the permission that was checked.
 */
public record AuthorizationDecision(boolean allowed, AuthFailureKind reason) {

    private static final AuthorizationDecision ALLOWED = new AuthorizationDecision(true, null);

    public static AuthorizationDecision allow() {
        return ALLOWED;
    }

    public static AuthorizationDecision deny(AuthFailureKind reason) {
        return new AuthorizationDecision(false, reason);
    }
}
