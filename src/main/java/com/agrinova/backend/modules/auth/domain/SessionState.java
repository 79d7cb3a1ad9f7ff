package com.agrinova.backend.modules.auth.domain;

import java.util.EnumSet;
import java.util.Set;

/**
 * Client session lifecycle as seen by the orchestrator.
 * <pre>
 * ANONYMOUS -> AUTHENTICATING -> AUTHENTICATED -> REFRESHING -> AUTHENTICATED
 *                                AUTHENTICATED | REFRESHING -> REVOKED_OR_EXPIRED -> ANONYMOUS
 * </pre>
 */
public enum SessionState {
    ANONYMOUS,
    AUTHENTICATING,
    AUTHENTICATED,
    REFRESHING,
    REVOKED_OR_EXPIRED;

    public Set<SessionState> allowedNext() {
        return switch (this) {
            case ANONYMOUS -> EnumSet.of(AUTHENTICATING);
            case AUTHENTICATING -> EnumSet.of(AUTHENTICATED, ANONYMOUS);
            case AUTHENTICATED -> EnumSet.of(REFRESHING, REVOKED_OR_EXPIRED, ANONYMOUS);
            case REFRESHING -> EnumSet.of(AUTHENTICATED, REVOKED_OR_EXPIRED);
            case REVOKED_OR_EXPIRED -> EnumSet.of(ANONYMOUS);
        };
    }

    public boolean canTransitionTo(SessionState next) {
        return allowedNext().contains(next);
    }

    public SessionState transitionTo(SessionState next) {
        if (!canTransitionTo(next)) {
            throw new IllegalStateException("Illegal session transition " + this + " -> " + next);
        }
        return next;
    }
}
