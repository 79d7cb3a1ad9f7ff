package com.agrinova.backend.modules.auth.application;

import com.agrinova.backend.modules.auth.domain.AuthException;
import com.agrinova.backend.modules.auth.domain.AuthFailureKind;
import com.agrinova.backend.modules.auth.domain.IssuedTokens;
import com.agrinova.backend.modules.auth.domain.RateLimitedException;
import com.agrinova.backend.modules.auth.domain.SessionState;
import com.agrinova.backend.modules.auth.domain.VerifiedIdentity;
import com.agrinova.backend.modules.rbac.domain.EffectivePermissions;

/**
 * Outcome of a login, refresh or resume. On failure only {@code state}, {@code failureReason} and, for
 * rate limiting, {@code retryAfterSeconds} are set.
 */
public record SessionResult(
        boolean success,
        SessionState state,
        VerifiedIdentity identity,
        IssuedTokens tokens,
        EffectivePermissions permissions,
        AuthFailureKind failureReason,
        long retryAfterSeconds
) {

    public static SessionResult authenticated(VerifiedIdentity identity, IssuedTokens tokens,
                                              EffectivePermissions permissions) {
        return new SessionResult(true, SessionState.AUTHENTICATED, identity, tokens, permissions, null, 0);
    }

    public static SessionResult failed(SessionState state, AuthFailureKind reason) {
        return new SessionResult(false, state, null, null, EffectivePermissions.none(), reason, 0);
    }

    public static SessionResult rateLimited(SessionState state, long retryAfterSeconds) {
        return new SessionResult(false, state, null, null, EffectivePermissions.none(), AuthFailureKind.RATE_LIMITED,
                retryAfterSeconds);
    }

    /**
     * Returns this result when successful, otherwise throws the matching {@link AuthException}.
     */
    public SessionResult orThrow() {
        if (success) {
            return this;
        }
        if (failureReason == AuthFailureKind.RATE_LIMITED) {
            throw new RateLimitedException(retryAfterSeconds);
        }
        throw new AuthException(failureReason);
    }
}
