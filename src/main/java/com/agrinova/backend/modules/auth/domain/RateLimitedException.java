package com.agrinova.backend.modules.auth.domain;

public class RateLimitedException extends AuthException {

    private final long retryAfterSeconds;

    public RateLimitedException(long retryAfterSeconds) {
        this(retryAfterSeconds, null);
    }

    public RateLimitedException(long retryAfterSeconds, Throwable cause) {
        super(AuthFailureKind.RATE_LIMITED, cause);
        if (retryAfterSeconds < 0) {
            throw new IllegalArgumentException("retryAfterSeconds must be >= 0");
        }
        this.retryAfterSeconds = retryAfterSeconds;
    }

    public long getRetryAfterSeconds() {
        return retryAfterSeconds;
    }
}
