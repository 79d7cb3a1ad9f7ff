package com.agrinova.backend.modules.security.infrastructure.ratelimit;

import java.time.Duration;

/**
 * Outcome of a single slot reservation. {@code retryAfter} is zero when the slot was granted.
 */
public record RateLimitDecision(boolean allowed, long count, Duration retryAfter) {

    public static RateLimitDecision allowed(long count) {
        return new RateLimitDecision(true, count, Duration.ZERO);
    }

    public static RateLimitDecision denied(long count, Duration retryAfter) {
        Duration safe = retryAfter == null || retryAfter.isNegative() ? Duration.ZERO : retryAfter;
        return new RateLimitDecision(false, count, safe);
    }

    /**
     * Whole seconds a client should wait, rounded up and never below one for a denial.
     */
    public long retryAfterSeconds() {
        if (allowed) {
            return 0;
        }
        long seconds = retryAfter.getSeconds() + (retryAfter.getNano() > 0 ? 1 : 0);
        return Math.max(1, seconds);
    }
}
