package com.agrinova.backend.modules.security.infrastructure.ratelimit;

import java.time.Duration;

/**
 * Counter backend for the rate limiter. Implementations must make {@link #tryAcquire} atomic per key.
 */
public interface RateLimitCounterStore {

    /**
     * Reserves one slot for {@code key} if fewer than {@code limit} slots are held inside {@code window}.
     * A denied call does not consume a slot.
     */
    RateLimitDecision tryAcquire(String key, int limit, Duration window);

    void reset(String key);

    /**
     * Gives back the most recent slot of {@code key}, if any.
     */
    void release(String key);

    /**
     * Drops keys with no slot left inside their window.
     *
     * @return number of keys removed
     */
    int evictIdle();
}
