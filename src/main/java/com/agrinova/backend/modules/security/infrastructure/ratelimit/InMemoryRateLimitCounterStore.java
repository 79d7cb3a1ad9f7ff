package com.agrinova.backend.modules.security.infrastructure.ratelimit;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Single-node sliding window store. Each key keeps the timestamps of its granted slots; updates to a key
 * run inside {@link ConcurrentMap#compute} so reservation and eviction are atomic per key.
 */
@Component
@ConditionalOnProperty(name = "agrinova.rate-limit.store", havingValue = "memory", matchIfMissing = true)
public class InMemoryRateLimitCounterStore implements RateLimitCounterStore {

    private final ConcurrentMap<String, SlidingWindow> windows = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryRateLimitCounterStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public RateLimitDecision tryAcquire(String key, int limit, Duration window) {
        Instant now = clock.instant();
        AtomicReference<RateLimitDecision> decision = new AtomicReference<>();
        windows.compute(key, (k, existing) -> {
            SlidingWindow current = existing != null ? existing : new SlidingWindow(window);
            current.window = window;
            current.prune(now);
            if (current.hits.size() < limit) {
                current.hits.addLast(now);
                decision.set(RateLimitDecision.allowed(current.hits.size()));
            } else {
                Instant oldest = current.hits.peekFirst();
                decision.set(RateLimitDecision.denied(current.hits.size(),
                        Duration.between(now, oldest.plus(window))));
            }
            return current;
        });
        return decision.get();
    }

    @Override
    public void reset(String key) {
        windows.remove(key);
    }

    @Override
    public void release(String key) {
        windows.computeIfPresent(key, (k, current) -> {
            current.hits.pollLast();
            return current.hits.isEmpty() ? null : current;
        });
    }

    @Override
    public int evictIdle() {
        Instant now = clock.instant();
        AtomicInteger removed = new AtomicInteger();
        for (String key : windows.keySet()) {
            windows.computeIfPresent(key, (k, current) -> {
                current.prune(now);
                if (current.hits.isEmpty()) {
                    removed.incrementAndGet();
                    return null;
                }
                return current;
            });
        }
        return removed.get();
    }

    int trackedKeys() {
        return windows.size();
    }

    private static final class SlidingWindow {

        private final Deque<Instant> hits = new ArrayDeque<>();
        private Duration window;

        private SlidingWindow(Duration window) {
            this.window = window;
        }

        private void prune(Instant now) {
            Instant threshold = now.minus(window);
            while (!hits.isEmpty() && !hits.peekFirst().isAfter(threshold)) {
                hits.pollFirst();
            }
        }
    }
}
