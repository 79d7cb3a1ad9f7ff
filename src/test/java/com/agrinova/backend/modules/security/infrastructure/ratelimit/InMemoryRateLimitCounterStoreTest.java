package com.agrinova.backend.modules.security.infrastructure.ratelimit;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import com.agrinova.backend.support.MutableClock;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class InMemoryRateLimitCounterStoreTest {

    private static final Duration WINDOW = Duration.ofMinutes(15);

    private MutableClock clock;
    private InMemoryRateLimitCounterStore store;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2025-03-01T06:00:00Z"));
        store = new InMemoryRateLimitCounterStore(clock);
    }

    @Test
    void deniesOnceLimitReachedWithinWindow() {
        for (int i = 1; i <= 5; i++) {
            assertThat(store.tryAcquire("login:mandor1|10.0.0.1", 5, WINDOW).allowed()).isTrue();
        }

        RateLimitDecision denied = store.tryAcquire("login:mandor1|10.0.0.1", 5, WINDOW);

        assertThat(denied.allowed()).isFalse();
        assertThat(denied.count()).isEqualTo(5);
        assertThat(denied.retryAfterSeconds()).isEqualTo(WINDOW.toSeconds());
    }

    @Test
    void slidingWindowFreesOldestSlot() {
        store.tryAcquire("k", 2, WINDOW);
        clock.advance(Duration.ofMinutes(5));
        store.tryAcquire("k", 2, WINDOW);
        assertThat(store.tryAcquire("k", 2, WINDOW).allowed()).isFalse();

        clock.advance(Duration.ofMinutes(10));

        assertThat(store.tryAcquire("k", 2, WINDOW).allowed()).isTrue();
        assertThat(store.tryAcquire("k", 2, WINDOW).allowed()).isFalse();
    }

    @Test
    void resetClearsKey() {
        store.tryAcquire("k", 1, WINDOW);
        store.reset("k");

        assertThat(store.tryAcquire("k", 1, WINDOW).allowed()).isTrue();
    }

    @Test
    void releaseGivesBackOnlyTheLatestSlot() {
        store.tryAcquire("k", 2, WINDOW);
        store.tryAcquire("k", 2, WINDOW);
        store.release("k");

        assertThat(store.tryAcquire("k", 2, WINDOW).allowed()).isTrue();
        assertThat(store.tryAcquire("k", 2, WINDOW).allowed()).isFalse();
    }

    @Test
    void releasingTheLastSlotForgetsTheKey() {
        store.tryAcquire("k", 2, WINDOW);
        store.release("k");
        store.release("unknown");

        assertThat(store.trackedKeys()).isZero();
    }

    @Test
    void evictIdleDropsExpiredWindowsOnly() {
        store.tryAcquire("old", 5, WINDOW);
        clock.advance(Duration.ofMinutes(20));
        store.tryAcquire("fresh", 5, WINDOW);

        assertThat(store.evictIdle()).isEqualTo(1);
        assertThat(store.trackedKeys()).isEqualTo(1);
    }

    @Test
    void concurrentAcquiresNeverExceedLimit() throws Exception {
        int threads = 16;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch ready = new CountDownLatch(threads);
        CountDownLatch start = new CountDownLatch(1);

        Callable<Boolean> task = () -> {
            ready.countDown();
            start.await(5, TimeUnit.SECONDS);
            return store.tryAcquire("shared", 5, WINDOW).allowed();
        };

        try {
            List<Future<Boolean>> futures = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                futures.add(executor.submit(task));
            }
            ready.await(5, TimeUnit.SECONDS);
            start.countDown();

            int granted = 0;
            for (Future<Boolean> future : futures) {
                if (future.get(5, TimeUnit.SECONDS)) {
                    granted++;
                }
            }
            assertThat(granted).isEqualTo(5);
        } finally {
            executor.shutdownNow();
        }
    }
}
