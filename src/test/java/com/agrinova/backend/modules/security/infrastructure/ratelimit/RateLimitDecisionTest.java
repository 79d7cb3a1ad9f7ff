package com.agrinova.backend.modules.security.infrastructure.ratelimit;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;

import org.junit.jupiter.api.Test;

class RateLimitDecisionTest {

    @Test
    void retryAfterRoundsUp() {
        assertThat(RateLimitDecision.denied(5, Duration.ofMillis(1500)).retryAfterSeconds()).isEqualTo(2);
    }

    @Test
    void denialWaitsAtLeastOneSecond() {
        assertThat(RateLimitDecision.denied(5, Duration.ZERO).retryAfterSeconds()).isEqualTo(1);
        assertThat(RateLimitDecision.denied(5, Duration.ofSeconds(-3)).retryAfterSeconds()).isEqualTo(1);
    }

    @Test
    void allowedHasNoRetryAfter() {
        assertThat(RateLimitDecision.allowed(1).retryAfterSeconds()).isZero();
    }
}
