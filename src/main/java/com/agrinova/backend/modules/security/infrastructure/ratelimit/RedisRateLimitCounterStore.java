package com.agrinova.backend.modules.security.infrastructure.ratelimit;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

/**
 * Fixed-window counters shared across nodes. The first INCR of a window sets its TTL; an increment over
 * the limit is undone so a denied call holds no slot.
 */
@Component
@ConditionalOnProperty(name = "agrinova.rate-limit.store", havingValue = "redis")
public class RedisRateLimitCounterStore implements RateLimitCounterStore {

    static final String KEY_PREFIX = "agrinova:ratelimit:";

    private final StringRedisTemplate redisTemplate;

    public RedisRateLimitCounterStore(StringRedisTemplate redisTemplate) {
        this.redisTemplate = redisTemplate;
    }

    @Override
    public RateLimitDecision tryAcquire(String key, int limit, Duration window) {
        String redisKey = KEY_PREFIX + key;
        Long count = redisTemplate.opsForValue().increment(redisKey);
        long current = count != null ? count : 1L;
        if (current == 1L) {
            redisTemplate.expire(redisKey, window);
        }
        if (current <= limit) {
            return RateLimitDecision.allowed(current);
        }
        redisTemplate.opsForValue().decrement(redisKey);
        Long ttl = redisTemplate.getExpire(redisKey, TimeUnit.MILLISECONDS);
        if (ttl == null || ttl < 0) {
            // key lost its TTL, restart the window
            redisTemplate.expire(redisKey, window);
            return RateLimitDecision.denied(current - 1, window);
        }
        return RateLimitDecision.denied(current - 1, Duration.ofMillis(ttl));
    }

    @Override
    public void reset(String key) {
        redisTemplate.delete(KEY_PREFIX + key);
    }

    @Override
    public void release(String key) {
        String redisKey = KEY_PREFIX + key;
        Long remaining = redisTemplate.opsForValue().decrement(redisKey);
        if (remaining != null && remaining <= 0) {
            redisTemplate.delete(redisKey);
        }
    }

    @Override
    public int evictIdle() {
        return 0;
    }
}
