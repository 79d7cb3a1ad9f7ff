package com.agrinova.backend.modules.security.application;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

import com.agrinova.backend.modules.auth.domain.RateLimitedException;
import com.agrinova.backend.modules.security.domain.SecurityEventType;
import com.agrinova.backend.modules.security.domain.SecurityOutcome;
import com.agrinova.backend.modules.security.infrastructure.ratelimit.RateLimitCounterStore;
import com.agrinova.backend.modules.security.infrastructure.ratelimit.RateLimitDecision;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Throttles login attempts per (identifier, source address) and sensitive mutations per (user, operation).
 * <p>
 * A login slot is reserved before the credential check. A successful login releases every slot for the key;
 * a failed one keeps its slot, so the attempt after {@code max-failures} failures is rejected without hashing.
 */
@Service
public class AuthRateLimiter {

    private static final String LOGIN_KEY_PREFIX = "login:";
    private static final String MUTATION_KEY_PREFIX = "mutation:";

    private final RateLimitCounterStore counterStore;
    private final SecurityEventLogger securityEventLogger;
    private final int loginMaxFailures;
    private final Duration loginWindow;
    private final int mutationMaxRequests;
    private final Duration mutationWindow;

    public AuthRateLimiter(
            RateLimitCounterStore counterStore,
            SecurityEventLogger securityEventLogger,
            @Value("${agrinova.rate-limit.login.max-failures:5}") int loginMaxFailures,
            @Value("${agrinova.rate-limit.login.window:PT15M}") Duration loginWindow,
            @Value("${agrinova.rate-limit.mutation.max-requests:30}") int mutationMaxRequests,
            @Value("${agrinova.rate-limit.mutation.window:PT1M}") Duration mutationWindow
    ) {
        this.counterStore = counterStore;
        this.securityEventLogger = securityEventLogger;
        this.loginMaxFailures = loginMaxFailures;
        this.loginWindow = loginWindow;
        this.mutationMaxRequests = mutationMaxRequests;
        this.mutationWindow = mutationWindow;
    }

    public void acquireLoginAttempt(String identifier, String sourceAddress) {
        RateLimitDecision decision = counterStore.tryAcquire(loginKey(identifier, sourceAddress), loginMaxFailures,
                loginWindow);
        if (!decision.allowed()) {
            securityEventLogger.record(SecurityEventCommand.of(SecurityEventType.LOGIN_RATE_LIMITED, SecurityOutcome.DENIED)
                    .withIdentifier(identifier)
                    .withSource(sourceAddress)
                    .withDetail(Map.of("retryAfterSeconds", decision.retryAfterSeconds())));
            throw new RateLimitedException(decision.retryAfterSeconds());
        }
    }

    public void releaseLoginAttempts(String identifier, String sourceAddress) {
        counterStore.reset(loginKey(identifier, sourceAddress));
    }

    /**
     * Returns the slot reserved by the current attempt without touching earlier failures.
     */
    public void releaseLoginAttempt(String identifier, String sourceAddress) {
        counterStore.release(loginKey(identifier, sourceAddress));
    }

    public void checkMutation(UUID userId, String operation) {
        String key = MUTATION_KEY_PREFIX + userId + "|" + operation;
        RateLimitDecision decision = counterStore.tryAcquire(key, mutationMaxRequests, mutationWindow);
        if (!decision.allowed()) {
            securityEventLogger.record(SecurityEventCommand.of(SecurityEventType.MUTATION_RATE_LIMITED, SecurityOutcome.DENIED)
                    .withUser(userId)
                    .withDetail(Map.of("operation", operation)));
            throw new RateLimitedException(decision.retryAfterSeconds());
        }
    }

    public int evictIdle() {
        return counterStore.evictIdle();
    }

    static String loginKey(String identifier, String sourceAddress) {
        String normalizedIdentifier = identifier == null ? "" : identifier.trim().toLowerCase(Locale.ROOT);
        String normalizedSource = sourceAddress == null ? "unknown" : sourceAddress;
        return LOGIN_KEY_PREFIX + normalizedIdentifier + "|" + normalizedSource;
    }
}
