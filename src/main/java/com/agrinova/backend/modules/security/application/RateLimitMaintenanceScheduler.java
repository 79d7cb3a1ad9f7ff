package com.agrinova.backend.modules.security.application;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class RateLimitMaintenanceScheduler {

    private static final Logger log = LoggerFactory.getLogger(RateLimitMaintenanceScheduler.class);

    private final AuthRateLimiter authRateLimiter;

    public RateLimitMaintenanceScheduler(AuthRateLimiter authRateLimiter) {
        this.authRateLimiter = authRateLimiter;
    }

    @Scheduled(fixedDelayString = "${agrinova.rate-limit.eviction-interval:PT5M}")
    public void evictIdleWindows() {
        int evicted = authRateLimiter.evictIdle();
        if (evicted > 0) {
            log.debug("Evicted {} idle rate-limit windows", evicted);
        }
    }
}
