package com.agrinova.backend.global.config;

import java.util.Map;

import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Dedicated executors kept apart from the servlet request pool.
 * <p>
 * {@code credentialHashingExecutor} bounds concurrent Argon2 work so a login burst cannot starve
 * request threads. {@code securityEventExecutor} persists security events off the decision path.
 * Both reject work when their queue is full.
 */
@Configuration
public class AsyncExecutorConfig {

    @Bean(name = "credentialHashingExecutor")
    public ThreadPoolTaskExecutor credentialHashingExecutor(
            @Value("${agrinova.credentials.hashing-pool-size:4}") int poolSize,
            @Value("${agrinova.credentials.hashing-queue-capacity:64}") int queueCapacity
    ) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("credential-hash-");
        executor.setTaskDecorator(mdcPropagatingDecorator());
        executor.initialize();
        return executor;
    }

    @Bean(name = "securityEventExecutor")
    public ThreadPoolTaskExecutor securityEventExecutor(
            @Value("${agrinova.security-events.pool-size:2}") int poolSize,
            @Value("${agrinova.security-events.queue-capacity:1000}") int queueCapacity
    ) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("security-event-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(5);
        executor.setTaskDecorator(mdcPropagatingDecorator());
        executor.initialize();
        return executor;
    }

    static TaskDecorator mdcPropagatingDecorator() {
        return runnable -> {
            Map<String, String> context = MDC.getCopyOfContextMap();
            return () -> {
                Map<String, String> previous = MDC.getCopyOfContextMap();
                if (context != null) {
                    MDC.setContextMap(context);
                } else {
                    MDC.clear();
                }
                try {
                    runnable.run();
                } finally {
                    if (previous != null) {
                        MDC.setContextMap(previous);
                    } else {
                        MDC.clear();
                    }
                }
            };
        };
    }
}
