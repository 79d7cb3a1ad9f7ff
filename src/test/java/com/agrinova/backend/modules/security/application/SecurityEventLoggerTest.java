package com.agrinova.backend.modules.security.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

import com.agrinova.backend.modules.security.domain.SecurityEvent;
import com.agrinova.backend.modules.security.domain.SecurityEventType;
import com.agrinova.backend.modules.security.domain.SecurityOutcome;
import com.agrinova.backend.modules.security.domain.SecuritySeverity;
import com.agrinova.backend.modules.security.infrastructure.persistence.SecurityEventRepository;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.MDC;
import org.springframework.dao.DataAccessResourceFailureException;

@ExtendWith(MockitoExtension.class)
class SecurityEventLoggerTest {

    private static final Instant NOW = Instant.parse("2025-03-01T06:00:00Z");

    @Mock
    private SecurityEventRepository securityEventRepository;

    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);

    @AfterEach
    void clearMdc() {
        MDC.clear();
    }

    @Test
    void persistsEventWithRequestIdAndTruncatedFields() {
        SecurityEventLogger logger = new SecurityEventLogger(securityEventRepository, Runnable::run, clock);
        UUID userId = UUID.randomUUID();
        MDC.put("requestId", "req-42");

        logger.record(SecurityEventCommand.of(SecurityEventType.DEVICE_MISMATCH, SecurityOutcome.DENIED)
                .withUser(userId)
                .withDevice("d".repeat(150))
                .withSource("203.0.113.9")
                .withDetail(Map.of("platform", "ANDROID")));

        ArgumentCaptor<SecurityEvent> captor = ArgumentCaptor.forClass(SecurityEvent.class);
        verify(securityEventRepository).save(captor.capture());
        SecurityEvent event = captor.getValue();
        assertThat(event.getEventType()).isEqualTo(SecurityEventType.DEVICE_MISMATCH);
        assertThat(event.getSeverity()).isEqualTo(SecuritySeverity.CRITICAL);
        assertThat(event.getOutcome()).isEqualTo(SecurityOutcome.DENIED);
        assertThat(event.getUserId()).isEqualTo(userId);
        assertThat(event.getDeviceId()).hasSize(100);
        assertThat(event.getSourceAddress()).isEqualTo("203.0.113.9");
        assertThat(event.getRequestId()).isEqualTo("req-42");
        assertThat(event.getDetail()).containsEntry("platform", "ANDROID");
        assertThat(event.getCreatedAt()).isEqualTo(OffsetDateTime.ofInstant(NOW, ZoneOffset.UTC));
    }

    @Test
    void logOnlyEventsAreNotPersisted() {
        SecurityEventLogger logger = new SecurityEventLogger(securityEventRepository, Runnable::run, clock);

        logger.record(SecurityEventCommand.of(SecurityEventType.AUTHORIZATION_ALLOWED, SecurityOutcome.SUCCESS));

        verify(securityEventRepository, never()).save(any());
    }

    @Test
    void storeFailureDoesNotReachTheCaller() {
        SecurityEventLogger logger = new SecurityEventLogger(securityEventRepository, Runnable::run, clock);
        when(securityEventRepository.save(any(SecurityEvent.class)))
                .thenThrow(new DataAccessResourceFailureException("down"));

        assertThatCode(() -> logger.record(SecurityEventCommand.of(SecurityEventType.LOGIN_FAILURE, SecurityOutcome.FAILURE)
                .withIdentifier("mandor1")))
                .doesNotThrowAnyException();
    }

    @Test
    void fullQueueDropsTheEvent() {
        Executor rejecting = task -> {
            throw new RejectedExecutionException("queue full");
        };
        SecurityEventLogger logger = new SecurityEventLogger(securityEventRepository, rejecting, clock);

        assertThatCode(() -> logger.record(SecurityEventCommand.of(SecurityEventType.LOGOUT, SecurityOutcome.SUCCESS)))
                .doesNotThrowAnyException();
        verify(securityEventRepository, never()).save(any());
    }

    @Test
    void nullCommandIsIgnored() {
        SecurityEventLogger logger = new SecurityEventLogger(securityEventRepository, Runnable::run, clock);

        logger.record(null);

        verify(securityEventRepository, never()).save(any());
    }
}
