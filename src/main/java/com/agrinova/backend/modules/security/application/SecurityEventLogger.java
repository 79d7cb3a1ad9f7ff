package com.agrinova.backend.modules.security.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.HashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

import com.agrinova.backend.modules.security.domain.SecurityEvent;
import com.agrinova.backend.modules.security.infrastructure.persistence.SecurityEventRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.slf4j.Marker;
import org.slf4j.MarkerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Best-effort recorder for security decisions.
 * <p>
 * Every event goes to the {@code SECURITY} logger on the calling thread. Persistent event types are
 * then written to {@code security_event} on {@code securityEventExecutor}. Failures in either path are
 * reported at WARN and never reach the caller.
 */
@Service
public class SecurityEventLogger {

    static final String SECURITY_LOGGER_NAME = "SECURITY";
    private static final String REQUEST_ID_MDC_KEY = "requestId";
    private static final Marker CRITICAL = MarkerFactory.getMarker("CRITICAL");

    private static final Logger log = LoggerFactory.getLogger(SecurityEventLogger.class);
    private static final Logger securityLog = LoggerFactory.getLogger(SECURITY_LOGGER_NAME);

    private final SecurityEventRepository securityEventRepository;
    private final Executor securityEventExecutor;
    private final Clock clock;

    public SecurityEventLogger(
            SecurityEventRepository securityEventRepository,
            @Qualifier("securityEventExecutor") Executor securityEventExecutor,
            Clock clock
    ) {
        this.securityEventRepository = securityEventRepository;
        this.securityEventExecutor = securityEventExecutor;
        this.clock = clock;
    }

    public void record(SecurityEventCommand command) {
        if (command == null || command.type() == null) {
            return;
        }
        OffsetDateTime occurredAt = OffsetDateTime.now(clock);
        try {
            writeLog(command);
        } catch (RuntimeException ex) {
            log.warn("Failed to log security event {}", command.type(), ex);
        }

        if (!command.type().isPersistent()) {
            return;
        }
        String requestId = MDC.get(REQUEST_ID_MDC_KEY);
        try {
            securityEventExecutor.execute(() -> persist(command, occurredAt, requestId));
        } catch (RejectedExecutionException ex) {
            log.warn("Security event queue full, dropping {} event", command.type());
        }
    }

    private void writeLog(SecurityEventCommand command) {
        try (MDC.MDCCloseable ignoredType = MDC.putCloseable("securityEvent", command.type().name());
             MDC.MDCCloseable ignoredOutcome = MDC.putCloseable("securityOutcome", command.outcome().name())) {
            String message = "{} outcome={} user={} identifier={} device={} source={} detail={}";
            Object[] args = {
                    command.type(),
                    command.outcome(),
                    command.userId(),
                    command.identifier(),
                    command.deviceId(),
                    command.sourceAddress(),
                    command.detail()
            };
            switch (command.severity()) {
                case CRITICAL -> securityLog.error(CRITICAL, message, args);
                case ERROR -> securityLog.error(message, args);
                case WARNING -> securityLog.warn(message, args);
                default -> {
                    if (command.type().isPersistent()) {
                        securityLog.info(message, args);
                    } else {
                        securityLog.debug(message, args);
                    }
                }
            }
        }
    }

    private void persist(SecurityEventCommand command, OffsetDateTime occurredAt, String requestId) {
        try {
            SecurityEvent event = new SecurityEvent();
            event.setEventType(command.type());
            event.setSeverity(command.severity());
            event.setOutcome(command.outcome());
            event.setIdentifier(truncate(command.identifier(), 320));
            event.setUserId(command.userId());
            event.setDeviceId(truncate(command.deviceId(), 100));
            event.setSourceAddress(truncate(command.sourceAddress(), 64));
            event.setRequestId(truncate(requestId, 64));
            if (command.detail() != null && !command.detail().isEmpty()) {
                event.setDetail(new HashMap<>(command.detail()));
            }
            event.setCreatedAt(occurredAt);
            securityEventRepository.save(event);
        } catch (RuntimeException ex) {
            log.warn("Failed to persist security event {}", command.type(), ex);
        }
    }

    private static String truncate(String value, int max) {
        if (value == null || value.length() <= max) {
            return value;
        }
        return value.substring(0, max);
    }
}
