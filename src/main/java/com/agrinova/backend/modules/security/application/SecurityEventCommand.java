package com.agrinova.backend.modules.security.application;

import java.util.Map;
import java.util.UUID;

import com.agrinova.backend.modules.security.domain.SecurityEventType;
import com.agrinova.backend.modules.security.domain.SecurityOutcome;
import com.agrinova.backend.modules.security.domain.SecuritySeverity;

public record SecurityEventCommand(
        SecurityEventType type,
        SecuritySeverity severity,
        SecurityOutcome outcome,
        String identifier,
        UUID userId,
        String deviceId,
        String sourceAddress,
        Map<String, Object> detail
) {

    public static SecurityEventCommand of(SecurityEventType type, SecurityOutcome outcome) {
        return new SecurityEventCommand(type, type.getDefaultSeverity(), outcome, null, null, null, null, Map.of());
    }

    public SecurityEventCommand withIdentifier(String value) {
        return new SecurityEventCommand(type, severity, outcome, value, userId, deviceId, sourceAddress, detail);
    }

    public SecurityEventCommand withUser(UUID value) {
        return new SecurityEventCommand(type, severity, outcome, identifier, value, deviceId, sourceAddress, detail);
    }

    public SecurityEventCommand withDevice(String value) {
        return new SecurityEventCommand(type, severity, outcome, identifier, userId, value, sourceAddress, detail);
    }

    public SecurityEventCommand withSource(String value) {
        return new SecurityEventCommand(type, severity, outcome, identifier, userId, deviceId, value, detail);
    }

    public SecurityEventCommand withDetail(Map<String, Object> value) {
        return new SecurityEventCommand(type, severity, outcome, identifier, userId, deviceId, sourceAddress,
                value == null ? Map.of() : value);
    }
}
