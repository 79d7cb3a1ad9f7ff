package com.agrinova.backend.global.config;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * Fails startup when required settings are missing or the signing secrets are weak.
 */
@Component
public class EnvironmentValidator {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentValidator.class);

    static final int MIN_SECRET_BYTES = 32;

    private static final String[] REQUIRED_KEYS = {
            "spring.datasource.url",
            "jwt.issuer",
            "jwt.access-secret",
            "jwt.refresh-secret",
            "jwt.offline-secret",
            "agrinova.device.fingerprint-secret",
            "app.cors.allowed-origins"
    };

    private static final String[] SECRET_KEYS = {
            "jwt.access-secret",
            "jwt.refresh-secret",
            "jwt.offline-secret",
            "agrinova.device.fingerprint-secret"
    };

    private final Environment environment;

    public EnvironmentValidator(Environment environment) {
        this.environment = environment;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void validateEnvironment() {
        List<String> problems = validate();
        if (!problems.isEmpty()) {
            throw new IllegalStateException("Environment validation failed: " + String.join("; ", problems));
        }
        log.info("Environment validation passed");
    }

    List<String> validate() {
        List<String> problems = new ArrayList<>();
        for (String key : REQUIRED_KEYS) {
            if (value(key).isEmpty()) {
                problems.add("missing " + key);
            }
        }

        Set<String> seen = new HashSet<>();
        for (String key : SECRET_KEYS) {
            Optional<String> secret = value(key);
            if (secret.isEmpty()) {
                continue;
            }
            if (secret.get().getBytes(StandardCharsets.UTF_8).length < MIN_SECRET_BYTES) {
                problems.add(key + " must be at least " + MIN_SECRET_BYTES + " bytes");
            }
            if (!seen.add(secret.get())) {
                problems.add(key + " must differ from the other secrets");
            }
        }
        return problems;
    }

    private Optional<String> value(String key) {
        return Optional.ofNullable(environment.getProperty(key))
                .map(String::trim)
                .filter(v -> !v.isEmpty());
    }
}
