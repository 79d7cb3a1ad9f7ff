package com.agrinova.backend.global.health;

import java.time.Clock;
import java.time.Instant;

import org.springframework.boot.actuate.health.CompositeHealth;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthComponent;
import org.springframework.boot.actuate.health.HealthEndpoint;
import org.springframework.boot.actuate.health.Status;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Liveness at {@code /health}; readiness at {@code /readyz} follows the database health indicator, since
 * no authentication decision can be made without the auth store.
 */
@RestController
public class HealthController {

    private final HealthEndpoint healthEndpoint;
    private final Clock clock;

    public HealthController(HealthEndpoint healthEndpoint, Clock clock) {
        this.healthEndpoint = healthEndpoint;
        this.clock = clock;
    }

    @GetMapping("/health")
    public HealthResponse health() {
        return new HealthResponse(Status.UP.getCode(), Instant.now(clock).toString());
    }

    @GetMapping("/readyz")
    public ResponseEntity<HealthResponse> readyz() {
        HealthComponent component = healthEndpoint.health();
        Status status = component.getStatus();
        if (component instanceof CompositeHealth composite
                && composite.getComponents().get("db") instanceof Health dbHealth) {
            status = dbHealth.getStatus();
        }
        HttpStatus httpStatus = Status.UP.equals(status) ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE;
        return ResponseEntity.status(httpStatus).body(new HealthResponse(status.getCode(), Instant.now(clock).toString()));
    }

    public record HealthResponse(String status, String timestamp) {
    }
}
