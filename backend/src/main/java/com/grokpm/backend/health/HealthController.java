package com.grokpm.backend.health;

import java.time.Clock;
import java.time.Instant;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.actuate.health.CompositeHealth;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthComponent;
import org.springframework.boot.actuate.health.HealthEndpoint;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Liveness ({@code /healthz}) and database readiness ({@code /readyz}).
 */
@RestController
public class HealthController {

    private static final Logger log = LoggerFactory.getLogger(HealthController.class);

    private final HealthEndpoint healthEndpoint;
    private final Clock clock;

    public HealthController(HealthEndpoint healthEndpoint, Clock clock) {
        this.healthEndpoint = healthEndpoint;
        this.clock = clock;
    }

    @GetMapping("/healthz")
    public HealthResponse healthz() {
        return new HealthResponse("UP", Instant.now(clock).toString());
    }

    @GetMapping("/readyz")
    public ResponseEntity<HealthResponse> readyz() {
        String status;
        try {
            HealthComponent healthComponent = healthEndpoint.health();
            status = healthComponent.getStatus().getCode();
            if (healthComponent instanceof CompositeHealth composite) {
                Object dbDetail = composite.getComponents().get("db");
                if (dbDetail instanceof Health dbHealth) {
                    status = dbHealth.getStatus().getCode();
                }
            }
        } catch (RuntimeException ex) {
            log.warn("Readiness check failed: {}", ex.getMessage());
            status = "DOWN";
        }
        HttpStatus httpStatus = "UP".equals(status) ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE;
        return ResponseEntity.status(httpStatus).body(new HealthResponse(status, Instant.now(clock).toString()));
    }

    public record HealthResponse(
            String status,
            String timestamp
    ) {
    }
}
