package com.classengage.backend.modules.health.presentation;

import java.time.Clock;
import java.time.Instant;

import com.classengage.backend.modules.health.application.DatabaseHealthService;
import com.classengage.backend.modules.health.presentation.dto.DatabasePingResponse;

import io.swagger.v3.oas.annotations.tags.Tag;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.actuate.health.CompositeHealth;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthComponent;
import org.springframework.boot.actuate.health.HealthEndpoint;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Liveness (/healthz), a plain greeting (/health), readiness (/readyz) and a write round-trip check (/db/ping).
 */
@Tag(name = "health")
@RestController
public class HealthController {

    private static final Logger log = LoggerFactory.getLogger(HealthController.class);

    private final HealthEndpoint healthEndpoint;
    private final DatabaseHealthService databaseHealthService;
    private final Clock clock;

    public HealthController(HealthEndpoint healthEndpoint, DatabaseHealthService databaseHealthService, Clock clock) {
        this.healthEndpoint = healthEndpoint;
        this.databaseHealthService = databaseHealthService;
        this.clock = clock;
    }

    @GetMapping("/healthz")
    public HealthResponse healthz() {
        return new HealthResponse("UP", now());
    }

    /**
     * Reports the database component when present, otherwise the aggregate status.
     */
    @GetMapping("/readyz")
    public ResponseEntity<HealthResponse> readyz() {
        String status;
        try {
            HealthComponent healthComponent = healthEndpoint.health();
            status = healthComponent.getStatus().getCode();
            if (healthComponent instanceof CompositeHealth composite) {
                HealthComponent dbComponent = composite.getComponents().get("db");
                if (dbComponent instanceof Health dbHealth) {
                    status = dbHealth.getStatus().getCode();
                }
            }
        } catch (RuntimeException e) {
            log.warn("Readiness check failed: {}", e.getMessage());
            status = "DOWN";
        }
        HealthResponse body = new HealthResponse(status, now());
        return "UP".equals(status) ? ResponseEntity.ok(body) : ResponseEntity.status(503).body(body);
    }

    @GetMapping("/health")
    public GreetingResponse health() {
        return new GreetingResponse("ok", "Hello World!");
    }

    @PostMapping("/db/ping")
    public DatabasePingResponse dbPing() {
        return databaseHealthService.recordPing();
    }

    private String now() {
        return Instant.now(clock).toString();
    }

    public record GreetingResponse(String status, String message) {}

    public record HealthResponse(
        String status,   // "UP" | "DOWN"
        String timestamp // ISO-8601
    ) {}
}
