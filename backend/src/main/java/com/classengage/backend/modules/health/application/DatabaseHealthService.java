package com.classengage.backend.modules.health.application;

import java.time.Clock;
import java.time.OffsetDateTime;

import com.classengage.backend.modules.health.domain.HealthCheck;
import com.classengage.backend.modules.health.infrastructure.persistence.HealthCheckRepository;
import com.classengage.backend.modules.health.presentation.dto.DatabasePingResponse;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class DatabaseHealthService {

    private final HealthCheckRepository healthCheckRepository;
    private final Clock clock;

    public DatabaseHealthService(HealthCheckRepository healthCheckRepository, Clock clock) {
        this.healthCheckRepository = healthCheckRepository;
        this.clock = clock;
    }

    /**
     * Writes a ping row and reports its id with the running total.
     */
    public DatabasePingResponse recordPing() {
        HealthCheck saved = healthCheckRepository.saveAndFlush(new HealthCheck(OffsetDateTime.now(clock)));
        return new DatabasePingResponse(saved.getId(), healthCheckRepository.count());
    }
}
