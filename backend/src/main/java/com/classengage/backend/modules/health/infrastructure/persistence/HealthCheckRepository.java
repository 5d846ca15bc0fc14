package com.classengage.backend.modules.health.infrastructure.persistence;

import com.classengage.backend.modules.health.domain.HealthCheck;

import org.springframework.data.jpa.repository.JpaRepository;

public interface HealthCheckRepository extends JpaRepository<HealthCheck, Long> {
}
