package com.classengage.backend.modules.health.domain;

import java.time.OffsetDateTime;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

/**
 * One row per database ping; kept as an audit of write round-trips.
 */
@Entity
@Table(name = "app_health_checks")
public class HealthCheck {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "checked_at", nullable = false, updatable = false)
    private OffsetDateTime checkedAt;

    protected HealthCheck() {
    }

    public HealthCheck(OffsetDateTime checkedAt) {
        this.checkedAt = checkedAt;
    }

    public Long getId() {
        return id;
    }

    public OffsetDateTime getCheckedAt() {
        return checkedAt;
    }
}
