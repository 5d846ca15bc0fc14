package com.classengage.backend.modules.health.presentation.dto;

public record DatabasePingResponse(
        long insertedId,
        long totalRows
) {
}
