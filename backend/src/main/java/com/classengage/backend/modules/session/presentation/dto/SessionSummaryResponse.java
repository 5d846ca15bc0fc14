package com.classengage.backend.modules.session.presentation.dto;

import java.time.OffsetDateTime;

public record SessionSummaryResponse(
        Long id,
        String code,
        String title,
        String status,
        UserSummaryResponse host,
        OffsetDateTime createdAt
) {
}
