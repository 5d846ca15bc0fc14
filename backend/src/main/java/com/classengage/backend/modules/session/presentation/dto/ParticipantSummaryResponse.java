package com.classengage.backend.modules.session.presentation.dto;

import java.time.OffsetDateTime;

public record ParticipantSummaryResponse(
        UserSummaryResponse user,
        String role,
        OffsetDateTime joinedAt
) {
}
