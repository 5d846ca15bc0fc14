package com.classengage.backend.modules.session.presentation.dto;

public record UserSummaryResponse(
        Long id,
        String displayName
) {
}
