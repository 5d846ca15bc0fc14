package com.classengage.backend.modules.session.presentation.dto;

import java.time.OffsetDateTime;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * {@code author} is serialized as an explicit {@code null} for anonymous questions.
 */
@JsonInclude(JsonInclude.Include.ALWAYS)
public record QuestionSummaryResponse(
        Long id,
        Long sessionId,
        String body,
        String status,
        int likes,
        UserSummaryResponse author,
        OffsetDateTime createdAt
) {
}
