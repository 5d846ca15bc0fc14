package com.classengage.backend.modules.session.presentation.dto;

import jakarta.validation.constraints.NotNull;

public record SubmitQuestionRequest(
        @NotNull String body
) {
}
