package com.classengage.backend.modules.session.presentation.dto;

import jakarta.validation.constraints.Size;

// Blank names reach the service, which answers INVALID_DISPLAY_NAME.
public record JoinSessionRequest(
        @Size(max = 100) String displayName
) {
}
