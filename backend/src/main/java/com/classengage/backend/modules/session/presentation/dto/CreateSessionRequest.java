package com.classengage.backend.modules.session.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record CreateSessionRequest(
        @NotBlank @Size(max = 200) String title,
        @Size(max = 100) String hostDisplayName
) {
}
