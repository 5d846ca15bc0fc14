package com.classengage.backend.modules.session.domain;

import java.util.Arrays;
import java.util.Optional;

public enum QuestionStatus {
    PENDING,
    ANSWERED;

    public String value() {
        return name().toLowerCase();
    }

    /**
     * Parses the lower-case wire value; anything else is empty.
     */
    public static Optional<QuestionStatus> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(status -> status.value().equals(value.trim()))
                .findFirst();
    }
}
