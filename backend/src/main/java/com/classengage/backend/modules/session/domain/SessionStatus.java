package com.classengage.backend.modules.session.domain;

public enum SessionStatus {
    DRAFT,
    ACTIVE,
    ENDED;

    /**
     * Ended sessions accept neither joins nor questions.
     */
    public boolean isOpen() {
        return this != ENDED;
    }

    public String value() {
        return name().toLowerCase();
    }
}
