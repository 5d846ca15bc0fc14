package com.classengage.backend.modules.session.domain;

public enum ParticipantRole {
    HOST,
    PARTICIPANT;

    public String value() {
        return name().toLowerCase();
    }
}
