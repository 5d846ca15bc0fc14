package com.classengage.backend.global.error;

import org.springframework.http.HttpStatus;

/**
 * Every failure the session core can report. The HTTP status is fixed per code so the
 * transport maps failures without inspecting messages.
 */
public enum ErrorCode {

    INVALID_DISPLAY_NAME(HttpStatus.BAD_REQUEST, "Display name is required"),
    INVALID_HOST_DISPLAY_NAME(HttpStatus.BAD_REQUEST, "Host display name is required"),
    INVALID_TITLE(HttpStatus.BAD_REQUEST, "Title must be between 1 and 200 characters"),
    INVALID_LIMIT(HttpStatus.BAD_REQUEST, "Limit must be at least 1"),
    INVALID_QUESTION_BODY(HttpStatus.UNPROCESSABLE_ENTITY, "Question body must be between 1 and 280 characters"),
    INVALID_STATUS_FILTER(HttpStatus.UNPROCESSABLE_ENTITY, "Status filter must be one of: pending, answered"),
    SESSION_NOT_FOUND(HttpStatus.NOT_FOUND, "Session not found"),
    NOT_PARTICIPANT(HttpStatus.FORBIDDEN, "User must be a participant to submit questions"),
    HOST_SESSION_LIMIT_EXCEEDED(HttpStatus.CONFLICT, "Host has reached the maximum number of active sessions"),
    SESSION_NOT_JOINABLE(HttpStatus.CONFLICT, "Session has ended and is no longer joinable"),
    QUESTION_LIMIT_EXCEEDED(HttpStatus.CONFLICT, "User has reached the maximum number of pending questions"),
    CODE_COLLISION_EXHAUSTED(HttpStatus.INTERNAL_SERVER_ERROR, "Failed to generate a unique join code"),
    STORE_TIMEOUT(HttpStatus.SERVICE_UNAVAILABLE, "The data store did not respond in time");

    private final HttpStatus status;
    private final String defaultDetail;

    ErrorCode(HttpStatus status, String defaultDetail) {
        this.status = status;
        this.defaultDetail = defaultDetail;
    }

    public HttpStatus getStatus() {
        return status;
    }

    public String getDefaultDetail() {
        return defaultDetail;
    }
}
