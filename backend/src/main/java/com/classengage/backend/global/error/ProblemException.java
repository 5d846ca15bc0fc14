package com.classengage.backend.global.error;

import org.springframework.web.server.ResponseStatusException;

public class ProblemException extends ResponseStatusException {

    private final ErrorCode errorCode;
    private final String detail;
    private final String type;

    public ProblemException(ErrorCode errorCode) {
        this(errorCode, null, null);
    }

    public ProblemException(ErrorCode errorCode, String detail) {
        this(errorCode, detail, null);
    }

    public ProblemException(ErrorCode errorCode, String detail, Throwable cause) {
        super(requireCode(errorCode).getStatus(), errorCode.name(), cause);
        this.errorCode = errorCode;
        this.detail = (detail != null && !detail.isBlank()) ? detail : errorCode.getDefaultDetail();
        this.type = ProblemResponse.typeOf(errorCode.name());
    }

    private static ErrorCode requireCode(ErrorCode errorCode) {
        if (errorCode == null) {
            throw new IllegalArgumentException("ProblemException errorCode must not be null");
        }
        return errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public String getCode() {
        return errorCode.name();
    }

    public String getDetailMessage() {
        return detail;
    }

    public String getProblemType() {
        return type;
    }
}
