package com.classengage.backend.global.error;

import org.springframework.http.HttpStatus;

/**
 * Error body shared by every failure. {@code code} is the stable discriminator clients switch on;
 * {@code type} is derived from it.
 */
public record ProblemResponse(String type, String title, int status, String detail, String instance, String code) {

    static final String TYPE_PREFIX = "urn:problem:classengage:";

    public static ProblemResponse of(HttpStatus httpStatus, String code, String detail, String instance) {
        String safeCode = (code != null && !code.isBlank()) ? code : httpStatus.name();
        String safeDetail = (detail != null && !detail.isBlank()) ? detail : httpStatus.getReasonPhrase();
        return new ProblemResponse(typeOf(safeCode), httpStatus.getReasonPhrase(), httpStatus.value(),
                safeDetail, instance, safeCode);
    }

    public static ProblemResponse of(ProblemException ex, String instance) {
        HttpStatus status = ex.getErrorCode().getStatus();
        return new ProblemResponse(ex.getProblemType(), status.getReasonPhrase(), status.value(),
                ex.getDetailMessage(), instance, ex.getCode());
    }

    static String typeOf(String code) {
        return TYPE_PREFIX + code.toLowerCase().replaceAll("[^a-z0-9.]+", "-");
    }
}
