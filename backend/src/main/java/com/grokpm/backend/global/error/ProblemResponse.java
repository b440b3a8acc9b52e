package com.grokpm.backend.global.error;

import org.springframework.http.HttpStatus;

/**
 * Error body shared by every endpoint. {@code error} carries the human readable message.
 */
public record ProblemResponse(String type, String title, int status, String error, String code, String instance) {

    private static final String DEFAULT_TYPE_PREFIX = "https://grokpm.app/errors/";

    public static ProblemResponse of(HttpStatus httpStatus, String code, String detail, String instance) {
        String safeCode = (code != null && !code.isBlank()) ? code : httpStatus.name();
        String normalized = safeCode.toLowerCase().replaceAll("[^a-z0-9\\-_.]+", "-");
        String safeDetail = (detail != null && !detail.isBlank()) ? detail : httpStatus.getReasonPhrase();
        String type = DEFAULT_TYPE_PREFIX + normalized;
        return new ProblemResponse(type, httpStatus.getReasonPhrase(), httpStatus.value(), safeDetail, safeCode, instance);
    }
}
