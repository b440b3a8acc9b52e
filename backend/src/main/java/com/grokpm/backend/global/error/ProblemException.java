package com.grokpm.backend.global.error;

import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

public class ProblemException extends ResponseStatusException {

    private final String code;
    private final String detail;

    public ProblemException(HttpStatus status, String code) {
        this(status, code, null);
    }

    public ProblemException(HttpStatus status, String code, String detail) {
        super(status, code);
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("ProblemException code must not be blank");
        }
        this.code = code;
        this.detail = (detail != null && !detail.isBlank()) ? detail : code;
    }

    public static ProblemException notFound(String resource, Object id) {
        return new ProblemException(
                HttpStatus.NOT_FOUND,
                toCode(resource) + "_NOT_FOUND",
                resource + " " + id + " not found"
        );
    }

    /**
     * A request body named a parent row that does not exist.
     */
    public static ProblemException invalidReference(String field, Object id) {
        return new ProblemException(
                HttpStatus.BAD_REQUEST,
                "INVALID_REFERENCE",
                field + " " + id + " does not reference an existing record"
        );
    }

    public static ProblemException badRequest(String code, String detail) {
        return new ProblemException(HttpStatus.BAD_REQUEST, code, detail);
    }

    public static ProblemException conflict(String code, String detail) {
        return new ProblemException(HttpStatus.CONFLICT, code, detail);
    }

    public static ProblemException inUse(String resource, Object id, String dependents) {
        return conflict("RESOURCE_IN_USE", resource + " " + id + " is still referenced by " + dependents);
    }

    private static String toCode(String resource) {
        return resource.trim()
                .replaceAll("([a-z])([A-Z])", "$1_$2")
                .replaceAll("[^A-Za-z0-9]+", "_")
                .toUpperCase();
    }

    public String getCode() {
        return code;
    }

    public String getDetailMessage() {
        return detail;
    }
}
