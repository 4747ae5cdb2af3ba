package com.memory.graph.rest.dto;

import java.time.Instant;

/**
 * Standardized error response DTO. {@code error} is a machine-readable code.
 */
public record ErrorResponse(
        String error,
        String message,
        int status,
        String path,
        String timestamp
) {
    public static final String NOT_FOUND = "not_found";
    public static final String BAD_REQUEST = "bad_request";
    public static final String INTERNAL_ERROR = "internal_error";

    public ErrorResponse(String error, String message, int status, String path) {
        this(error, message, status, path, Instant.now().toString());
    }

    public static ErrorResponse badRequest(String message, String path) {
        return new ErrorResponse(BAD_REQUEST, message, 400, path);
    }

    public static ErrorResponse notFound(String message, String path) {
        return new ErrorResponse(NOT_FOUND, message, 404, path);
    }

    public static ErrorResponse internalError(String path) {
        return new ErrorResponse(INTERNAL_ERROR, "An internal error occurred. Check server logs for details.", 500, path);
    }
}
