package com.record.merge.rest.dto;

import java.time.Instant;
import java.util.List;

/**
 * Standardized error response DTO.
 *
 * @param violations validation messages, empty unless a record failed validation
 */
public record ErrorResponse(
        int status,
        String error,
        String message,
        String path,
        Instant timestamp,
        List<String> violations
) {
    public ErrorResponse {
        violations = violations != null ? List.copyOf(violations) : List.of();
    }

    public ErrorResponse(int status, String error, String message, String path) {
        this(status, error, message, path, Instant.now(), List.of());
    }

    public static ErrorResponse badRequest(String message, String path) {
        return new ErrorResponse(400, "Bad Request", message, path);
    }

    public static ErrorResponse notFound(String message, String path) {
        return new ErrorResponse(404, "Not Found", message, path);
    }

    public static ErrorResponse conflict(String message, String path, List<String> violations) {
        return new ErrorResponse(409, "Conflict", message, path, Instant.now(), violations);
    }

    public static ErrorResponse internalError(String message, String path) {
        return new ErrorResponse(500, "Internal Server Error", message, path);
    }
}
