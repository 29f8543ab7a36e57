package com.creature.cache.rest.dto;

import java.time.Instant;

/**
 * Standardized error response DTO.
 */
public record ErrorResponse(
        int status,
        String error,
        String message,
        String path,
        Instant timestamp
) {
    public ErrorResponse(int status, String error, String message, String path) {
        this(status, error, message, path, Instant.now());
    }

    public static ErrorResponse badRequest(String message, String path) {
        return new ErrorResponse(400, "Bad Request", message, path);
    }

    public static ErrorResponse notFound(String message, String path) {
        return new ErrorResponse(404, "Not Found", message, path);
    }

    public static ErrorResponse badGateway(String message, String path) {
        return new ErrorResponse(502, "Bad Gateway", message, path);
    }

    public static ErrorResponse serviceUnavailable(String message, String path) {
        return new ErrorResponse(503, "Service Unavailable", message, path);
    }

    public static ErrorResponse internalError(String message, String path) {
        return new ErrorResponse(500, "Internal Server Error", message, path);
    }
}
