package com.chaincheck.dto;

import org.slf4j.MDC;

import java.time.LocalDateTime;

/**
 * Error body returned by {@link com.chaincheck.exception.GlobalExceptionHandler}.
 */
public record ErrorResponse(
        LocalDateTime timestamp,
        int status,
        String error,
        String message,
        String path,
        String correlationId
) {
    public static ErrorResponse of(int status, String error, String message, String path) {
        return new ErrorResponse(LocalDateTime.now(), status, error, message, path, MDC.get("correlationId"));
    }
}
