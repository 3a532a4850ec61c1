package com.example.chatstream.model.dto;

import org.springframework.http.HttpStatus;

import java.time.Instant;
import java.util.List;

/**
 * Cuerpo JSON de los errores previos al stream. {@code errorId} es el X-Request-Id
 * de la petición, el mismo que aparece en los logs del servidor.
 * Los errores dentro del stream viajan como eventos {@code {"error": ...}}.
 */
public record ApiError(
        String errorId,
        int status,
        String error,
        String message,
        String path,
        Instant timestamp,
        List<String> details
) {

    public static ApiError of(String errorId, HttpStatus status, String message, String path, List<String> details) {
        return new ApiError(
                errorId,
                status.value(),
                status.getReasonPhrase(),
                message,
                path,
                Instant.now(),
                details == null ? List.of() : List.copyOf(details)
        );
    }
}
