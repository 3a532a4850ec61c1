package com.example.chatstream.model.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * Cuerpo de POST /chat/stream. Con naming snake_case llega como
 * {"session_id", "prompt", "provider", "model"}.
 */
public record ChatStreamRequest(
        @NotBlank String sessionId,
        @NotBlank String prompt,
        @NotBlank String provider,
        @NotBlank String model
) {}
