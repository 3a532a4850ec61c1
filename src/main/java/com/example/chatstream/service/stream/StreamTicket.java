package com.example.chatstream.service.stream;

/**
 * Petición de stream ya validada: la sesión existe y es del usuario.
 */
public record StreamTicket(
        Long userId,
        String sessionId,
        String prompt,
        String providerId,
        String model
) {}
