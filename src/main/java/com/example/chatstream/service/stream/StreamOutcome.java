package com.example.chatstream.service.stream;

/**
 * Resultado de un stream: estado terminal, fragmentos reenviados y caracteres guardados
 * como respuesta del asistente (0 si no se guardó nada).
 */
public record StreamOutcome(StreamState state, int fragments, int persistedChars) {}
