package com.example.chatstream.service;

import java.util.NoSuchElementException;

/**
 * La sesión no existe o no pertenece al usuario. Se responde 404 en ambos casos
 * para no revelar sesiones ajenas.
 */
public class SessionNotFoundException extends NoSuchElementException {

    private final String sessionId;

    public SessionNotFoundException(String sessionId) {
        super("Sesión no encontrada: " + sessionId);
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }
}
