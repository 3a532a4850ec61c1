package com.example.chatstream.service.provider;

/**
 * Turno previo de la conversación tal como lo reciben los proveedores.
 *
 * @param role    "user" o "assistant"
 * @param content texto del turno
 */
public record ChatTurn(String role, String content) {

    public static final String USER = "user";
    public static final String ASSISTANT = "assistant";

    public boolean isUser() {
        return USER.equals(role);
    }
}
