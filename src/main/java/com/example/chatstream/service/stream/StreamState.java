package com.example.chatstream.service.stream;

/**
 * Estados de un stream de chat. Las transiciones solo avanzan:
 * INIT, USER_SAVED, STREAMING y uno de los tres terminales.
 */
public enum StreamState {
    INIT,
    USER_SAVED,
    STREAMING,
    COMPLETED,
    DISCONNECTED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == DISCONNECTED || this == FAILED;
    }
}
