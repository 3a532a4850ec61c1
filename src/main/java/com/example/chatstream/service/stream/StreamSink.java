package com.example.chatstream.service.stream;

/**
 * Canal hacia el cliente de un stream. Tras {@link #sendDone()} o
 * {@link #sendError(String)} no se emite nada más.
 */
public interface StreamSink {

    /**
     * El cliente sigue escuchando y el canal no está terminado.
     */
    boolean isOpen();

    /**
     * Envía un fragmento. Devuelve false si no se pudo entregar (cliente desconectado).
     */
    boolean sendDelta(String text);

    void sendDone();

    void sendError(String message);

    /**
     * Cierra sin emitir nada. Idempotente.
     */
    void close();
}
