package com.example.chatstream.service.provider;

/**
 * Resultado de decodificar una línea del stream de un proveedor.
 */
record StreamChunk(Kind kind, String text) {

    enum Kind {
        /** Fragmento con texto nuevo. */
        TEXT,
        /** Payload válido sin texto (keep-alive, rol, metadatos). */
        EMPTY,
        /** Línea que no es payload (separadores, "event:", comentarios SSE). */
        IGNORED,
        /** Fin normal de la respuesta. */
        END,
        /** El proveedor informa de un error; {@code text} es el mensaje saneado. */
        ERROR
    }

    private static final StreamChunk EMPTY_CHUNK = new StreamChunk(Kind.EMPTY, "");
    private static final StreamChunk IGNORED_CHUNK = new StreamChunk(Kind.IGNORED, "");
    private static final StreamChunk END_CHUNK = new StreamChunk(Kind.END, "");

    static StreamChunk text(String text) {
        if (text == null || text.isEmpty()) {
            return EMPTY_CHUNK;
        }
        return new StreamChunk(Kind.TEXT, text);
    }

    static StreamChunk empty() {
        return EMPTY_CHUNK;
    }

    static StreamChunk ignored() {
        return IGNORED_CHUNK;
    }

    static StreamChunk end() {
        return END_CHUNK;
    }

    static StreamChunk error(String message) {
        return new StreamChunk(Kind.ERROR, message);
    }

    boolean isPayload() {
        return kind != Kind.IGNORED;
    }
}
