package com.example.chatstream.service.provider;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.NoSuchElementException;

/**
 * Lee el cuerpo de una respuesta en streaming línea a línea y entrega sólo
 * los fragmentos con texto. La conexión se libera al terminar, al fallar o
 * al cerrar antes de tiempo.
 */
final class ProviderStreamReader implements TokenStream {

    private static final Logger log = LoggerFactory.getLogger(ProviderStreamReader.class);

    static final int MAX_CONSECUTIVE_MALFORMED = 20;
    private static final int LOG_LINE_LIMIT = 200;

    private final String providerId;
    private final BufferedReader reader;
    private final Closeable connection;
    private final PayloadDecoder decoder;

    private String pending;
    private boolean finished;
    private boolean closed;

    private int wellFormed;
    private int malformed;
    private int consecutiveMalformed;

    ProviderStreamReader(String providerId, InputStream body, Closeable connection, PayloadDecoder decoder) {
        this.providerId = providerId;
        this.reader = new BufferedReader(new InputStreamReader(body, StandardCharsets.UTF_8));
        this.connection = connection;
        this.decoder = decoder;
    }

    @Override
    public boolean hasNext() {
        if (pending != null) {
            return true;
        }
        if (finished) {
            return false;
        }
        pending = advance();
        return pending != null;
    }

    @Override
    public String next() {
        if (!hasNext()) {
            throw new NoSuchElementException("No quedan fragmentos");
        }
        String out = pending;
        pending = null;
        return out;
    }

    private String advance() {
        try {
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.isBlank()) {
                    continue;
                }
                StreamChunk chunk = decodeOrSkip(line);
                if (chunk == null) {
                    continue;
                }
                switch (chunk.kind()) {
                    case TEXT -> {
                        return chunk.text();
                    }
                    case END -> {
                        close();
                        return null;
                    }
                    case ERROR -> {
                        close();
                        throw new ProviderException(providerId, chunk.text());
                    }
                    default -> {
                        // EMPTY / IGNORED: nada que emitir
                    }
                }
            }
            close();
            if (malformed > 0 && wellFormed == 0) {
                throw new ProviderException(providerId, "El proveedor " + providerId + " devolvió una respuesta ilegible");
            }
            return null;
        } catch (IOException e) {
            close();
            throw new ProviderException(providerId, "Se perdió la conexión con el proveedor " + providerId, e);
        }
    }

    /**
     * Devuelve null si la línea está malformada y se descarta.
     */
    private StreamChunk decodeOrSkip(String line) {
        StreamChunk chunk;
        try {
            chunk = decoder.decode(line);
        } catch (IOException e) {
            malformed++;
            consecutiveMalformed++;
            log.warn("provider={} payload malformado descartado ({} seguidos): {}",
                    providerId, consecutiveMalformed, abbreviate(line));
            if (consecutiveMalformed >= MAX_CONSECUTIVE_MALFORMED) {
                close();
                throw new ProviderException(providerId, "El proveedor " + providerId + " devolvió una respuesta ilegible", e);
            }
            return null;
        }
        if (chunk.isPayload()) {
            wellFormed++;
            consecutiveMalformed = 0;
        }
        return chunk;
    }

    @Override
    public void close() {
        finished = true;
        if (closed) {
            return;
        }
        closed = true;
        try {
            reader.close();
        } catch (IOException e) {
            log.debug("provider={} error cerrando el cuerpo de la respuesta: {}", providerId, e.getMessage());
        }
        try {
            connection.close();
        } catch (IOException e) {
            log.debug("provider={} error liberando la conexión: {}", providerId, e.getMessage());
        }
    }

    private static String abbreviate(String line) {
        return line.length() <= LOG_LINE_LIMIT ? line : line.substring(0, LOG_LINE_LIMIT) + "...";
    }
}
