package com.example.chatstream.service.stream;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.servlet.mvc.method.annotation.ResponseBodyEmitter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * {@link StreamSink} sobre un {@link ResponseBodyEmitter}. Las tramas se escriben ya
 * formateadas como texto UTF-8; el content type de la respuesta lo fija el controlador.
 * Un envío fallido o un timeout del contenedor marcan el canal como cerrado.
 */
public class EmitterStreamSink implements StreamSink {

    private static final Logger log = LoggerFactory.getLogger(EmitterStreamSink.class);

    static final MediaType FRAME_TYPE = new MediaType(MediaType.TEXT_PLAIN, StandardCharsets.UTF_8);

    private final ResponseBodyEmitter emitter;
    private final ObjectMapper mapper;

    private volatile boolean disconnected;
    private volatile boolean terminated;

    public EmitterStreamSink(ResponseBodyEmitter emitter, ObjectMapper mapper) {
        this.emitter = emitter;
        this.mapper = mapper;
        emitter.onCompletion(() -> terminated = true);
        emitter.onTimeout(() -> disconnected = true);
        emitter.onError(e -> {
            log.debug("Emitter cerrado por error: {}", e.getMessage());
            disconnected = true;
        });
    }

    @Override
    public boolean isOpen() {
        return !disconnected && !terminated;
    }

    @Override
    public synchronized boolean sendDelta(String text) {
        if (!isOpen()) {
            return false;
        }
        try {
            return write(SseFrames.delta(mapper, text));
        } catch (IOException e) {
            // JsonProcessingException: un String siempre serializa
            throw new IllegalStateException("No se pudo serializar el fragmento", e);
        }
    }

    @Override
    public synchronized void sendDone() {
        if (!isOpen()) {
            return;
        }
        if (write(SseFrames.DONE)) {
            terminated = true;
            emitter.complete();
        }
    }

    @Override
    public synchronized void sendError(String message) {
        if (!isOpen()) {
            return;
        }
        String frame;
        try {
            frame = SseFrames.error(mapper, message);
        } catch (IOException e) {
            throw new IllegalStateException("No se pudo serializar el error", e);
        }
        if (write(frame)) {
            terminated = true;
            emitter.complete();
        }
    }

    @Override
    public synchronized void close() {
        if (terminated) {
            return;
        }
        terminated = true;
        try {
            emitter.complete();
        } catch (IllegalStateException e) {
            log.debug("Emitter ya cerrado: {}", e.getMessage());
        }
    }

    private boolean write(String frame) {
        try {
            emitter.send(frame, FRAME_TYPE);
            return true;
        } catch (IOException | IllegalStateException e) {
            log.debug("Cliente desconectado al enviar: {}", e.getMessage());
            disconnected = true;
            return false;
        }
    }
}
