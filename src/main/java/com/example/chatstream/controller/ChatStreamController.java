package com.example.chatstream.controller;

import com.example.chatstream.model.dto.ChatStreamRequest;
import com.example.chatstream.service.ChatStreamDispatcher;
import com.example.chatstream.service.ChatStreamOrchestrator;
import com.example.chatstream.service.stream.EmitterStreamSink;
import com.example.chatstream.service.stream.StreamEmitterFactory;
import com.example.chatstream.service.stream.StreamTicket;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.Valid;
import org.springframework.http.CacheControl;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.ResponseBodyEmitter;

import java.nio.charset.StandardCharsets;
import java.security.Principal;

@RestController
@RequestMapping("/chat")
public class ChatStreamController {

    private static final MediaType EVENT_STREAM_UTF8 = new MediaType(MediaType.TEXT_EVENT_STREAM, StandardCharsets.UTF_8);

    private final ChatStreamOrchestrator orchestrator;
    private final ChatStreamDispatcher dispatcher;
    private final StreamEmitterFactory emitterFactory;
    private final ObjectMapper objectMapper;

    public ChatStreamController(ChatStreamOrchestrator orchestrator,
                                ChatStreamDispatcher dispatcher,
                                StreamEmitterFactory emitterFactory,
                                ObjectMapper objectMapper) {
        this.orchestrator = orchestrator;
        this.dispatcher = dispatcher;
        this.emitterFactory = emitterFactory;
        this.objectMapper = objectMapper;
    }

    // ---------------------------------------------------------------------
    // CHAT EN STREAMING
    // Sesión ajena o inexistente: 404 normal, antes de abrir el stream.
    // Lo demás se informa con eventos "data: ..." dentro del stream.
    // ---------------------------------------------------------------------
    @PostMapping(path = "/stream", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ResponseBodyEmitter> stream(@Valid @RequestBody ChatStreamRequest req, Principal principal) {
        StreamTicket ticket = orchestrator.prepare(principal.getName(), req);

        ResponseBodyEmitter emitter = emitterFactory.create();
        dispatcher.dispatch(ticket, new EmitterStreamSink(emitter, objectMapper));

        return ResponseEntity.ok()
                .contentType(EVENT_STREAM_UTF8)
                .cacheControl(CacheControl.noCache())
                .header("X-Accel-Buffering", "no")
                .body(emitter);
    }
}
