package com.example.chatstream.service.stream;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Map;

/**
 * Tramas "data: ...\n\n" del stream de chat.
 */
public final class SseFrames {

    public static final String DONE = "data: [DONE]\n\n";

    private SseFrames() {
    }

    public static String delta(ObjectMapper mapper, String text) throws JsonProcessingException {
        return data(mapper.writeValueAsString(Map.of("delta", text)));
    }

    public static String error(ObjectMapper mapper, String message) throws JsonProcessingException {
        return data(mapper.writeValueAsString(Map.of("error", message)));
    }

    private static String data(String payload) {
        return "data: " + payload + "\n\n";
    }
}
