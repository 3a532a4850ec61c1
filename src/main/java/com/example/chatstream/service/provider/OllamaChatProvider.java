package com.example.chatstream.service.provider;

import com.example.chatstream.config.AiProvidersProperties.ProviderSettings;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.util.UriBuilder;

import java.io.IOException;
import java.net.URI;
import java.util.List;

/**
 * Ollama local ({@code /api/chat}). Responde JSON por líneas:
 * {@code {"message":{"content":"..."},"done":false}} hasta {@code "done":true}.
 */
public class OllamaChatProvider extends HttpStreamingChatProvider {

    public static final String ID = "ollama";
    static final String DEFAULT_BASE_URL = "http://localhost:11434";

    public OllamaChatProvider(ProviderSettings settings, RestClient.Builder builder) {
        super(settings, builder, DEFAULT_BASE_URL);
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    protected boolean requiresApiKey() {
        return false;
    }

    @Override
    protected URI requestUri(UriBuilder uriBuilder, String model) {
        return uriBuilder.path("/api/chat").build();
    }

    @Override
    protected void applyHeaders(HttpHeaders headers) {
        headers.setAccept(List.of(MediaType.APPLICATION_NDJSON, MediaType.APPLICATION_JSON));
        if (settings.hasApiKey()) {
            // instalaciones detrás de un proxy con token
            headers.setBearerAuth(settings.getApiKey());
        }
    }

    @Override
    protected Object buildRequestBody(String prompt, String model, List<ChatTurn> history) {
        List<Message> messages = conversation(history, prompt).stream()
                .map(t -> new Message(t.role(), t.content()))
                .toList();
        return new ChatRequest(model, messages, true);
    }

    @Override
    protected StreamChunk decode(String line) throws IOException {
        JsonNode node = MAPPER.readTree(line);
        if (node.hasNonNull("error")) {
            return StreamChunk.error("El proveedor " + ID + " devolvió un error durante la generación");
        }
        if (node.path("done").asBoolean(false)) {
            return StreamChunk.end();
        }
        return StreamChunk.text(node.path("message").path("content").asText(""));
    }

    record Message(String role, String content) {}

    record ChatRequest(String model, List<Message> messages, boolean stream) {}
}
