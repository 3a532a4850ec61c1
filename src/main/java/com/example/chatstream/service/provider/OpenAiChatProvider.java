package com.example.chatstream.service.provider;

import com.example.chatstream.config.AiProvidersProperties.ProviderSettings;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.http.HttpHeaders;
import org.springframework.web.client.RestClient;
import org.springframework.web.util.UriBuilder;

import java.io.IOException;
import java.net.URI;
import java.util.List;

/**
 * Chat Completions de OpenAI (o compatible) con {@code stream: true}.
 * Frames SSE {@code data: {"choices":[{"delta":{"content":"..."}}]}} terminados en {@code data: [DONE]}.
 */
public class OpenAiChatProvider extends HttpStreamingChatProvider {

    public static final String ID = "openai";
    static final String DEFAULT_BASE_URL = "https://api.openai.com/v1";

    public OpenAiChatProvider(ProviderSettings settings, RestClient.Builder builder) {
        super(settings, builder, DEFAULT_BASE_URL);
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    protected URI requestUri(UriBuilder uriBuilder, String model) {
        return uriBuilder.path("/chat/completions").build();
    }

    @Override
    protected void applyHeaders(HttpHeaders headers) {
        super.applyHeaders(headers);
        headers.setBearerAuth(settings.getApiKey());
    }

    @Override
    protected Object buildRequestBody(String prompt, String model, List<ChatTurn> history) {
        List<Message> messages = conversation(history, prompt).stream()
                .map(t -> new Message(t.role(), t.content()))
                .toList();
        return new CompletionRequest(model, messages, true);
    }

    @Override
    protected StreamChunk decode(String line) throws IOException {
        String data = sseData(line);
        if (data == null) {
            return StreamChunk.ignored();
        }
        if ("[DONE]".equals(data)) {
            return StreamChunk.end();
        }
        JsonNode node = MAPPER.readTree(data);
        if (node.hasNonNull("error")) {
            return StreamChunk.error("El proveedor " + ID + " devolvió un error durante la generación");
        }
        JsonNode choices = node.path("choices");
        if (!choices.isArray() || choices.isEmpty()) {
            return StreamChunk.empty();
        }
        // el primer frame sólo trae {"role":"assistant"}
        return StreamChunk.text(choices.get(0).path("delta").path("content").asText(""));
    }

    record Message(String role, String content) {}

    record CompletionRequest(String model, List<Message> messages, boolean stream) {}
}
