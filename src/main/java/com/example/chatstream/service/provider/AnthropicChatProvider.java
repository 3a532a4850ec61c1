package com.example.chatstream.service.provider;

import com.example.chatstream.config.AiProvidersProperties.ProviderSettings;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.http.HttpHeaders;
import org.springframework.web.client.RestClient;
import org.springframework.web.util.UriBuilder;

import java.io.IOException;
import java.net.URI;
import java.util.List;

/**
 * Messages API de Anthropic en streaming.
 * Sólo interesan los eventos {@code content_block_delta}; {@code message_stop} cierra
 * la respuesta y {@code error} se traduce a {@link ProviderException}.
 */
public class AnthropicChatProvider extends HttpStreamingChatProvider {

    public static final String ID = "anthropic";
    static final String DEFAULT_BASE_URL = "https://api.anthropic.com";
    static final String API_VERSION = "2023-06-01";
    static final int DEFAULT_MAX_TOKENS = 1024;

    public AnthropicChatProvider(ProviderSettings settings, RestClient.Builder builder) {
        super(settings, builder, DEFAULT_BASE_URL);
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    protected URI requestUri(UriBuilder uriBuilder, String model) {
        return uriBuilder.path("/v1/messages").build();
    }

    @Override
    protected void applyHeaders(HttpHeaders headers) {
        super.applyHeaders(headers);
        headers.set("x-api-key", settings.getApiKey());
        headers.set("anthropic-version", API_VERSION);
    }

    @Override
    protected Object buildRequestBody(String prompt, String model, List<ChatTurn> history) {
        List<Message> messages = conversation(history, prompt).stream()
                .map(t -> new Message(t.role(), t.content()))
                .toList();
        // la API exige que el primer mensaje sea del usuario
        if (!messages.isEmpty() && !ChatTurn.USER.equals(messages.get(0).role())) {
            messages = messages.subList(1, messages.size());
        }
        int maxTokens = settings.getMaxTokens() == null ? DEFAULT_MAX_TOKENS : settings.getMaxTokens();
        return new MessagesRequest(model, maxTokens, messages, true);
    }

    @Override
    protected StreamChunk decode(String line) throws IOException {
        String data = sseData(line);
        if (data == null) {
            return StreamChunk.ignored();
        }
        JsonNode node = MAPPER.readTree(data);
        String type = node.path("type").asText("");
        return switch (type) {
            case "content_block_delta" -> StreamChunk.text(node.path("delta").path("text").asText(""));
            case "message_stop" -> StreamChunk.end();
            case "error" -> StreamChunk.error("El proveedor " + ID + " devolvió un error ("
                    + node.path("error").path("type").asText("desconocido") + ")");
            default -> StreamChunk.empty();
        };
    }

    record Message(String role, String content) {}

    record MessagesRequest(String model,
                           @JsonProperty("max_tokens") int maxTokens,
                           List<Message> messages,
                           boolean stream) {}
}
