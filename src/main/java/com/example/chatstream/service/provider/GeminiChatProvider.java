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
 * Gemini {@code streamGenerateContent} con {@code alt=sse}. El rol del asistente es "model"
 * y no hay frame de cierre: la respuesta termina con el cuerpo.
 */
public class GeminiChatProvider extends HttpStreamingChatProvider {

    public static final String ID = "gemini";
    static final String DEFAULT_BASE_URL = "https://generativelanguage.googleapis.com";

    public GeminiChatProvider(ProviderSettings settings, RestClient.Builder builder) {
        super(settings, builder, DEFAULT_BASE_URL);
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    protected URI requestUri(UriBuilder uriBuilder, String model) {
        return uriBuilder.path("/v1beta/models/{model}:streamGenerateContent")
                .queryParam("alt", "sse")
                .build(model);
    }

    @Override
    protected void applyHeaders(HttpHeaders headers) {
        super.applyHeaders(headers);
        headers.set("x-goog-api-key", settings.getApiKey());
    }

    @Override
    protected Object buildRequestBody(String prompt, String model, List<ChatTurn> history) {
        List<Content> contents = conversation(history, prompt).stream()
                .map(t -> new Content(t.isUser() ? "user" : "model", List.of(new Part(t.content()))))
                .toList();
        return new GenerateRequest(contents);
    }

    @Override
    protected StreamChunk decode(String line) throws IOException {
        String data = sseData(line);
        if (data == null) {
            return StreamChunk.ignored();
        }
        JsonNode node = MAPPER.readTree(data);
        if (node.hasNonNull("error")) {
            return StreamChunk.error("El proveedor " + ID + " devolvió un error ("
                    + node.path("error").path("status").asText("desconocido") + ")");
        }
        JsonNode parts = node.path("candidates").path(0).path("content").path("parts");
        if (!parts.isArray()) {
            return StreamChunk.empty();
        }
        StringBuilder text = new StringBuilder();
        for (JsonNode part : parts) {
            text.append(part.path("text").asText(""));
        }
        return StreamChunk.text(text.toString());
    }

    record Part(String text) {}

    record Content(String role, List<Part> parts) {}

    record GenerateRequest(List<Content> contents) {}
}
