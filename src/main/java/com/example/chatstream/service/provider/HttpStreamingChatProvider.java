package com.example.chatstream.service.provider;

import com.example.chatstream.config.AiProvidersProperties.ProviderSettings;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.util.UriBuilder;

import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Base de los adaptadores HTTP: envía la petición, comprueba el status y deja
 * la respuesta abierta para leerla de forma incremental con {@link ProviderStreamReader}.
 * Cada subclase sólo define el formato de petición y cómo decodificar cada línea.
 */
public abstract class HttpStreamingChatProvider implements ChatProvider {

    private static final Logger log = LoggerFactory.getLogger(HttpStreamingChatProvider.class);

    private static final int ERROR_BODY_LOG_LIMIT = 500;

    protected static final ObjectMapper MAPPER = new ObjectMapper();

    protected final ProviderSettings settings;
    private final RestClient restClient;

    protected HttpStreamingChatProvider(ProviderSettings settings, RestClient.Builder builder, String defaultBaseUrl) {
        this.settings = settings;
        this.restClient = builder
                .baseUrl(settings.baseUrlOr(defaultBaseUrl))
                .build();
    }

    @Override
    public TokenStream streamChat(String prompt, String model, List<ChatTurn> history) {
        if (requiresApiKey() && !settings.hasApiKey()) {
            throw new ProviderException(id(), "El proveedor " + id() + " no tiene credenciales configuradas");
        }
        Object body = buildRequestBody(prompt, model, history == null ? List.of() : history);

        try {
            return restClient.post()
                    .uri(uriBuilder -> requestUri(uriBuilder, model))
                    .headers(this::applyHeaders)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(body)
                    .exchange((request, response) -> openStream(response), false);
        } catch (RestClientException e) {
            log.warn("provider={} model={} fallo de conexión: {}", id(), model, e.getMessage());
            throw new ProviderException(id(), "No se pudo conectar con el proveedor " + id(), e);
        }
    }

    private TokenStream openStream(ClientHttpResponse response) throws IOException {
        HttpStatusCode status = response.getStatusCode();
        if (status.isError()) {
            String snippet;
            try {
                snippet = new String(response.getBody().readNBytes(ERROR_BODY_LOG_LIMIT), StandardCharsets.UTF_8);
            } finally {
                response.close();
            }
            log.warn("provider={} status={} body={}", id(), status.value(), snippet);
            throw new ProviderException(id(), describeStatus(status));
        }
        return new ProviderStreamReader(id(), response.getBody(), response, this::decode);
    }

    /**
     * Mensaje saneado para el cliente; nunca incluye el cuerpo de la respuesta.
     */
    protected String describeStatus(HttpStatusCode status) {
        int code = status.value();
        if (code == 401 || code == 403) {
            return "El proveedor " + id() + " rechazó las credenciales";
        }
        if (code == 404) {
            return "El proveedor " + id() + " no reconoce el modelo solicitado";
        }
        if (code == 429) {
            return "El proveedor " + id() + " ha limitado las peticiones, inténtalo más tarde";
        }
        if (status.is5xxServerError()) {
            return "El proveedor " + id() + " no está disponible";
        }
        return "El proveedor " + id() + " rechazó la petición (HTTP " + code + ")";
    }

    protected boolean requiresApiKey() {
        return true;
    }

    protected abstract URI requestUri(UriBuilder uriBuilder, String model);

    protected abstract Object buildRequestBody(String prompt, String model, List<ChatTurn> history);

    protected void applyHeaders(HttpHeaders headers) {
        headers.setAccept(List.of(MediaType.TEXT_EVENT_STREAM, MediaType.APPLICATION_JSON));
    }

    protected abstract StreamChunk decode(String line) throws IOException;

    /**
     * Payload de una línea SSE "data: ...", o null si la línea es de otro tipo.
     */
    protected static String sseData(String line) {
        if (!line.startsWith("data:")) {
            return null;
        }
        String data = line.substring(5).trim();
        return data.isEmpty() ? null : data;
    }

    /**
     * Historial + prompt nuevo, fusionando turnos seguidos del mismo rol
     * (quedan así cuando un turno anterior no obtuvo respuesta).
     */
    protected static List<ChatTurn> conversation(List<ChatTurn> history, String prompt) {
        List<ChatTurn> all = new ArrayList<>(history.size() + 1);
        all.addAll(history);
        all.add(new ChatTurn(ChatTurn.USER, prompt));

        List<ChatTurn> merged = new ArrayList<>(all.size());
        for (ChatTurn turn : all) {
            if (!merged.isEmpty() && merged.get(merged.size() - 1).role().equals(turn.role())) {
                ChatTurn last = merged.remove(merged.size() - 1);
                merged.add(new ChatTurn(last.role(), last.content() + "\n\n" + turn.content()));
            } else {
                merged.add(turn);
            }
        }
        return merged;
    }
}
