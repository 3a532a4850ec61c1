package com.example.chatstream.service.provider;

import com.example.chatstream.config.AiProvidersProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.client.ClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registro de proveedores: identificador -> factoría.
 * {@link #resolve(String)} devuelve siempre una instancia nueva; lo que se comparte
 * es el {@link ClientHttpRequestFactory} (pool de conexiones del HttpClient).
 */
@Component
public class ProviderRegistry {

    private static final Logger log = LoggerFactory.getLogger(ProviderRegistry.class);

    private final Map<String, ProviderFactory> factories = new ConcurrentHashMap<>();
    private final AiProvidersProperties properties;
    private final ClientHttpRequestFactory requestFactory;

    public ProviderRegistry(AiProvidersProperties properties, ClientHttpRequestFactory aiRequestFactory) {
        this.properties = properties;
        this.requestFactory = aiRequestFactory;
        registerDefaults();
    }

    private void registerDefaults() {
        register(OpenAiChatProvider.ID, OpenAiChatProvider::new);
        register(GeminiChatProvider.ID, GeminiChatProvider::new);
        register(AnthropicChatProvider.ID, AnthropicChatProvider::new);
        register(OllamaChatProvider.ID, OllamaChatProvider::new);

        log.info("Proveedores registrados: {} (con credenciales: {})", providerIds(), configuredIds());
    }

    /**
     * Registra (o reemplaza) la factoría de un proveedor.
     */
    public void register(String providerId, ProviderFactory factory) {
        String key = normalize(providerId);
        if (key == null) {
            throw new IllegalArgumentException("Identificador de proveedor vacío");
        }
        factories.put(key, factory);
        log.debug("Proveedor registrado: {}", key);
    }

    /**
     * @throws UnsupportedProviderException si el identificador no está registrado
     */
    public ChatProvider resolve(String providerId) {
        String key = normalize(providerId);
        ProviderFactory factory = key == null ? null : factories.get(key);
        if (factory == null) {
            throw new UnsupportedProviderException(providerId, factories.keySet());
        }
        RestClient.Builder builder = RestClient.builder().requestFactory(requestFactory);
        return factory.create(properties.settingsFor(key), builder);
    }

    public boolean supports(String providerId) {
        String key = normalize(providerId);
        return key != null && factories.containsKey(key);
    }

    public Set<String> providerIds() {
        return new TreeSet<>(factories.keySet());
    }

    private Set<String> configuredIds() {
        Set<String> out = new TreeSet<>();
        properties.getProviders().forEach((id, s) -> {
            if (s != null && s.hasApiKey()) {
                out.add(id);
            }
        });
        return out;
    }

    private static String normalize(String providerId) {
        if (providerId == null || providerId.isBlank()) {
            return null;
        }
        return providerId.trim().toLowerCase(Locale.ROOT);
    }
}
