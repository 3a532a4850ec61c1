package com.example.chatstream.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Credenciales y endpoints de cada proveedor de IA, indexados por identificador
 * ("openai", "gemini", "anthropic", "ollama").
 * Se inyectan en el registro de proveedores al arrancar; ningún adaptador lee el entorno.
 */
@ConfigurationProperties(prefix = "ai")
public class AiProvidersProperties {

    /**
     * Tiempo máximo para abrir la conexión TCP con el proveedor.
     */
    private Duration connectTimeout = Duration.ofSeconds(10);

    private Map<String, ProviderSettings> providers = new LinkedHashMap<>();

    public Duration getConnectTimeout() { return connectTimeout; }
    public void setConnectTimeout(Duration connectTimeout) { this.connectTimeout = connectTimeout; }

    public Map<String, ProviderSettings> getProviders() { return providers; }
    public void setProviders(Map<String, ProviderSettings> providers) { this.providers = providers; }

    /**
     * Configuración de un proveedor. Si falta, se usa una vacía y el adaptador
     * aplica su URL por defecto.
     */
    public ProviderSettings settingsFor(String providerId) {
        ProviderSettings settings = providers.get(providerId);
        return settings == null ? new ProviderSettings() : settings;
    }

    public static class ProviderSettings {
        private String apiKey;
        private String baseUrl;
        private Integer maxTokens;

        public ProviderSettings() {
        }

        public ProviderSettings(String apiKey, String baseUrl) {
            this.apiKey = apiKey;
            this.baseUrl = baseUrl;
        }

        public String getApiKey() { return apiKey; }
        public void setApiKey(String apiKey) { this.apiKey = apiKey; }

        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }

        public Integer getMaxTokens() { return maxTokens; }
        public void setMaxTokens(Integer maxTokens) { this.maxTokens = maxTokens; }

        public boolean hasApiKey() {
            return apiKey != null && !apiKey.isBlank();
        }

        public String baseUrlOr(String fallback) {
            return (baseUrl == null || baseUrl.isBlank()) ? fallback : baseUrl.trim();
        }
    }
}
