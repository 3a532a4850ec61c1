package com.example.chatstream.service.provider;

import com.example.chatstream.config.AiProvidersProperties.ProviderSettings;
import org.springframework.web.client.RestClient;

/**
 * Crea un adaptador nuevo a partir de su configuración y de un builder HTTP
 * que comparte el transporte con el resto de adaptadores.
 */
@FunctionalInterface
public interface ProviderFactory {

    ChatProvider create(ProviderSettings settings, RestClient.Builder restClientBuilder);
}
