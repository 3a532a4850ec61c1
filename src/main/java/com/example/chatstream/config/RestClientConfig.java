package com.example.chatstream.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.ClientHttpRequestFactory;
import org.springframework.http.client.JdkClientHttpRequestFactory;

import java.net.http.HttpClient;

@Configuration
public class RestClientConfig {

    /**
     * Transporte compartido por todos los adaptadores de IA. Cada adaptador crea su
     * propio RestClient, pero las conexiones las reutiliza este HttpClient.
     *
     * <p>Sin read timeout: en {@link JdkClientHttpRequestFactory} limita la respuesta
     * completa, cuerpo incluido, y cortaría a mitad cualquier generación larga.
     * Un stream termina cuando el proveedor lo cierra o cuando el cliente se va.
     */
    @Bean
    public ClientHttpRequestFactory aiRequestFactory(AiProvidersProperties props) {
        HttpClient httpClient = HttpClient.newBuilder()
                .connectTimeout(props.getConnectTimeout())
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
        return new JdkClientHttpRequestFactory(httpClient);
    }
}
