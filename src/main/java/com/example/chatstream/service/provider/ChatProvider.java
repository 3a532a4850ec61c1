package com.example.chatstream.service.provider;

import java.util.List;

/**
 * Interfaz común de generación incremental sobre un backend de IA.
 * Cada llamada abre su propia respuesta en streaming.
 */
public interface ChatProvider {

    /**
     * Identificador con el que se registra ("openai", "ollama"...).
     */
    String id();

    /**
     * Genera la respuesta a {@code prompt} como secuencia perezosa de fragmentos,
     * en orden de generación y nunca vacíos.
     *
     * @param prompt  mensaje nuevo del usuario (no incluido en {@code history})
     * @param model   modelo del proveedor
     * @param history turnos anteriores, del más antiguo al más reciente
     * @return secuencia que el llamante debe cerrar
     * @throws ProviderException si el proveedor falla al abrir la respuesta o durante la lectura
     */
    TokenStream streamChat(String prompt, String model, List<ChatTurn> history);
}
