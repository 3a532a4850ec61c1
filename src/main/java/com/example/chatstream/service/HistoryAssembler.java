package com.example.chatstream.service;

import com.example.chatstream.service.provider.ChatTurn;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Convierte los mensajes previos de una sesión en turnos rol/contenido para el proveedor.
 * Solo lee.
 */
@Component
public class HistoryAssembler {

    private final ConversationStore store;

    public HistoryAssembler(ConversationStore store) {
        this.store = store;
    }

    /**
     * Historial anterior al mensaje indicado (normalmente el prompt recién guardado,
     * que así queda fuera).
     */
    public List<ChatTurn> load(String sessionId, Long actingUserId, Long beforeMessageId) {
        return store.loadMessagesBefore(sessionId, actingUserId, beforeMessageId).stream()
                .map(m -> new ChatTurn(m.getRole().wireValue(), m.getContent()))
                .toList();
    }
}
