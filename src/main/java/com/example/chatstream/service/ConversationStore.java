package com.example.chatstream.service;

import com.example.chatstream.model.entity.ChatMessage;
import com.example.chatstream.model.entity.ChatSession;
import com.example.chatstream.repository.ChatMessageRepository;
import com.example.chatstream.repository.ChatSessionRepository;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Objects;

/**
 * Log de mensajes por sesión. Solo añade: un mensaje persistido no se modifica.
 * Todas las operaciones comprueban que la sesión sea del usuario que actúa.
 * Cada método abre y cierra su propia transacción.
 */
@Service
public class ConversationStore {

    private final ChatSessionRepository sessionRepo;
    private final ChatMessageRepository messageRepo;

    public ConversationStore(ChatSessionRepository sessionRepo, ChatMessageRepository messageRepo) {
        this.sessionRepo = sessionRepo;
        this.messageRepo = messageRepo;
    }

    @Transactional
    public ChatMessage appendMessage(String sessionId, ChatMessage.Role role, String content, Long actingUserId) {
        Objects.requireNonNull(role, "role requerido");
        Objects.requireNonNull(content, "content requerido");
        try {
            ChatSession session = requireOwnedSession(sessionId, actingUserId);
            return messageRepo.saveAndFlush(new ChatMessage(session, role, content));
        } catch (DataAccessException e) {
            throw new ConversationStoreException("No se pudo guardar el mensaje en la sesión " + sessionId, e);
        }
    }

    @Transactional(readOnly = true)
    public List<ChatMessage> loadMessages(String sessionId, Long actingUserId) {
        try {
            requireOwnedSession(sessionId, actingUserId);
            return messageRepo.findBySession_IdOrderByCreatedAtAscIdAsc(sessionId);
        } catch (DataAccessException e) {
            throw new ConversationStoreException("No se pudo leer la sesión " + sessionId, e);
        }
    }

    /**
     * Mensajes anteriores a {@code beforeMessageId}, en orden de llegada.
     */
    @Transactional(readOnly = true)
    public List<ChatMessage> loadMessagesBefore(String sessionId, Long actingUserId, Long beforeMessageId) {
        if (beforeMessageId == null) {
            return loadMessages(sessionId, actingUserId);
        }
        try {
            requireOwnedSession(sessionId, actingUserId);
            return messageRepo.findHistoryBefore(sessionId, beforeMessageId);
        } catch (DataAccessException e) {
            throw new ConversationStoreException("No se pudo leer la sesión " + sessionId, e);
        }
    }

    @Transactional(readOnly = true)
    public boolean isOwnedBy(String sessionId, Long actingUserId) {
        if (sessionId == null || actingUserId == null) {
            return false;
        }
        return sessionRepo.existsByIdAndUser_Id(sessionId, actingUserId);
    }

    private ChatSession requireOwnedSession(String sessionId, Long actingUserId) {
        if (sessionId == null || actingUserId == null) {
            throw new SessionNotFoundException(sessionId);
        }
        return sessionRepo.findByIdAndUser_Id(sessionId, actingUserId)
                .orElseThrow(() -> new SessionNotFoundException(sessionId));
    }
}
