package com.example.chatstream.service;

import com.example.chatstream.model.dto.ChatMessageDto;
import com.example.chatstream.model.dto.SessionDetailsDto;
import com.example.chatstream.model.dto.SessionSummaryDto;
import com.example.chatstream.model.entity.AppUser;
import com.example.chatstream.model.entity.ChatMessage;
import com.example.chatstream.model.entity.ChatSession;
import com.example.chatstream.repository.ChatSessionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Service
public class ChatSessionService {

    private static final Logger log = LoggerFactory.getLogger(ChatSessionService.class);

    private final ChatSessionRepository sessionRepo;
    private final AuthService authService;

    public ChatSessionService(ChatSessionRepository sessionRepo, AuthService authService) {
        this.sessionRepo = sessionRepo;
        this.authService = authService;
    }

    // =========================================================================
    // SESIONES (CREATE/LIST/DETAILS/RENAME/DELETE)
    // =========================================================================

    @Transactional
    public SessionSummaryDto createSession(String email, String title) {
        AppUser user = authService.requireUser(email);

        ChatSession s = new ChatSession();
        s.setId(UUID.randomUUID().toString());
        s.setUser(user);
        s.setTitle(normalizeTitle(title));
        s = sessionRepo.save(s);

        log.info("Sesión creada id={} user={}", s.getId(), user.getId());
        return new SessionSummaryDto(s.getId(), s.getTitle(), s.getCreatedAt(), 0, null);
    }

    @Transactional(readOnly = true)
    public List<SessionSummaryDto> listSessions(String email) {
        AppUser user = authService.requireUser(email);
        return sessionRepo.listSummaries(user.getId());
    }

    @Transactional(readOnly = true)
    public SessionDetailsDto sessionDetails(String email, String sessionId) {
        ChatSession s = requireOwnedSession(authService.requireUser(email), sessionId);
        List<ChatMessageDto> messages = s.getMessages().stream()
                .map(ChatMessageDto::from)
                .toList();
        return new SessionDetailsDto(s.getId(), s.getTitle(), s.getCreatedAt(), messages);
    }

    @Transactional
    public SessionSummaryDto renameSession(String email, String sessionId, String title) {
        ChatSession s = requireOwnedSession(authService.requireUser(email), sessionId);
        String clean = title == null ? "" : title.trim();
        if (clean.isEmpty()) {
            throw new IllegalArgumentException("Título vacío");
        }
        s.setTitle(truncate(clean));
        sessionRepo.save(s);
        return new SessionSummaryDto(s.getId(), s.getTitle(), s.getCreatedAt(), s.getMessages().size(), lastMessageAt(s));
    }

    @Transactional
    public void deleteSession(String email, String sessionId) {
        AppUser user = authService.requireUser(email);
        ChatSession s = requireOwnedSession(user, sessionId);
        // cascade + orphanRemoval borran los mensajes
        sessionRepo.delete(s);
        log.info("Sesión borrada id={} user={}", sessionId, user.getId());
    }

    // =========================================================================
    // HELPERS
    // =========================================================================

    /**
     * Valida que la sesión exista y sea del usuario. Ajena o inexistente: mismo 404.
     */
    private ChatSession requireOwnedSession(AppUser user, String sessionId) {
        return sessionRepo.findByIdAndUser_Id(sessionId, user.getId())
                .orElseThrow(() -> new SessionNotFoundException(sessionId));
    }

    static String normalizeTitle(String title) {
        String clean = title == null ? "" : title.trim();
        if (clean.isEmpty()) {
            return ChatSession.DEFAULT_TITLE;
        }
        return truncate(clean);
    }

    private static String truncate(String title) {
        return title.length() > ChatSession.TITLE_MAX_LENGTH
                ? title.substring(0, ChatSession.TITLE_MAX_LENGTH)
                : title;
    }

    private static Instant lastMessageAt(ChatSession s) {
        List<ChatMessage> messages = s.getMessages();
        return messages.isEmpty() ? null : messages.get(messages.size() - 1).getCreatedAt();
    }
}
