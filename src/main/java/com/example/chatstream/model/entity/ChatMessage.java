package com.example.chatstream.model.entity;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.Locale;

/**
 * Mensaje de una sesión. Rol y contenido no cambian una vez guardado.
 */
@Entity
@Table(name = "chat_message", indexes = @Index(name = "idx_chat_message_session", columnList = "session_id, created_at"))
public class ChatMessage {

    public enum Role {
        USER, ASSISTANT;

        /**
         * Valor que esperan los proveedores y el cliente: "user" / "assistant".
         */
        public String wireValue() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "session_id", nullable = false, updatable = false)
    private ChatSession session;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16, updatable = false)
    private Role role;

    @Lob
    @Column(nullable = false, updatable = false)
    private String content;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    protected ChatMessage() {
    }

    public ChatMessage(ChatSession session, Role role, String content) {
        this.session = session;
        this.role = role;
        this.content = content;
    }

    public Long getId() { return id; }

    public ChatSession getSession() { return session; }

    public Role getRole() { return role; }

    public String getContent() { return content; }

    public Instant getCreatedAt() { return createdAt; }
}
