package com.example.chatstream.model.dto;

import com.example.chatstream.model.entity.ChatMessage;

import java.time.Instant;

/**
 * Mensaje tal como se devuelve al frontend, sin exponer la entidad JPA.
 */
public record ChatMessageDto(
        Long id,
        String role,
        String content,
        Instant createdAt
) {
    public static ChatMessageDto from(ChatMessage m) {
        return new ChatMessageDto(m.getId(), m.getRole().wireValue(), m.getContent(), m.getCreatedAt());
    }
}
