package com.example.chatstream.model.dto;

import java.time.Instant;
import java.util.List;

public record SessionDetailsDto(
        String id,
        String title,
        Instant createdAt,
        List<ChatMessageDto> messages
) {}
