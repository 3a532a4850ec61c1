package com.example.chatstream.model.dto;

import java.time.Instant;

public record SessionSummaryDto(
        String id,
        String title,
        Instant createdAt,
        long messageCount,
        Instant lastMessageAt
) {}
