package io.github.drompincen.boardpilot.protocol.api;

import java.time.Instant;
import java.util.List;

public record ConversationDto(
        String conversationId,
        String tenantId,
        String projectId,
        String cardId,
        String context,
        String title,
        ConversationStatus status,
        List<MessageDto> messages,
        Instant createdAt,
        Instant updatedAt
) {}
