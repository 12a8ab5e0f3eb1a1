package io.github.drompincen.boardpilot.protocol.api;

import java.time.Instant;

public record CardDto(
        String cardId,
        String boardId,
        String laneId,
        String parentCardId,
        String title,
        String description,
        String type,
        CardPriority priority,
        String assignedAgent,
        CardStatus status,
        int position,
        DocumentType documentType,
        ReviewStatus reviewStatus,
        Instant createdAt,
        Instant updatedAt
) {}
