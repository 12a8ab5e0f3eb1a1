package io.github.drompincen.boardpilot.protocol.api;

import java.time.Instant;

public record PlanningDocumentDto(
        String documentId,
        String projectId,
        DocumentType type,
        String content,
        int version,
        Instant createdAt,
        Instant updatedAt
) {}
