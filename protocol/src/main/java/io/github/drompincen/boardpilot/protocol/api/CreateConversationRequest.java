package io.github.drompincen.boardpilot.protocol.api;

public record CreateConversationRequest(
        String context,
        String projectId,
        String cardId,
        String title
) {}
