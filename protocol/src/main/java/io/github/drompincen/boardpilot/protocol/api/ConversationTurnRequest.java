package io.github.drompincen.boardpilot.protocol.api;

import java.util.Map;

public record ConversationTurnRequest(
        String message,
        String conversationId,
        String context,
        String projectId,
        String cardId,
        String phase,
        Map<String, Object> metadata
) {
    public ConversationTurnRequest(String message, String conversationId, String projectId) {
        this(message, conversationId, "planning", projectId, null, null, null);
    }
}
