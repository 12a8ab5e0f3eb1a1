package io.github.drompincen.boardpilot.protocol.api;

import java.util.List;

public record ConversationTurnResponse(
        String conversationId,
        String messageId,
        String content,
        PlanningPhase currentPhase,
        PlanningPhase nextPhase,
        boolean phaseComplete,
        ActionSummary actions,
        List<GeneratedDocumentDto> documents
) {}
