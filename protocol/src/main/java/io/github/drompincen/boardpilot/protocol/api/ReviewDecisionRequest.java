package io.github.drompincen.boardpilot.protocol.api;

public record ReviewDecisionRequest(
        String projectId,
        String documentType,
        String actor,
        String reason
) {}
