package io.github.drompincen.boardpilot.protocol.api;

import java.util.Map;

public record PhaseStateDto(
        String projectId,
        PlanningPhase currentPhase,
        PlanningPhase nextPhase,
        Map<String, String> responses
) {}
