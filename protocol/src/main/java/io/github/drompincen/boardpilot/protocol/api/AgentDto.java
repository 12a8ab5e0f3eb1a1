package io.github.drompincen.boardpilot.protocol.api;

import java.util.List;

public record AgentDto(
        String name,
        String displayName,
        String description,
        List<Integer> allowedLanes,
        String defaultProvider,
        String defaultModel
) {}
