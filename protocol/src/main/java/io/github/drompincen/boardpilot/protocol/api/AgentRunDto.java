package io.github.drompincen.boardpilot.protocol.api;

import java.math.BigDecimal;
import java.time.Instant;

public record AgentRunDto(
        String runId,
        String cardId,
        String projectId,
        String agentName,
        int laneNumber,
        AgentRunStatus status,
        String output,
        String error,
        int inputTokens,
        int outputTokens,
        BigDecimal cost,
        BigDecimal price,
        Instant startedAt,
        Instant finishedAt
) {}
