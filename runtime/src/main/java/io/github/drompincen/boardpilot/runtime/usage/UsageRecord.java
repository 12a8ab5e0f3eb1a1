package io.github.drompincen.boardpilot.runtime.usage;

import java.math.BigDecimal;

/**
 * Accounting for one completed model call.
 */
public record UsageRecord(
        String agentName,
        String projectId,
        String conversationId,
        String cardId,
        String provider,
        String model,
        int inputTokens,
        int outputTokens,
        BigDecimal cost,
        BigDecimal price,
        long durationMs,
        boolean streamed
) {}
