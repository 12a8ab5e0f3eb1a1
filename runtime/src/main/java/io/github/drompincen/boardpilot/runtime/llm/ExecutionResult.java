package io.github.drompincen.boardpilot.runtime.llm;

import java.math.BigDecimal;

public record ExecutionResult(
        String content,
        int inputTokens,
        int outputTokens,
        BigDecimal cost,
        BigDecimal price,
        String model,
        String provider,
        long durationMs
) {}
