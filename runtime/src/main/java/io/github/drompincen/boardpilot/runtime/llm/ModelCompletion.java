package io.github.drompincen.boardpilot.runtime.llm;

public record ModelCompletion(
        String content,
        int inputTokens,
        int outputTokens,
        String model,
        String provider
) {}
