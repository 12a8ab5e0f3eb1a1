package io.github.drompincen.boardpilot.runtime.prompt;

/**
 * Assembled prompt. {@code totalTokenEstimate} is an approximation, never an exact count.
 */
public record BuiltPrompt(
        String systemPrompt,
        String userContext,
        int totalTokenEstimate,
        PromptMode mode
) {}
