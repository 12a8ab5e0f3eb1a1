package io.github.drompincen.boardpilot.runtime.prompt;

/**
 * Token allowance per prompt section.
 */
public record TokenBudget(
        int systemPrompt,
        int styleGuide,
        int agentPlan,
        int agentTask,
        int agentTodo,
        int projectContext,
        int cardContext
) {
    /** Agent-plan allowance at or above which the agent's own context renders in full. */
    public static final int FULL_AGENT_CONTEXT_THRESHOLD = 4000;

    private static final TokenBudget FULL = new TokenBudget(4000, 800, 4000, 2000, 1000, 2500, 1000);
    private static final TokenBudget SUMMARY = new TokenBudget(2000, 300, 1500, 500, 300, 1000, 500);

    public static TokenBudget full() {
        return FULL;
    }

    public static TokenBudget summary() {
        return SUMMARY;
    }

    public static TokenBudget forMode(PromptMode mode) {
        return mode == PromptMode.SUMMARY ? SUMMARY : FULL;
    }

    public PromptMode agentContextMode() {
        return agentPlan >= FULL_AGENT_CONTEXT_THRESHOLD ? PromptMode.FULL : PromptMode.SUMMARY;
    }
}
