package io.github.drompincen.boardpilot.runtime.prompt;

import java.util.Map;

public record PromptContext(
        String projectId,
        String agentName,
        String cardId,
        String cardTitle,
        String cardDescription,
        Map<String, Object> additionalContext
) {
    public static PromptContext forAgent(String projectId, String agentName) {
        return new PromptContext(projectId, agentName, null, null, null, null);
    }

    public static PromptContext forCard(String projectId, String agentName, String cardId) {
        return new PromptContext(projectId, agentName, cardId, null, null, null);
    }
}
