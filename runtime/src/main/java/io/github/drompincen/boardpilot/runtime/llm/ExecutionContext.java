package io.github.drompincen.boardpilot.runtime.llm;

/**
 * Where a model call happens and what it is asked. {@code laneNumber} is the lane of the card
 * the agent acts on; null when the call is not tied to a lane (conversation turns).
 */
public record ExecutionContext(
        String projectId,
        String conversationId,
        String cardId,
        Integer laneNumber,
        String systemContext,
        String userMessage
) {
    public static ExecutionContext forConversation(String projectId, String conversationId) {
        return new ExecutionContext(projectId, conversationId, null, null, null, null);
    }
}
