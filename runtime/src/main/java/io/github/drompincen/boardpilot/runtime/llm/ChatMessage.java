package io.github.drompincen.boardpilot.runtime.llm;

/**
 * Provider-neutral chat message.
 */
public record ChatMessage(Role role, String content) {

    public enum Role { SYSTEM, USER, ASSISTANT }

    public static ChatMessage system(String content) { return new ChatMessage(Role.SYSTEM, content); }

    public static ChatMessage user(String content) { return new ChatMessage(Role.USER, content); }

    public static ChatMessage assistant(String content) { return new ChatMessage(Role.ASSISTANT, content); }

    /** Maps a stored message role ("user", "assistant", "system") to a message. Unknown roles become user turns. */
    public static ChatMessage of(String role, String content) {
        if ("assistant".equalsIgnoreCase(role)) {
            return assistant(content);
        }
        if ("system".equalsIgnoreCase(role)) {
            return system(content);
        }
        return user(content);
    }
}
