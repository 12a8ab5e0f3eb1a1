package io.github.drompincen.boardpilot.runtime.prompt;

/**
 * Character-count token approximation: one token per four characters.
 */
public final class TokenEstimator {

    public static final int CHARS_PER_TOKEN = 4;
    public static final String TRUNCATION_MARKER = "\n\n[... content truncated for context window]";

    private TokenEstimator() {}

    public static int estimate(String content) {
        if (content == null || content.isEmpty()) {
            return 0;
        }
        return (content.length() + CHARS_PER_TOKEN - 1) / CHARS_PER_TOKEN;
    }

    /**
     * Cuts {@code content} to {@code maxTokens * 4} characters and appends the truncation marker.
     * Content within budget is returned unchanged.
     */
    public static String truncate(String content, int maxTokens) {
        if (content == null) {
            return "";
        }
        int maxChars = Math.max(0, maxTokens) * CHARS_PER_TOKEN;
        if (content.length() <= maxChars) {
            return content;
        }
        return content.substring(0, maxChars) + TRUNCATION_MARKER;
    }
}
