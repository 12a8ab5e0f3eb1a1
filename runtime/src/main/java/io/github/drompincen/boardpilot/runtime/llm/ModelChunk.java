package io.github.drompincen.boardpilot.runtime.llm;

/**
 * One element of a streamed completion: text chunks, then a single terminal chunk carrying usage.
 */
public record ModelChunk(String content, boolean done, int inputTokens, int outputTokens, String model) {

    public static ModelChunk text(String content) {
        return new ModelChunk(content, false, 0, 0, null);
    }

    public static ModelChunk usage(int inputTokens, int outputTokens, String model) {
        return new ModelChunk("", true, inputTokens, outputTokens, model);
    }
}
