package io.github.drompincen.boardpilot.runtime.llm;

/**
 * Streamed text, followed by exactly one chunk with {@code done = true} carrying the result.
 */
public record ExecutionChunk(String content, boolean done, ExecutionResult result) {

    public static ExecutionChunk text(String content) {
        return new ExecutionChunk(content, false, null);
    }

    public static ExecutionChunk complete(ExecutionResult result) {
        return new ExecutionChunk("", true, result);
    }
}
