package io.github.drompincen.boardpilot.runtime.llm;

/**
 * A model provider call failed or returned nothing usable. Not retried.
 */
public class ModelExecutionException extends RuntimeException {

    public ModelExecutionException(String message) {
        super(message);
    }

    public ModelExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
