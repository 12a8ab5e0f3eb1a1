package io.github.drompincen.boardpilot.runtime.llm;

import io.github.drompincen.boardpilot.protocol.api.ModelConfig;
import reactor.core.publisher.Flux;

import java.util.List;

/**
 * Stand-in when no API key is configured: every call fails.
 */
public class UnconfiguredModelClient implements ModelClient {

    static final String MESSAGE = "No model provider is configured. Set boardpilot.llm.anthropic.api-key "
            + "or boardpilot.llm.openai.api-key.";

    @Override
    public String provider() { return "none"; }

    @Override
    public String defaultModel() { return null; }

    @Override
    public boolean isAvailable() { return false; }

    @Override
    public ModelCompletion complete(List<ChatMessage> messages, ModelConfig config) {
        throw new ModelExecutionException(MESSAGE);
    }

    @Override
    public Flux<ModelChunk> stream(List<ChatMessage> messages, ModelConfig config) {
        return Flux.error(new ModelExecutionException(MESSAGE));
    }
}
