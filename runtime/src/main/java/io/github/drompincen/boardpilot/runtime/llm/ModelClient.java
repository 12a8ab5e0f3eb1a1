package io.github.drompincen.boardpilot.runtime.llm;

import io.github.drompincen.boardpilot.protocol.api.ModelConfig;
import reactor.core.publisher.Flux;

import java.util.List;

/**
 * Sends a message list to the configured provider. Built once at startup.
 */
public interface ModelClient {

    /** Provider id, e.g. "anthropic", "openai" or "none". */
    String provider();

    String defaultModel();

    ModelCompletion complete(List<ChatMessage> messages, ModelConfig config);

    Flux<ModelChunk> stream(List<ChatMessage> messages, ModelConfig config);

    default boolean isAvailable() { return true; }
}
