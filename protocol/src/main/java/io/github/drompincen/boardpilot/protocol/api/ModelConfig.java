package io.github.drompincen.boardpilot.protocol.api;

/**
 * Per-call model settings. A null {@code modelName} means the agent's default model.
 */
public record ModelConfig(
        String modelName,
        double temperature,
        int maxTokens
) {
    public static ModelConfig agentDefaults() {
        return new ModelConfig(null, 0.7, 4096);
    }

    public static ModelConfig chatDefaults() {
        return new ModelConfig(null, 0.7, 2048);
    }

    public ModelConfig withModel(String model) {
        return new ModelConfig(model, temperature, maxTokens);
    }
}
