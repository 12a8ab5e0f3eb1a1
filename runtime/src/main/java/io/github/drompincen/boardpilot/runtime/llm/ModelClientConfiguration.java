package io.github.drompincen.boardpilot.runtime.llm;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.anthropic.AnthropicChatModel;
import org.springframework.ai.anthropic.AnthropicChatOptions;
import org.springframework.ai.anthropic.api.AnthropicApi;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.ai.openai.api.OpenAiApi;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Builds the single {@link ModelClient} from {@code boardpilot.llm.*}. A missing or placeholder key
 * yields an {@link UnconfiguredModelClient} so the service still starts.
 */
@Configuration
public class ModelClientConfiguration {

    private static final Logger log = LoggerFactory.getLogger(ModelClientConfiguration.class);

    public static final String ANTHROPIC = "anthropic";
    public static final String OPENAI = "openai";

    @Bean
    public ModelClient modelClient(@Value("${boardpilot.llm.provider:anthropic}") String provider,
                                   @Value("${boardpilot.llm.anthropic.api-key:}") String anthropicKey,
                                   @Value("${boardpilot.llm.anthropic.model:claude-3-5-sonnet-20241022}") String anthropicModel,
                                   @Value("${boardpilot.llm.openai.api-key:}") String openaiKey,
                                   @Value("${boardpilot.llm.openai.model:gpt-4o}") String openaiModel) {
        String selected = provider == null ? "" : provider.trim().toLowerCase();
        switch (selected) {
            case ANTHROPIC -> {
                if (hasRealKey(anthropicKey, "sk-ant-placeholder")) {
                    log.info("Model client: anthropic ({})", anthropicModel);
                    return new SpringAiModelClient(anthropicModel(anthropicKey, anthropicModel), ANTHROPIC, anthropicModel);
                }
            }
            case OPENAI -> {
                if (hasRealKey(openaiKey, "sk-placeholder")) {
                    log.info("Model client: openai ({})", openaiModel);
                    return new SpringAiModelClient(openAiModel(openaiKey, openaiModel), OPENAI, openaiModel);
                }
            }
            case "none" -> {
                log.info("Model client disabled by configuration");
                return new UnconfiguredModelClient();
            }
            default -> throw new IllegalStateException("Unknown boardpilot.llm.provider: " + provider);
        }
        log.warn("No API key configured for provider '{}'; model calls will fail", selected);
        return new UnconfiguredModelClient();
    }

    static boolean hasRealKey(String key, String placeholderPrefix) {
        return key != null && !key.isBlank() && !key.startsWith(placeholderPrefix);
    }

    private static AnthropicChatModel anthropicModel(String apiKey, String model) {
        AnthropicApi api = AnthropicApi.builder().apiKey(apiKey).build();
        return AnthropicChatModel.builder()
                .anthropicApi(api)
                .defaultOptions(AnthropicChatOptions.builder().model(model).build())
                .build();
    }

    private static OpenAiChatModel openAiModel(String apiKey, String model) {
        OpenAiApi api = OpenAiApi.builder().apiKey(apiKey).build();
        return OpenAiChatModel.builder()
                .openAiApi(api)
                .defaultOptions(OpenAiChatOptions.builder().model(model).build())
                .build();
    }
}
