package io.github.drompincen.boardpilot.runtime.llm;

import io.github.drompincen.boardpilot.protocol.api.ModelConfig;
import io.github.drompincen.boardpilot.runtime.prompt.TokenEstimator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.metadata.Usage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.chat.prompt.Prompt;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * {@link ModelClient} over a Spring AI {@link ChatModel}.
 */
public class SpringAiModelClient implements ModelClient {

    private static final Logger log = LoggerFactory.getLogger(SpringAiModelClient.class);

    private final ChatModel chatModel;
    private final String provider;
    private final String defaultModel;

    public SpringAiModelClient(ChatModel chatModel, String provider, String defaultModel) {
        this.chatModel = chatModel;
        this.provider = provider;
        this.defaultModel = defaultModel;
    }

    @Override
    public String provider() { return provider; }

    @Override
    public String defaultModel() { return defaultModel; }

    @Override
    public ModelCompletion complete(List<ChatMessage> messages, ModelConfig config) {
        Prompt prompt = buildPrompt(messages, config);
        ChatResponse response;
        try {
            response = chatModel.call(prompt);
        } catch (RuntimeException e) {
            throw new ModelExecutionException(provider + " call failed: " + e.getMessage(), e);
        }
        String text = textOf(response);
        int input = promptTokens(response);
        int output = completionTokens(response);
        if (input == 0 && output == 0) {
            input = estimate(messages);
            output = TokenEstimator.estimate(text);
        }
        log.debug("{} completion: {} in / {} out", provider, input, output);
        return new ModelCompletion(text, input, output, modelOf(response, config), provider);
    }

    @Override
    public Flux<ModelChunk> stream(List<ChatMessage> messages, ModelConfig config) {
        return Flux.defer(() -> {
            Prompt prompt = buildPrompt(messages, config);
            AtomicInteger input = new AtomicInteger();
            AtomicInteger output = new AtomicInteger();
            AtomicReference<String> model = new AtomicReference<>(resolveModel(config));
            StringBuilder text = new StringBuilder();

            Flux<ModelChunk> chunks = chatModel.stream(prompt)
                    .doOnNext(response -> {
                        int in = promptTokens(response);
                        int out = completionTokens(response);
                        if (in > 0) input.set(in);
                        if (out > 0) output.set(out);
                        if (response != null && response.getMetadata() != null
                                && response.getMetadata().getModel() != null
                                && !response.getMetadata().getModel().isBlank()) {
                            model.set(response.getMetadata().getModel());
                        }
                    })
                    .map(SpringAiModelClient::textOf)
                    .filter(chunk -> !chunk.isEmpty())
                    .doOnNext(text::append)
                    .map(ModelChunk::text);

            Mono<ModelChunk> usage = Mono.fromSupplier(() -> {
                int in = input.get() > 0 ? input.get() : estimate(messages);
                int out = output.get() > 0 ? output.get() : TokenEstimator.estimate(text.toString());
                return ModelChunk.usage(in, out, model.get());
            });
            return chunks.concatWith(usage);
        }).onErrorMap(e -> !(e instanceof ModelExecutionException),
                e -> new ModelExecutionException(provider + " stream failed: " + e.getMessage(), e));
    }

    Prompt buildPrompt(List<ChatMessage> messages, ModelConfig config) {
        List<Message> converted = new ArrayList<>();
        for (ChatMessage message : messages) {
            String content = message.content() != null ? message.content() : "";
            switch (message.role()) {
                case SYSTEM -> converted.add(new SystemMessage(content));
                case ASSISTANT -> converted.add(new AssistantMessage(content));
                default -> converted.add(new UserMessage(content));
            }
        }
        ChatOptions.Builder options = ChatOptions.builder().model(resolveModel(config));
        if (config != null) {
            options.temperature(config.temperature());
            if (config.maxTokens() > 0) options.maxTokens(config.maxTokens());
        }
        return new Prompt(converted, options.build());
    }

    private String resolveModel(ModelConfig config) {
        return config != null && config.modelName() != null ? config.modelName() : defaultModel;
    }

    private String modelOf(ChatResponse response, ModelConfig config) {
        if (response != null && response.getMetadata() != null) {
            String model = response.getMetadata().getModel();
            if (model != null && !model.isBlank()) {
                return model;
            }
        }
        return resolveModel(config);
    }

    private static String textOf(ChatResponse response) {
        if (response != null && response.getResult() != null && response.getResult().getOutput() != null) {
            String text = response.getResult().getOutput().getText();
            return text != null ? text : "";
        }
        return "";
    }

    private static int promptTokens(ChatResponse response) {
        Usage usage = usageOf(response);
        return usage == null || usage.getPromptTokens() == null ? 0 : usage.getPromptTokens();
    }

    private static int completionTokens(ChatResponse response) {
        Usage usage = usageOf(response);
        return usage == null || usage.getCompletionTokens() == null ? 0 : usage.getCompletionTokens();
    }

    private static Usage usageOf(ChatResponse response) {
        return response == null || response.getMetadata() == null ? null : response.getMetadata().getUsage();
    }

    private static int estimate(List<ChatMessage> messages) {
        return messages.stream().mapToInt(m -> TokenEstimator.estimate(m.content())).sum();
    }
}
