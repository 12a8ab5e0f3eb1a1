package io.github.drompincen.boardpilot.runtime.llm;

import io.github.drompincen.boardpilot.protocol.api.ModelConfig;
import io.github.drompincen.boardpilot.runtime.agent.AgentDefinition;
import io.github.drompincen.boardpilot.runtime.agent.AgentRegistry;
import io.github.drompincen.boardpilot.runtime.usage.PricingTable;
import io.github.drompincen.boardpilot.runtime.usage.UsageRecord;
import io.github.drompincen.boardpilot.runtime.usage.UsageSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Single entry point for model calls made on behalf of an agent. Checks the agent's lane
 * permission before anything is sent, prices the call and records usage. No retries.
 */
@Service
public class ExecutionGateway {

    private static final Logger log = LoggerFactory.getLogger(ExecutionGateway.class);

    private final AgentRegistry agentRegistry;
    private final ModelClient modelClient;
    private final PricingTable pricingTable;
    private final UsageSink usageSink;

    public ExecutionGateway(AgentRegistry agentRegistry, ModelClient modelClient,
                            PricingTable pricingTable, UsageSink usageSink) {
        this.agentRegistry = agentRegistry;
        this.modelClient = modelClient;
        this.pricingTable = pricingTable;
        this.usageSink = usageSink;
    }

    /** Runs the agent's system prompt plus the context's system section against its user message. */
    public ExecutionResult execute(String agentName, ExecutionContext context, ModelConfig options) {
        AgentDefinition agent = authorize(agentName, context);
        return call(agent, context, agentMessages(agent, context), options);
    }

    public Flux<ExecutionChunk> stream(String agentName, ExecutionContext context, ModelConfig options) {
        return Flux.defer(() -> {
            AgentDefinition agent = authorize(agentName, context);
            return streamCall(agent, context, agentMessages(agent, context), options);
        });
    }

    /** Sends a caller-assembled message list (conversation turns) under the agent's identity. */
    public ExecutionResult converse(String agentName, ExecutionContext context, List<ChatMessage> messages,
                                    ModelConfig options) {
        AgentDefinition agent = authorize(agentName, context);
        return call(agent, context, messages, options);
    }

    public Flux<ExecutionChunk> streamConverse(String agentName, ExecutionContext context,
                                               List<ChatMessage> messages, ModelConfig options) {
        return Flux.defer(() -> {
            AgentDefinition agent = authorize(agentName, context);
            return streamCall(agent, context, messages, options);
        });
    }

    private AgentDefinition authorize(String agentName, ExecutionContext context) {
        AgentDefinition agent = agentRegistry.require(agentName);
        if (context != null && context.laneNumber() != null) {
            agentRegistry.checkLanePermission(agentName, context.laneNumber());
        }
        return agent;
    }

    private ExecutionResult call(AgentDefinition agent, ExecutionContext context, List<ChatMessage> messages,
                                 ModelConfig options) {
        ModelConfig config = resolveConfig(agent, options);
        long start = System.currentTimeMillis();
        ModelCompletion completion;
        try {
            completion = modelClient.complete(messages, config);
        } catch (ModelExecutionException e) {
            log.error("Model call for agent {} failed: {}", agent.name(), e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            log.error("Model call for agent {} failed: {}", agent.name(), e.getMessage());
            throw new ModelExecutionException("Model call failed for agent " + agent.name() + ": " + e.getMessage(), e);
        }
        if (completion == null || completion.content() == null || completion.content().isBlank()) {
            throw new ModelExecutionException("Empty response from model for agent " + agent.name());
        }
        String model = completion.model() != null ? completion.model() : config.modelName();
        String provider = completion.provider() != null ? completion.provider() : modelClient.provider();
        ExecutionResult result = price(completion.content(), completion.inputTokens(), completion.outputTokens(),
                model, provider, System.currentTimeMillis() - start);
        recordUsage(agent, context, result, false);
        return result;
    }

    private Flux<ExecutionChunk> streamCall(AgentDefinition agent, ExecutionContext context,
                                            List<ChatMessage> messages, ModelConfig options) {
        ModelConfig config = resolveConfig(agent, options);
        long start = System.currentTimeMillis();
        StringBuilder content = new StringBuilder();
        AtomicReference<ModelChunk> usage = new AtomicReference<>();

        Flux<ExecutionChunk> text = modelClient.stream(messages, config)
                .filter(chunk -> {
                    if (chunk.done()) {
                        usage.set(chunk);
                        return false;
                    }
                    return chunk.content() != null && !chunk.content().isEmpty();
                })
                .doOnNext(chunk -> content.append(chunk.content()))
                .map(chunk -> ExecutionChunk.text(chunk.content()));

        Mono<ExecutionChunk> done = Mono.fromCallable(() -> {
            if (content.toString().isBlank()) {
                throw new ModelExecutionException("Empty response from model for agent " + agent.name());
            }
            ModelChunk last = usage.get();
            int in = last != null ? last.inputTokens() : 0;
            int out = last != null ? last.outputTokens() : 0;
            String model = last != null && last.model() != null ? last.model() : config.modelName();
            ExecutionResult result = price(content.toString(), in, out, model, modelClient.provider(),
                    System.currentTimeMillis() - start);
            recordUsage(agent, context, result, true);
            return ExecutionChunk.complete(result);
        });

        return text.concatWith(done)
                .onErrorMap(e -> !(e instanceof ModelExecutionException),
                        e -> new ModelExecutionException("Model stream failed for agent " + agent.name()
                                + ": " + e.getMessage(), e))
                .doOnError(e -> log.error("Model stream for agent {} failed: {}", agent.name(), e.getMessage()));
    }

    /**
     * The agent's default model applies only when it belongs to the configured provider;
     * otherwise the client's own default is used.
     */
    ModelConfig resolveConfig(AgentDefinition agent, ModelConfig options) {
        ModelConfig config = options != null ? options : ModelConfig.agentDefaults();
        if (config.modelName() != null) {
            return config;
        }
        if (agent.defaultProvider() != null && agent.defaultProvider().equalsIgnoreCase(modelClient.provider())) {
            return config.withModel(agent.defaultModel());
        }
        return config.withModel(modelClient.defaultModel());
    }

    private static List<ChatMessage> agentMessages(AgentDefinition agent, ExecutionContext context) {
        StringBuilder system = new StringBuilder(agent.systemPrompt());
        if (context != null && context.systemContext() != null && !context.systemContext().isBlank()) {
            system.append("\n\n---\n\n").append(context.systemContext());
        }
        List<ChatMessage> messages = new ArrayList<>();
        messages.add(ChatMessage.system(system.toString()));
        String user = context != null && context.userMessage() != null && !context.userMessage().isBlank()
                ? context.userMessage() : "Proceed with the current card.";
        messages.add(ChatMessage.user(user));
        return messages;
    }

    private ExecutionResult price(String content, int inputTokens, int outputTokens, String model,
                                  String provider, long durationMs) {
        BigDecimal cost = pricingTable.cost(provider, model, inputTokens, outputTokens);
        BigDecimal price = pricingTable.price(cost);
        return new ExecutionResult(content, inputTokens, outputTokens, cost, price, model, provider, durationMs);
    }

    private void recordUsage(AgentDefinition agent, ExecutionContext context, ExecutionResult result, boolean streamed) {
        try {
            usageSink.record(new UsageRecord(agent.name(),
                    context != null ? context.projectId() : null,
                    context != null ? context.conversationId() : null,
                    context != null ? context.cardId() : null,
                    result.provider(), result.model(), result.inputTokens(), result.outputTokens(),
                    result.cost(), result.price(), result.durationMs(), streamed));
        } catch (RuntimeException e) {
            log.warn("Failed to record usage for agent {}: {}", agent.name(), e.getMessage());
        }
    }
}
