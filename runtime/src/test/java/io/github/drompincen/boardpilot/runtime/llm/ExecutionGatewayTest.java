package io.github.drompincen.boardpilot.runtime.llm;

import io.github.drompincen.boardpilot.protocol.api.ModelConfig;
import io.github.drompincen.boardpilot.runtime.agent.AgentDefinitions;
import io.github.drompincen.boardpilot.runtime.agent.AgentNotAllowedInLaneException;
import io.github.drompincen.boardpilot.runtime.agent.AgentRegistry;
import io.github.drompincen.boardpilot.runtime.usage.PricingTable;
import io.github.drompincen.boardpilot.runtime.usage.UsageRecord;
import io.github.drompincen.boardpilot.runtime.usage.UsageSink;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class ExecutionGatewayTest {

    @Mock private ModelClient modelClient;
    @Mock private UsageSink usageSink;

    private final AgentRegistry registry = new AgentRegistry(AgentDefinitions.defaults());
    private ExecutionGateway gateway;

    @BeforeEach
    void setUp() {
        when(modelClient.provider()).thenReturn("anthropic");
        when(modelClient.defaultModel()).thenReturn("claude-3-haiku-20240307");
        gateway = new ExecutionGateway(registry, modelClient, new PricingTable(5.0, 0.01), usageSink);
    }

    private static ExecutionContext inLane(int lane) {
        return new ExecutionContext("p-1", null, "c-1", lane, "## Current Card", "Design the schema");
    }

    // ---- authorization ----

    @Test
    void agentOutsideItsLanes_isRefusedBeforeAnyModelCall() {
        assertThatThrownBy(() -> gateway.execute("architect", inLane(0), null))
                .isInstanceOf(AgentNotAllowedInLaneException.class);

        verifyNoInteractions(usageSink);
        verify(modelClient, never()).complete(anyList(), any());
    }

    @Test
    void unknownAgent_isRejected() {
        assertThatThrownBy(() -> gateway.execute("ghost", inLane(3), null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("ghost");
    }

    @Test
    void streamRefusal_isDeliveredAsError() {
        StepVerifier.create(gateway.stream("architect", inLane(0), null))
                .expectError(AgentNotAllowedInLaneException.class)
                .verify();
        verify(modelClient, never()).stream(anyList(), any());
    }

    // ---- execute ----

    @Test
    void execute_pricesAndRecordsUsage() {
        when(modelClient.complete(anyList(), any()))
                .thenReturn(new ModelCompletion("Use Postgres.", 1000, 500, "claude-3-5-sonnet-20241022", "anthropic"));

        ExecutionResult result = gateway.execute("architect", inLane(3), null);

        assertThat(result.content()).isEqualTo("Use Postgres.");
        assertThat(result.cost()).isEqualByComparingTo("0.0105");
        assertThat(result.price()).isEqualByComparingTo("0.06");

        ArgumentCaptor<UsageRecord> usage = ArgumentCaptor.forClass(UsageRecord.class);
        verify(usageSink).record(usage.capture());
        assertThat(usage.getValue().agentName()).isEqualTo("architect");
        assertThat(usage.getValue().cardId()).isEqualTo("c-1");
        assertThat(usage.getValue().streamed()).isFalse();
    }

    @SuppressWarnings("unchecked")
    @Test
    void execute_sendsAgentPromptWithContext() {
        when(modelClient.complete(anyList(), any())).thenReturn(new ModelCompletion("ok", 1, 1, null, null));

        gateway.execute("architect", inLane(3), null);

        ArgumentCaptor<List<ChatMessage>> messages = ArgumentCaptor.forClass(List.class);
        ArgumentCaptor<ModelConfig> config = ArgumentCaptor.forClass(ModelConfig.class);
        verify(modelClient).complete(messages.capture(), config.capture());
        assertThat(messages.getValue()).hasSize(2);
        assertThat(messages.getValue().get(0).role()).isEqualTo(ChatMessage.Role.SYSTEM);
        assertThat(messages.getValue().get(0).content()).contains("Architect Agent").endsWith("## Current Card");
        assertThat(messages.getValue().get(1).content()).isEqualTo("Design the schema");
        assertThat(config.getValue().modelName()).isEqualTo("claude-3-5-sonnet-20241022");
    }

    @Test
    void emptyResponse_isAnError() {
        when(modelClient.complete(anyList(), any())).thenReturn(new ModelCompletion("  ", 10, 0, null, null));

        assertThatThrownBy(() -> gateway.execute("architect", inLane(3), null))
                .isInstanceOf(ModelExecutionException.class)
                .hasMessage("Empty response from model for agent architect");
        verifyNoInteractions(usageSink);
    }

    @Test
    void providerFailure_isWrapped() {
        when(modelClient.complete(anyList(), any())).thenThrow(new IllegalStateException("socket closed"));

        assertThatThrownBy(() -> gateway.execute("architect", inLane(3), null))
                .isInstanceOf(ModelExecutionException.class)
                .hasMessageContaining("socket closed")
                .hasCauseInstanceOf(IllegalStateException.class);
    }

    @Test
    void usageSinkFailure_doesNotFailTheCall() {
        when(modelClient.complete(anyList(), any())).thenReturn(new ModelCompletion("fine", 5, 5, null, null));
        doThrow(new IllegalStateException("mongo down")).when(usageSink).record(any());

        assertThat(gateway.execute("architect", inLane(3), null).content()).isEqualTo("fine");
    }

    // ---- model resolution ----

    @Test
    void agentDefaultModel_onlyWhenProviderMatches() {
        assertThat(gateway.resolveConfig(registry.require("architect"), null).modelName())
                .isEqualTo("claude-3-5-sonnet-20241022");
        assertThat(gateway.resolveConfig(registry.require("research"), null).modelName())
                .isEqualTo("claude-3-haiku-20240307");
        assertThat(gateway.resolveConfig(registry.require("research"), new ModelConfig("gpt-4o-mini", 0.2, 100)).modelName())
                .isEqualTo("gpt-4o-mini");
    }

    // ---- streaming ----

    @Test
    void stream_emitsTextThenOneCompletion() {
        when(modelClient.stream(anyList(), any())).thenReturn(Flux.just(
                ModelChunk.text("Hello"), ModelChunk.text(""), ModelChunk.text(" world"),
                ModelChunk.usage(40, 2, "claude-3-5-sonnet-20241022")));

        StepVerifier.create(gateway.streamConverse(AgentDefinitions.CEO_COPILOT,
                        ExecutionContext.forConversation("p-1", "conv-1"), List.of(ChatMessage.user("hi")), null))
                .assertNext(c -> assertThat(c.content()).isEqualTo("Hello"))
                .assertNext(c -> assertThat(c.content()).isEqualTo(" world"))
                .assertNext(c -> {
                    assertThat(c.done()).isTrue();
                    assertThat(c.result().content()).isEqualTo("Hello world");
                    assertThat(c.result().inputTokens()).isEqualTo(40);
                    assertThat(c.result().model()).isEqualTo("claude-3-5-sonnet-20241022");
                })
                .verifyComplete();

        ArgumentCaptor<UsageRecord> usage = ArgumentCaptor.forClass(UsageRecord.class);
        verify(usageSink).record(usage.capture());
        assertThat(usage.getValue().streamed()).isTrue();
        assertThat(usage.getValue().conversationId()).isEqualTo("conv-1");
    }

    @Test
    void stream_failureMidway_isWrappedAndRecordsNothing() {
        when(modelClient.stream(anyList(), any())).thenReturn(
                Flux.concat(Flux.just(ModelChunk.text("partial")), Flux.error(new IllegalStateException("reset"))));

        StepVerifier.create(gateway.streamConverse(AgentDefinitions.CEO_COPILOT,
                        ExecutionContext.forConversation("p-1", "conv-1"), List.of(ChatMessage.user("hi")), null))
                .expectNextCount(1)
                .expectErrorSatisfies(e -> assertThat(e)
                        .isInstanceOf(ModelExecutionException.class)
                        .hasMessageContaining("reset"))
                .verify();
        verifyNoInteractions(usageSink);
    }

    @Test
    void stream_withNoText_failsAsEmpty() {
        when(modelClient.stream(anyList(), any())).thenReturn(Flux.just(ModelChunk.usage(3, 0, null)));

        StepVerifier.create(gateway.streamConverse(AgentDefinitions.CEO_COPILOT,
                        ExecutionContext.forConversation("p-1", "conv-1"), List.of(ChatMessage.user("hi")), null))
                .expectError(ModelExecutionException.class)
                .verify();
    }
}
