package io.github.drompincen.boardpilot.gateway.controller;

import io.github.drompincen.boardpilot.protocol.api.AgentDto;
import io.github.drompincen.boardpilot.protocol.api.AgentRunDto;
import io.github.drompincen.boardpilot.protocol.api.AgentRunRequest;
import io.github.drompincen.boardpilot.protocol.api.AgentRunStatus;
import io.github.drompincen.boardpilot.runtime.NotFoundException;
import io.github.drompincen.boardpilot.runtime.agent.AgentDefinitions;
import io.github.drompincen.boardpilot.runtime.agent.AgentNotAllowedInLaneException;
import io.github.drompincen.boardpilot.runtime.agent.AgentRegistry;
import io.github.drompincen.boardpilot.runtime.agent.AgentRoutingTable;
import io.github.drompincen.boardpilot.runtime.agent.AgentRunService;
import io.github.drompincen.boardpilot.runtime.llm.ModelExecutionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.ResponseEntity;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AgentControllerTest {

    @Mock private AgentRunService agentRunService;

    private AgentController controller;

    @BeforeEach
    void setUp() {
        controller = new AgentController(new AgentRegistry(AgentDefinitions.defaults()),
                AgentRoutingTable.defaults(), agentRunService);
    }

    // ---- registry ----

    @Test
    void listReturnsAllAgents() {
        assertThat(controller.list()).hasSize(16);
    }

    @Test
    void getReturnsAgentWhenFound() {
        ResponseEntity<?> response = controller.get("architect");

        assertThat(response.getStatusCode().value()).isEqualTo(200);
        AgentDto dto = (AgentDto) response.getBody();
        assertThat(dto.name()).isEqualTo("architect");
        assertThat(dto.allowedLanes()).containsExactly(3);
    }

    @Test
    void getReturns404WhenNotFound() {
        ResponseEntity<?> response = controller.get("ghost");

        assertThat(response.getStatusCode().value()).isEqualTo(404);
        assertThat(response.getBody()).isEqualTo(Map.of("error", "Agent not found: ghost"));
    }

    @Test
    void byLaneListsAgentsAllowedThere() {
        assertThat(controller.byLane(7)).extracting(AgentDto::name)
                .containsExactly("ceo_copilot", "code_standards", "qa", "troubleshooter");
    }

    @Test
    @SuppressWarnings("unchecked")
    void routingIncludesBaselineAgent() {
        ResponseEntity<?> response = controller.routing();

        Map<String, Object> body = (Map<String, Object>) response.getBody();
        assertThat(body).containsEntry("baselineAgent", "ceo-copilot");
        assertThat((List<?>) body.get("routes")).isNotEmpty();
    }

    // ---- runs ----

    @Test
    void runReturnsCompletedRun() {
        AgentRunDto run = new AgentRunDto("r-1", "c-1", "p-1", "architect", 3, AgentRunStatus.COMPLETED,
                "done", null, 10, 20, BigDecimal.ZERO, BigDecimal.ZERO, Instant.now(), Instant.now());
        when(agentRunService.run("c-1", "architect", "go")).thenReturn(run);

        ResponseEntity<?> response = controller.run("architect", new AgentRunRequest("c-1", "go"));

        assertThat(response.getStatusCode().value()).isEqualTo(200);
        assertThat(response.getBody()).isSameAs(run);
    }

    @Test
    void runWithoutCardIsBadRequest() {
        ResponseEntity<?> response = controller.run("architect", new AgentRunRequest(" ", null));

        assertThat(response.getStatusCode().value()).isEqualTo(400);
        verifyNoInteractions(agentRunService);
    }

    @Test
    void runInForbiddenLaneIs403() {
        when(agentRunService.run(eq("c-1"), eq("qa"), any()))
                .thenThrow(new AgentNotAllowedInLaneException("qa", 0));

        ResponseEntity<?> response = controller.run("qa", new AgentRunRequest("c-1", null));

        assertThat(response.getStatusCode().value()).isEqualTo(403);
    }

    @Test
    void runOnMissingCardIs404() {
        when(agentRunService.run(eq("c-404"), anyString(), any())).thenThrow(new NotFoundException("Card", "c-404"));

        ResponseEntity<?> response = controller.run("architect", new AgentRunRequest("c-404", null));

        assertThat(response.getStatusCode().value()).isEqualTo(404);
        assertThat(response.getBody()).isEqualTo(Map.of("error", "Card not found: c-404"));
    }

    @Test
    void providerFailureIs502() {
        when(agentRunService.run(eq("c-1"), anyString(), any()))
                .thenThrow(new ModelExecutionException("openai call failed: timeout"));

        ResponseEntity<?> response = controller.run("architect", new AgentRunRequest("c-1", null));

        assertThat(response.getStatusCode().value()).isEqualTo(502);
    }
}
