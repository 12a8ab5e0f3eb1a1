package io.github.drompincen.boardpilot.gateway.controller;

import io.github.drompincen.boardpilot.protocol.api.AgentDto;
import io.github.drompincen.boardpilot.protocol.api.AgentRunRequest;
import io.github.drompincen.boardpilot.runtime.agent.AgentDefinition;
import io.github.drompincen.boardpilot.runtime.agent.AgentRegistry;
import io.github.drompincen.boardpilot.runtime.agent.AgentRoutingTable;
import io.github.drompincen.boardpilot.runtime.agent.AgentRunService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/agents")
public class AgentController {

    private final AgentRegistry agentRegistry;
    private final AgentRoutingTable routingTable;
    private final AgentRunService agentRunService;

    public AgentController(AgentRegistry agentRegistry, AgentRoutingTable routingTable,
                           AgentRunService agentRunService) {
        this.agentRegistry = agentRegistry;
        this.routingTable = routingTable;
        this.agentRunService = agentRunService;
    }

    @GetMapping
    public List<AgentDto> list() {
        return agentRegistry.all().stream().map(AgentDefinition::toDto).toList();
    }

    @GetMapping("/{name}")
    public ResponseEntity<?> get(@PathVariable String name) {
        return agentRegistry.get(name)
                .<ResponseEntity<?>>map(a -> ResponseEntity.ok(a.toDto()))
                .orElseGet(() -> ResponseEntity.status(404).body(Map.of("error", "Agent not found: " + name)));
    }

    @GetMapping("/lane/{laneNumber}")
    public List<AgentDto> byLane(@PathVariable int laneNumber) {
        return agentRegistry.byLane(laneNumber).stream().map(AgentDefinition::toDto).toList();
    }

    @GetMapping("/routing")
    public ResponseEntity<?> routing() {
        return ResponseEntity.ok(Map.of(
                "baselineAgent", routingTable.baselineAgent(),
                "routes", routingTable.toDtos()));
    }

    /** Runs the named agent on a card. 403 when the card's lane does not allow the agent. */
    @PostMapping("/{name}/run")
    public ResponseEntity<?> run(@PathVariable String name, @RequestBody AgentRunRequest request) {
        if (request == null || request.cardId() == null || request.cardId().isBlank()) {
            return ApiErrors.badRequest("cardId is required");
        }
        try {
            return ResponseEntity.ok(agentRunService.run(request.cardId(), name, request.message()));
        } catch (RuntimeException e) {
            return ApiErrors.toResponse(e);
        }
    }

    @GetMapping("/runs/{cardId}")
    public ResponseEntity<?> runsForCard(@PathVariable String cardId) {
        return ResponseEntity.ok(agentRunService.runsForCard(cardId));
    }
}
