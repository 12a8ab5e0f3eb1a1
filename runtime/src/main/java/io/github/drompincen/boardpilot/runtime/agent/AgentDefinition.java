package io.github.drompincen.boardpilot.runtime.agent;

import io.github.drompincen.boardpilot.protocol.api.AgentDto;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Code-defined agent. Never mutated after the registry is built.
 */
public record AgentDefinition(
        String name,
        String displayName,
        String description,
        Set<Integer> allowedLanes,
        String defaultProvider,
        String defaultModel,
        String systemPrompt
) {
    public AgentDefinition {
        allowedLanes = Set.copyOf(allowedLanes);
    }

    public boolean allowsLane(int laneNumber) {
        return allowedLanes.contains(laneNumber);
    }

    public AgentDto toDto() {
        List<Integer> lanes = new ArrayList<>(new TreeSet<>(allowedLanes));
        return new AgentDto(name, displayName, description, lanes, defaultProvider, defaultModel);
    }
}
