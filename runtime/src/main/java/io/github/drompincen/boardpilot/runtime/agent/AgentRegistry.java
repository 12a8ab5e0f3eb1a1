package io.github.drompincen.boardpilot.runtime.agent;

import io.github.drompincen.boardpilot.runtime.NotFoundException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only lookup of agent definitions. Built once, safe for concurrent reads.
 */
public class AgentRegistry {

    private static final Logger log = LoggerFactory.getLogger(AgentRegistry.class);

    private final Map<String, AgentDefinition> agents;

    public AgentRegistry(Collection<AgentDefinition> definitions) {
        Map<String, AgentDefinition> map = new LinkedHashMap<>();
        for (AgentDefinition def : definitions) {
            if (map.putIfAbsent(def.name(), def) != null) {
                throw new IllegalArgumentException("Duplicate agent definition: " + def.name());
            }
        }
        this.agents = Map.copyOf(map);
        log.info("Agent registry loaded with {} agents", agents.size());
    }

    public Optional<AgentDefinition> get(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(agents.get(name));
    }

    public AgentDefinition require(String name) {
        return get(name).orElseThrow(() -> new NotFoundException("Agent", name));
    }

    public boolean isAllowedInLane(String name, int laneNumber) {
        return get(name).map(a -> a.allowsLane(laneNumber)).orElse(false);
    }

    /** Throws {@link AgentNotAllowedInLaneException} unless the agent may run in the lane. */
    public AgentDefinition checkLanePermission(String name, int laneNumber) {
        AgentDefinition agent = require(name);
        if (!agent.allowsLane(laneNumber)) {
            throw new AgentNotAllowedInLaneException(name, laneNumber);
        }
        return agent;
    }

    public List<AgentDefinition> byLane(int laneNumber) {
        return agents.values().stream()
                .filter(a -> a.allowsLane(laneNumber))
                .sorted(Comparator.comparing(AgentDefinition::name))
                .toList();
    }

    public List<AgentDefinition> all() {
        return agents.values().stream()
                .sorted(Comparator.comparing(AgentDefinition::name))
                .toList();
    }
}
