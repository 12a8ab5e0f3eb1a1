package io.github.drompincen.boardpilot.runtime.agent;

import io.github.drompincen.boardpilot.protocol.api.AgentRouteDto;
import io.github.drompincen.boardpilot.protocol.api.CardPriority;

import java.util.List;

/**
 * Where cards for an agent land: the lanes it works in, the lane new cards start in,
 * and the priority they get when none is given.
 */
public record AgentRoute(List<Integer> lanes, int defaultLane, CardPriority priority) {

    public AgentRoute {
        lanes = List.copyOf(lanes);
        if (!lanes.contains(defaultLane)) {
            throw new IllegalArgumentException("Default lane " + defaultLane + " not in " + lanes);
        }
    }

    public AgentRouteDto toDto(String agent) {
        return new AgentRouteDto(agent, lanes, defaultLane, priority);
    }
}
