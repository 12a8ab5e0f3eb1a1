package io.github.drompincen.boardpilot.protocol.api;

import java.util.List;

public record AgentRouteDto(
        String agent,
        List<Integer> lanes,
        int defaultLane,
        CardPriority priority
) {}
