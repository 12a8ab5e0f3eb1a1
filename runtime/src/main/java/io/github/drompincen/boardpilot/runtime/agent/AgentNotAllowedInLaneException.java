package io.github.drompincen.boardpilot.runtime.agent;

public class AgentNotAllowedInLaneException extends RuntimeException {

    private final String agentName;
    private final int laneNumber;

    public AgentNotAllowedInLaneException(String agentName, int laneNumber) {
        super("Agent " + agentName + " is not allowed to execute in lane " + laneNumber);
        this.agentName = agentName;
        this.laneNumber = laneNumber;
    }

    public String getAgentName() { return agentName; }

    public int getLaneNumber() { return laneNumber; }
}
