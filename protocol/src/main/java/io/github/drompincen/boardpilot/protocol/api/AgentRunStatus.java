package io.github.drompincen.boardpilot.protocol.api;

public enum AgentRunStatus {
    RUNNING, COMPLETED, FAILED
}
