package io.github.drompincen.boardpilot.protocol.api;

public record AgentRunRequest(String cardId, String message) {}
