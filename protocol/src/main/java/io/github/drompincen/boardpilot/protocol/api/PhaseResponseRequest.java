package io.github.drompincen.boardpilot.protocol.api;

public record PhaseResponseRequest(String projectId, String phase, String response) {}
