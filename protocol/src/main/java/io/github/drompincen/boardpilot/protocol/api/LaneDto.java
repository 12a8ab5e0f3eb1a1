package io.github.drompincen.boardpilot.protocol.api;

public record LaneDto(String laneId, String boardId, int laneNumber, String name) {}
