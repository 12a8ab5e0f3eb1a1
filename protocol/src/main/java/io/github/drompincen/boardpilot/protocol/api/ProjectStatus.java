package io.github.drompincen.boardpilot.protocol.api;

public enum ProjectStatus {
    ACTIVE, ARCHIVED, TEMPLATE
}
