package io.github.drompincen.boardpilot.protocol.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum DocumentType {
    BLUEPRINT("blueprint", "Blueprint", 0),
    PRD("prd", "PRD", 1),
    MVP("mvp", "MVP", 1),
    PLAYBOOK("playbook", "Agent Playbook", 0);

    private final String value;
    private final String displayName;
    private final int initialLane;

    DocumentType(String value, String displayName, int initialLane) {
        this.value = value;
        this.displayName = displayName;
        this.initialLane = initialLane;
    }

    @JsonValue
    public String value() { return value; }

    public String displayName() { return displayName; }

    /** Lane a fresh review card for this document type is placed in. */
    public int initialLane() { return initialLane; }

    public String reviewCardTitle() {
        return "Review " + displayName;
    }

    public String fileName() {
        return name() + ".md";
    }

    @JsonCreator
    public static DocumentType fromValue(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().toLowerCase();
        for (DocumentType type : values()) {
            if (type.value.equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown document type: " + value);
    }
}
