package io.github.drompincen.boardpilot.protocol.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

/**
 * Ordered steps of the planning conversation. {@link #GENERAL} sits outside the ordering
 * and never advances.
 */
public enum PlanningPhase {
    WELCOME("welcome"),
    VISION("vision"),
    REQUIREMENTS("requirements"),
    GOALS("goals"),
    ROLES("roles"),
    ARCHITECTURE("architecture"),
    BLUEPRINT_REVIEW("blueprint-review"),
    PLANNING_COMPLETE("planning-complete"),
    GENERAL("general");

    private final String value;

    PlanningPhase(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public boolean isSequential() {
        return this != GENERAL;
    }

    public boolean isTerminal() {
        return this == PLANNING_COMPLETE;
    }

    /** The following phase in the fixed order, empty at the terminal phase and for GENERAL. */
    public Optional<PlanningPhase> next() {
        if (!isSequential() || isTerminal()) {
            return Optional.empty();
        }
        return Optional.of(values()[ordinal() + 1]);
    }

    @JsonCreator
    public static PlanningPhase fromValue(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().toLowerCase().replace('_', '-');
        for (PlanningPhase phase : values()) {
            if (phase.value.equals(normalized)) {
                return phase;
            }
        }
        throw new IllegalArgumentException("Unknown planning phase: " + value);
    }

    @Override
    public String toString() {
        return value;
    }
}
