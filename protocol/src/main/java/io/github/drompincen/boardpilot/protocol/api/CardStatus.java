package io.github.drompincen.boardpilot.protocol.api;

import java.util.Optional;

public enum CardStatus {
    PENDING, READY, QUEUED, RUNNING, IN_PROGRESS, BLOCKED, DONE;

    /**
     * Lenient parse for values coming out of model text: case-insensitive, accepts
     * "in progress", "in-progress" and "InProgress".
     */
    public static Optional<CardStatus> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String key = raw.trim()
                .replaceAll("([a-z])([A-Z])", "$1_$2")
                .replace('-', '_')
                .replace(' ', '_')
                .toUpperCase();
        try {
            return Optional.of(CardStatus.valueOf(key));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
