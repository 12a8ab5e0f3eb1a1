package io.github.drompincen.boardpilot.protocol.api;

import java.util.Optional;

public enum CardPriority {
    LOW, MEDIUM, HIGH, CRITICAL;

    public static Optional<CardPriority> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(CardPriority.valueOf(raw.trim().toUpperCase()));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
