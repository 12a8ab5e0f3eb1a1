package io.github.drompincen.boardpilot.protocol.api;

import java.time.Instant;
import java.util.Map;

public record CardHistoryDto(
        String historyId,
        String cardId,
        String action,
        String field,
        String previousValue,
        String newValue,
        String performedBy,
        String reason,
        Map<String, Object> metadata,
        Instant timestamp
) {}
