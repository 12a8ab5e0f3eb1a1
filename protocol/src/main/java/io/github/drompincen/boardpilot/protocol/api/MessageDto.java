package io.github.drompincen.boardpilot.protocol.api;

import java.time.Instant;
import java.util.Map;

public record MessageDto(
        String messageId,
        String conversationId,
        long seq,
        String role,
        String content,
        Map<String, Object> metadata,
        Instant timestamp
) {}
