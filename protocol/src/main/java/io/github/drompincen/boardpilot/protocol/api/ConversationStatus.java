package io.github.drompincen.boardpilot.protocol.api;

public enum ConversationStatus {
    ACTIVE, CLOSED
}
