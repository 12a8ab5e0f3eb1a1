package io.github.drompincen.boardpilot.protocol.api;

public enum ReviewStatus {
    NONE, PENDING, IN_REVIEW, APPROVED, REJECTED
}
