package io.github.drompincen.boardpilot.protocol.api;

public enum TaskComplexity {
    SIMPLE, MODERATE, COMPLEX
}
