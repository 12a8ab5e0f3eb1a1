package io.github.drompincen.boardpilot.runtime.prompt;

import io.github.drompincen.boardpilot.protocol.api.TaskComplexity;

public enum PromptMode {
    FULL, SUMMARY;

    public static PromptMode forComplexity(TaskComplexity complexity) {
        if (complexity == null) {
            return FULL;
        }
        return switch (complexity) {
            case SIMPLE -> SUMMARY;
            case MODERATE, COMPLEX -> FULL;
        };
    }
}
