package io.github.drompincen.boardpilot.runtime.action;

import java.util.List;

public record ParsedReply(String cleanedText, List<CardAction> actions) {

    public ParsedReply {
        actions = List.copyOf(actions);
    }
}
