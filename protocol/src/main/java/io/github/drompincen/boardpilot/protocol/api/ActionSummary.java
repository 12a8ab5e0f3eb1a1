package io.github.drompincen.boardpilot.protocol.api;

import java.util.List;

/**
 * Outcome of applying a batch of card actions. A card created through deduplication
 * (an existing card with the same title was reused) is reported under {@code cardsCreated}.
 */
public record ActionSummary(
        List<CardDto> cardsCreated,
        List<CardDto> cardsMoved,
        List<CardDto> cardsUpdated,
        List<String> errors
) {
    public static ActionSummary empty() {
        return new ActionSummary(List.of(), List.of(), List.of(), List.of());
    }

    public static ActionSummary failed(String error) {
        return new ActionSummary(List.of(), List.of(), List.of(), List.of(error));
    }

    public boolean hasErrors() {
        return errors != null && !errors.isEmpty();
    }
}
