package io.github.drompincen.boardpilot.runtime.action;

import io.github.drompincen.boardpilot.protocol.api.CardActionType;

import java.util.Map;

/**
 * A directive block lifted out of model output: its type and its {@code key: value} fields.
 */
public record CardAction(CardActionType type, Map<String, String> data) {

    public CardAction {
        data = Map.copyOf(data);
    }

    /** Trimmed value, or null when the key is absent or blank. */
    public String get(String key) {
        String value = data.get(key);
        return value == null || value.isBlank() ? null : value;
    }

    public boolean has(String key) {
        return get(key) != null;
    }
}
