package io.github.drompincen.boardpilot.runtime.action;

import io.github.drompincen.boardpilot.protocol.api.CardActionType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts {@code [ACTION:TYPE] ... [/ACTION]} blocks from model output.
 *
 * <p>Parsing is lenient on purpose: a block missing its required fields is dropped without
 * an error, but it is still stripped from the text the operator sees. Required fields are
 * {@code title} for CREATE_CARD, {@code cardId} and {@code toLane} for MOVE_CARD, and
 * {@code cardId} for UPDATE_CARD.
 */
@Component
public class ActionParser {

    private static final Logger log = LoggerFactory.getLogger(ActionParser.class);

    private static final Pattern BLOCK = Pattern.compile(
            "\\[ACTION:(CREATE_CARD|MOVE_CARD|UPDATE_CARD)\\]([\\s\\S]*?)\\[/ACTION\\]");

    public ParsedReply parse(String text) {
        if (text == null || text.isEmpty()) {
            return new ParsedReply("", List.of());
        }
        List<CardAction> actions = new ArrayList<>();
        StringBuilder cleaned = new StringBuilder();
        Matcher matcher = BLOCK.matcher(text);
        int last = 0;
        while (matcher.find()) {
            cleaned.append(text, last, matcher.start());
            last = matcher.end();

            CardActionType type = CardActionType.valueOf(matcher.group(1));
            Map<String, String> data = parseFields(matcher.group(2));
            if (isComplete(type, data)) {
                actions.add(new CardAction(type, data));
            } else {
                log.debug("Dropping incomplete {} block: {}", type, data.keySet());
            }
        }
        cleaned.append(text.substring(last));
        return new ParsedReply(stripSplicedBlocks(cleaned.toString()).trim(), actions);
    }

    /**
     * Removing a block can join the text around it into a new block. Those are stripped too,
     * never executed, until the text holds no block at all.
     */
    private static String stripSplicedBlocks(String text) {
        String current = text;
        Matcher matcher = BLOCK.matcher(current);
        while (matcher.find()) {
            log.debug("Stripping spliced {} block", matcher.group(1));
            current = matcher.replaceAll("");
            matcher = BLOCK.matcher(current);
        }
        return current;
    }

    static Map<String, String> parseFields(String body) {
        Map<String, String> data = new LinkedHashMap<>();
        for (String line : body.trim().split("\n")) {
            int colon = line.indexOf(':');
            if (colon > 0) {
                String key = line.substring(0, colon).trim();
                if (!key.isEmpty()) {
                    data.put(key, line.substring(colon + 1).trim());
                }
            }
        }
        return data;
    }

    private static boolean isComplete(CardActionType type, Map<String, String> data) {
        return switch (type) {
            case CREATE_CARD -> present(data, "title");
            case MOVE_CARD -> present(data, "cardId") && present(data, "toLane");
            case UPDATE_CARD -> present(data, "cardId");
        };
    }

    private static boolean present(Map<String, String> data, String key) {
        String value = data.get(key);
        return value != null && !value.isBlank();
    }
}
