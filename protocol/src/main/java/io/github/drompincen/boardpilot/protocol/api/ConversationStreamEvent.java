package io.github.drompincen.boardpilot.protocol.api;

/**
 * One server-sent event of a streamed turn: {@code chunk} events carry text, the final
 * {@code complete} event carries the turn summary.
 */
public record ConversationStreamEvent(String event, String content, ConversationTurnResponse response) {

    public static final String CHUNK = "chunk";
    public static final String COMPLETE = "complete";
    public static final String ERROR = "error";

    public static ConversationStreamEvent chunk(String content) {
        return new ConversationStreamEvent(CHUNK, content, null);
    }

    public static ConversationStreamEvent complete(ConversationTurnResponse response) {
        return new ConversationStreamEvent(COMPLETE, response.content(), response);
    }

    public static ConversationStreamEvent error(String message) {
        return new ConversationStreamEvent(ERROR, message, null);
    }
}
