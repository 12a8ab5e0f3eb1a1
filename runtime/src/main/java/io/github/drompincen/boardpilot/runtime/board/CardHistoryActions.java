package io.github.drompincen.boardpilot.runtime.board;

/** Values of {@code CardHistoryDocument.action}. */
public final class CardHistoryActions {

    public static final String CREATED = "created";
    public static final String UPDATED = "updated";
    public static final String MOVED = "moved";
    public static final String STATUS_CHANGE = "status_change";
    public static final String LANE_CHANGE = "lane_change";
    public static final String REVIEW_TRANSITION = "review_transition";
    public static final String DOCUMENT_GENERATED = "document_generated";
    public static final String AGENT_RUN = "agent_run";

    private CardHistoryActions() {}
}
