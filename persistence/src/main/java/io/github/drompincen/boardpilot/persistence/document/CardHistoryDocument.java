package io.github.drompincen.boardpilot.persistence.document;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.Map;

/**
 * Append-only audit trail of card changes.
 */
@Document(collection = "card_history")
@CompoundIndex(name = "card_time", def = "{'cardId': 1, 'timestamp': 1}")
public class CardHistoryDocument {

    @Id
    private String historyId;
    private String cardId;
    private String action;          // created, updated, moved, status_change, lane_change, ...
    private String field;
    private String previousValue;
    private String newValue;
    private String performedBy;
    private String reason;
    private Map<String, Object> metadata;
    private Instant timestamp;

    public CardHistoryDocument() {}

    public String getHistoryId() { return historyId; }
    public void setHistoryId(String historyId) { this.historyId = historyId; }

    public String getCardId() { return cardId; }
    public void setCardId(String cardId) { this.cardId = cardId; }

    public String getAction() { return action; }
    public void setAction(String action) { this.action = action; }

    public String getField() { return field; }
    public void setField(String field) { this.field = field; }

    public String getPreviousValue() { return previousValue; }
    public void setPreviousValue(String previousValue) { this.previousValue = previousValue; }

    public String getNewValue() { return newValue; }
    public void setNewValue(String newValue) { this.newValue = newValue; }

    public String getPerformedBy() { return performedBy; }
    public void setPerformedBy(String performedBy) { this.performedBy = performedBy; }

    public String getReason() { return reason; }
    public void setReason(String reason) { this.reason = reason; }

    public Map<String, Object> getMetadata() { return metadata; }
    public void setMetadata(Map<String, Object> metadata) { this.metadata = metadata; }

    public Instant getTimestamp() { return timestamp; }
    public void setTimestamp(Instant timestamp) { this.timestamp = timestamp; }
}
