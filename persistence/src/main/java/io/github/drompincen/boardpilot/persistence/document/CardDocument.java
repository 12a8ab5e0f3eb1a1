package io.github.drompincen.boardpilot.persistence.document;

import io.github.drompincen.boardpilot.protocol.api.CardPriority;
import io.github.drompincen.boardpilot.protocol.api.CardStatus;
import io.github.drompincen.boardpilot.protocol.api.DocumentType;
import io.github.drompincen.boardpilot.protocol.api.ReviewStatus;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

@Document(collection = "cards")
@CompoundIndexes({
        @CompoundIndex(name = "board_title", def = "{'boardId': 1, 'title': 1}"),
        @CompoundIndex(name = "lane_position", def = "{'laneId': 1, 'position': -1}")
})
public class CardDocument {

    @Id
    private String cardId;
    private String boardId;
    private String laneId;
    @Indexed
    private String parentCardId;
    private String title;
    private String description;
    private String type;                // "task", "doc", ...
    private CardPriority priority;
    private String assignedAgent;
    private CardStatus status;
    private int position;
    private DocumentType documentType;  // review cards only
    private ReviewStatus reviewStatus;  // review cards only
    private Instant createdAt;
    private Instant updatedAt;

    public CardDocument() {}

    public String getCardId() { return cardId; }
    public void setCardId(String cardId) { this.cardId = cardId; }

    public String getBoardId() { return boardId; }
    public void setBoardId(String boardId) { this.boardId = boardId; }

    public String getLaneId() { return laneId; }
    public void setLaneId(String laneId) { this.laneId = laneId; }

    public String getParentCardId() { return parentCardId; }
    public void setParentCardId(String parentCardId) { this.parentCardId = parentCardId; }

    public String getTitle() { return title; }
    public void setTitle(String title) { this.title = title; }

    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }

    public String getType() { return type; }
    public void setType(String type) { this.type = type; }

    public CardPriority getPriority() { return priority; }
    public void setPriority(CardPriority priority) { this.priority = priority; }

    public String getAssignedAgent() { return assignedAgent; }
    public void setAssignedAgent(String assignedAgent) { this.assignedAgent = assignedAgent; }

    public CardStatus getStatus() { return status; }
    public void setStatus(CardStatus status) { this.status = status; }

    public int getPosition() { return position; }
    public void setPosition(int position) { this.position = position; }

    public DocumentType getDocumentType() { return documentType; }
    public void setDocumentType(DocumentType documentType) { this.documentType = documentType; }

    public ReviewStatus getReviewStatus() { return reviewStatus; }
    public void setReviewStatus(ReviewStatus reviewStatus) { this.reviewStatus = reviewStatus; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
}
