package io.github.drompincen.boardpilot.persistence.document;

import io.github.drompincen.boardpilot.protocol.api.ConversationStatus;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

@Document(collection = "conversations")
@CompoundIndex(name = "tenant_status_updated", def = "{'tenantId': 1, 'status': 1, 'updatedAt': -1}")
public class ConversationDocument {

    @Id
    private String conversationId;
    private String tenantId;
    private String projectId;
    private String cardId;
    private String context;     // free-text label, e.g. "planning"
    private String title;
    private ConversationStatus status;
    private Instant createdAt;
    private Instant updatedAt;

    public ConversationDocument() {}

    public String getConversationId() { return conversationId; }
    public void setConversationId(String conversationId) { this.conversationId = conversationId; }

    public String getTenantId() { return tenantId; }
    public void setTenantId(String tenantId) { this.tenantId = tenantId; }

    public String getProjectId() { return projectId; }
    public void setProjectId(String projectId) { this.projectId = projectId; }

    public String getCardId() { return cardId; }
    public void setCardId(String cardId) { this.cardId = cardId; }

    public String getContext() { return context; }
    public void setContext(String context) { this.context = context; }

    public String getTitle() { return title; }
    public void setTitle(String title) { this.title = title; }

    public ConversationStatus getStatus() { return status; }
    public void setStatus(ConversationStatus status) { this.status = status; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
}
