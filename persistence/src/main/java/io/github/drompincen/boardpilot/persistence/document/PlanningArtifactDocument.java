package io.github.drompincen.boardpilot.persistence.document;

import io.github.drompincen.boardpilot.protocol.api.DocumentType;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Current version of a planning document (Blueprint, PRD, MVP, Playbook) of a project.
 */
@Document(collection = "planning_documents")
@CompoundIndex(name = "project_type", def = "{'projectId': 1, 'type': 1}", unique = true)
public class PlanningArtifactDocument {

    @Id
    private String documentId;
    private String projectId;
    private DocumentType type;
    private String content;
    private int version;
    private Instant createdAt;
    private Instant updatedAt;

    public PlanningArtifactDocument() {}

    public String getDocumentId() { return documentId; }
    public void setDocumentId(String documentId) { this.documentId = documentId; }

    public String getProjectId() { return projectId; }
    public void setProjectId(String projectId) { this.projectId = projectId; }

    public DocumentType getType() { return type; }
    public void setType(DocumentType type) { this.type = type; }

    public String getContent() { return content; }
    public void setContent(String content) { this.content = content; }

    public int getVersion() { return version; }
    public void setVersion(int version) { this.version = version; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
}
