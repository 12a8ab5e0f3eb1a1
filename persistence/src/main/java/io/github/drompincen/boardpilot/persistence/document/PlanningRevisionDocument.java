package io.github.drompincen.boardpilot.persistence.document;

import io.github.drompincen.boardpilot.protocol.api.DocumentType;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

@Document(collection = "document_revisions")
@CompoundIndex(name = "project_type_version", def = "{'projectId': 1, 'type': 1, 'version': 1}", unique = true)
public class PlanningRevisionDocument {

    @Id
    private String revisionId;
    private String projectId;
    private DocumentType type;
    private int version;
    private String content;
    private String generatedBy;
    private Instant createdAt;

    public PlanningRevisionDocument() {}

    public String getRevisionId() { return revisionId; }
    public void setRevisionId(String revisionId) { this.revisionId = revisionId; }

    public String getProjectId() { return projectId; }
    public void setProjectId(String projectId) { this.projectId = projectId; }

    public DocumentType getType() { return type; }
    public void setType(DocumentType type) { this.type = type; }

    public int getVersion() { return version; }
    public void setVersion(int version) { this.version = version; }

    public String getContent() { return content; }
    public void setContent(String content) { this.content = content; }

    public String getGeneratedBy() { return generatedBy; }
    public void setGeneratedBy(String generatedBy) { this.generatedBy = generatedBy; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
}
