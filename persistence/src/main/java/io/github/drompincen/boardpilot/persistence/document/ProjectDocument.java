package io.github.drompincen.boardpilot.persistence.document;

import io.github.drompincen.boardpilot.protocol.api.PlanningPhase;
import io.github.drompincen.boardpilot.protocol.api.ProjectStatus;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.Map;

@Document(collection = "projects")
public class ProjectDocument {

    @Id
    private String projectId;
    @Indexed
    private String tenantId;
    private String name;
    private String description;
    private ProjectStatus status;
    private PlanningPhase phase;
    private String localPath;                   // root for rendered document files, optional
    private Map<String, String> phaseResponses; // phase wire value -> operator summary
    private Instant createdAt;
    @Indexed(direction = org.springframework.data.mongodb.core.index.IndexDirection.DESCENDING)
    private Instant updatedAt;

    public ProjectDocument() {}

    public String getProjectId() { return projectId; }
    public void setProjectId(String projectId) { this.projectId = projectId; }

    public String getTenantId() { return tenantId; }
    public void setTenantId(String tenantId) { this.tenantId = tenantId; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }

    public ProjectStatus getStatus() { return status; }
    public void setStatus(ProjectStatus status) { this.status = status; }

    public PlanningPhase getPhase() { return phase; }
    public void setPhase(PlanningPhase phase) { this.phase = phase; }

    public String getLocalPath() { return localPath; }
    public void setLocalPath(String localPath) { this.localPath = localPath; }

    public Map<String, String> getPhaseResponses() { return phaseResponses; }
    public void setPhaseResponses(Map<String, String> phaseResponses) { this.phaseResponses = phaseResponses; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
}
