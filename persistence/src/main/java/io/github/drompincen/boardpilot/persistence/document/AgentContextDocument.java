package io.github.drompincen.boardpilot.persistence.document;

import io.github.drompincen.boardpilot.protocol.api.CardPriority;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.List;

/**
 * Working document an agent keeps for a project: its plan, a log of tasks it has run,
 * and its todo list. One document per (project, agent, kind).
 */
@Document(collection = "agent_context_documents")
@CompoundIndex(name = "project_agent_kind", def = "{'projectId': 1, 'agentName': 1, 'kind': 1}", unique = true)
public class AgentContextDocument {

    public enum Kind { PLAN, TASK, TODO }

    public enum TodoStatus { PENDING, IN_PROGRESS, BLOCKED, COMPLETED }

    @Id
    private String contextId;
    private String projectId;
    private String agentName;
    private Kind kind;
    private String content;            // PLAN
    private List<TaskEntry> tasks;     // TASK, oldest first
    private List<TodoItem> todos;      // TODO
    private int version;
    private int tokenCount;
    private Instant createdAt;
    private Instant updatedAt;

    public AgentContextDocument() {}

    public static class TaskEntry {
        private Instant timestamp;
        private String title;
        private String summary;

        public TaskEntry() {}

        public TaskEntry(Instant timestamp, String title, String summary) {
            this.timestamp = timestamp;
            this.title = title;
            this.summary = summary;
        }

        public Instant getTimestamp() { return timestamp; }
        public void setTimestamp(Instant timestamp) { this.timestamp = timestamp; }

        public String getTitle() { return title; }
        public void setTitle(String title) { this.title = title; }

        public String getSummary() { return summary; }
        public void setSummary(String summary) { this.summary = summary; }
    }

    public static class TodoItem {
        private String id;
        private String title;
        private TodoStatus status;
        private CardPriority priority;
        private String description;

        public TodoItem() {}

        public TodoItem(String id, String title, TodoStatus status, CardPriority priority) {
            this.id = id;
            this.title = title;
            this.status = status;
            this.priority = priority;
        }

        public String getId() { return id; }
        public void setId(String id) { this.id = id; }

        public String getTitle() { return title; }
        public void setTitle(String title) { this.title = title; }

        public TodoStatus getStatus() { return status; }
        public void setStatus(TodoStatus status) { this.status = status; }

        public CardPriority getPriority() { return priority; }
        public void setPriority(CardPriority priority) { this.priority = priority; }

        public String getDescription() { return description; }
        public void setDescription(String description) { this.description = description; }
    }

    public String getContextId() { return contextId; }
    public void setContextId(String contextId) { this.contextId = contextId; }

    public String getProjectId() { return projectId; }
    public void setProjectId(String projectId) { this.projectId = projectId; }

    public String getAgentName() { return agentName; }
    public void setAgentName(String agentName) { this.agentName = agentName; }

    public Kind getKind() { return kind; }
    public void setKind(Kind kind) { this.kind = kind; }

    public String getContent() { return content; }
    public void setContent(String content) { this.content = content; }

    public List<TaskEntry> getTasks() { return tasks; }
    public void setTasks(List<TaskEntry> tasks) { this.tasks = tasks; }

    public List<TodoItem> getTodos() { return todos; }
    public void setTodos(List<TodoItem> todos) { this.todos = todos; }

    public int getVersion() { return version; }
    public void setVersion(int version) { this.version = version; }

    public int getTokenCount() { return tokenCount; }
    public void setTokenCount(int tokenCount) { this.tokenCount = tokenCount; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
}
