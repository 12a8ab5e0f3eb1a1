package io.github.drompincen.boardpilot.runtime.prompt;

import io.github.drompincen.boardpilot.persistence.document.AgentContextDocument;
import io.github.drompincen.boardpilot.persistence.document.AgentContextDocument.Kind;
import io.github.drompincen.boardpilot.persistence.document.AgentContextDocument.TaskEntry;
import io.github.drompincen.boardpilot.persistence.document.AgentContextDocument.TodoItem;
import io.github.drompincen.boardpilot.persistence.document.AgentContextDocument.TodoStatus;
import io.github.drompincen.boardpilot.persistence.repository.AgentContextRepository;
import io.github.drompincen.boardpilot.protocol.api.CardPriority;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Maintains each agent's plan, task log and todo list per project, and renders them
 * within a token budget for the prompt builder.
 */
@Service
public class AgentContextService {

    private static final Logger log = LoggerFactory.getLogger(AgentContextService.class);

    static final int RECENT_TASKS = 3;

    private final AgentContextRepository agentContextRepository;

    public AgentContextService(AgentContextRepository agentContextRepository) {
        this.agentContextRepository = agentContextRepository;
    }

    public Optional<String> getPlan(String projectId, String agentName) {
        return agentContextRepository.findByProjectIdAndAgentNameAndKind(projectId, agentName, Kind.PLAN)
                .map(AgentContextDocument::getContent);
    }

    public AgentContextDocument savePlan(String projectId, String agentName, String content) {
        AgentContextDocument doc = loadOrCreate(projectId, agentName, Kind.PLAN);
        doc.setContent(content);
        doc.setTokenCount(TokenEstimator.estimate(content));
        return touchAndSave(doc);
    }

    public AgentContextDocument appendTask(String projectId, String agentName, String title, String summary) {
        AgentContextDocument doc = loadOrCreate(projectId, agentName, Kind.TASK);
        List<TaskEntry> tasks = doc.getTasks() == null ? new ArrayList<>() : new ArrayList<>(doc.getTasks());
        tasks.add(new TaskEntry(Instant.now(), title, summary));
        doc.setTasks(tasks);
        doc.setTokenCount(TokenEstimator.estimate(renderTasks(tasks)));
        return touchAndSave(doc);
    }

    public AgentContextDocument saveTodos(String projectId, String agentName, List<TodoItem> todos) {
        AgentContextDocument doc = loadOrCreate(projectId, agentName, Kind.TODO);
        List<TodoItem> items = new ArrayList<>();
        for (TodoItem item : todos) {
            if (item.getId() == null) {
                item.setId(UUID.randomUUID().toString().substring(0, 8));
            }
            items.add(item);
        }
        doc.setTodos(items);
        doc.setTokenCount(TokenEstimator.estimate(renderTodos(items)));
        return touchAndSave(doc);
    }

    /**
     * Renders the agent's own context. FULL truncates each part to its budget; SUMMARY keeps
     * the last three tasks and only open high-priority or in-progress todos.
     */
    public String getTokenOptimizedContext(String projectId, String agentName, PromptMode mode) {
        TokenBudget budget = TokenBudget.forMode(mode);
        Map<Kind, AgentContextDocument> docs = new EnumMap<>(Kind.class);
        for (AgentContextDocument doc : agentContextRepository.findByProjectIdAndAgentName(projectId, agentName)) {
            docs.put(doc.getKind(), doc);
        }

        StringBuilder sb = new StringBuilder();
        AgentContextDocument plan = docs.get(Kind.PLAN);
        if (plan != null && plan.getContent() != null && !plan.getContent().isBlank()) {
            sb.append("## Agent Plan\n\n")
                    .append(TokenEstimator.truncate(plan.getContent(), budget.agentPlan()))
                    .append("\n\n");
        }

        AgentContextDocument task = docs.get(Kind.TASK);
        if (task != null && task.getTasks() != null && !task.getTasks().isEmpty()) {
            String content = mode == PromptMode.FULL
                    ? TokenEstimator.truncate(renderTasks(task.getTasks()), budget.agentTask())
                    : recentTasks(task.getTasks(), budget.agentTask());
            sb.append("## Recent Tasks\n\n").append(content).append("\n\n");
        }

        AgentContextDocument todo = docs.get(Kind.TODO);
        if (todo != null && todo.getTodos() != null && !todo.getTodos().isEmpty()) {
            List<TodoItem> items = mode == PromptMode.FULL ? todo.getTodos() : highPriorityOpen(todo.getTodos());
            if (!items.isEmpty()) {
                sb.append("## Pending Items\n\n")
                        .append(TokenEstimator.truncate(renderTodos(items), budget.agentTodo()))
                        .append("\n\n");
            }
        }
        return sb.toString();
    }

    private String recentTasks(List<TaskEntry> tasks, int maxTokens) {
        int omitted = Math.max(0, tasks.size() - RECENT_TASKS);
        String rendered = renderTasks(tasks.subList(omitted, tasks.size()));
        if (omitted > 0) {
            rendered = "[" + omitted + " earlier tasks omitted]\n\n" + rendered;
        }
        return TokenEstimator.truncate(rendered, maxTokens);
    }

    private static List<TodoItem> highPriorityOpen(List<TodoItem> todos) {
        return todos.stream()
                .filter(t -> t.getStatus() != TodoStatus.COMPLETED)
                .filter(t -> isHigh(t.getPriority()) || t.getStatus() == TodoStatus.IN_PROGRESS)
                .collect(Collectors.toList());
    }

    private static boolean isHigh(CardPriority priority) {
        return priority == CardPriority.HIGH || priority == CardPriority.CRITICAL;
    }

    static String renderTasks(List<TaskEntry> tasks) {
        return tasks.stream()
                .map(t -> "### " + t.getTimestamp() + " - " + t.getTitle()
                        + (t.getSummary() == null ? "" : "\n\n" + t.getSummary()))
                .collect(Collectors.joining("\n\n---\n\n"));
    }

    static String renderTodos(List<TodoItem> todos) {
        List<String> lines = new ArrayList<>();
        lines.add("# Agent Todo List\n");
        todos.stream()
                .sorted(Comparator.comparingInt((TodoItem t) -> statusOrder(t.getStatus()))
                        .thenComparingInt(t -> priorityOrder(t.getPriority())))
                .forEach(t -> {
                    lines.add("- " + checkbox(t.getStatus()) + " " + priorityLabel(t.getPriority()) + " "
                            + t.getTitle() + " (id: " + t.getId() + ")");
                    if (t.getDescription() != null && !t.getDescription().isBlank()) {
                        lines.add("  - " + t.getDescription());
                    }
                });
        return String.join("\n", lines);
    }

    private static int statusOrder(TodoStatus status) {
        if (status == null) return 2;
        return switch (status) {
            case IN_PROGRESS -> 0;
            case BLOCKED -> 1;
            case PENDING -> 2;
            case COMPLETED -> 3;
        };
    }

    private static int priorityOrder(CardPriority priority) {
        if (priority == null) return 2;
        return switch (priority) {
            case CRITICAL, HIGH -> 0;
            case MEDIUM -> 1;
            case LOW -> 2;
        };
    }

    private static String checkbox(TodoStatus status) {
        if (status == null) return "[ ]";
        return switch (status) {
            case COMPLETED -> "[x]";
            case IN_PROGRESS -> "[~]";
            case BLOCKED -> "[!]";
            case PENDING -> "[ ]";
        };
    }

    private static String priorityLabel(CardPriority priority) {
        return priority == null ? "MEDIUM" : priority.name();
    }

    private AgentContextDocument loadOrCreate(String projectId, String agentName, Kind kind) {
        return agentContextRepository.findByProjectIdAndAgentNameAndKind(projectId, agentName, kind)
                .orElseGet(() -> {
                    AgentContextDocument doc = new AgentContextDocument();
                    doc.setContextId(UUID.randomUUID().toString());
                    doc.setProjectId(projectId);
                    doc.setAgentName(agentName);
                    doc.setKind(kind);
                    doc.setCreatedAt(Instant.now());
                    return doc;
                });
    }

    private AgentContextDocument touchAndSave(AgentContextDocument doc) {
        doc.setVersion(doc.getVersion() + 1);
        doc.setUpdatedAt(Instant.now());
        AgentContextDocument saved = agentContextRepository.save(doc);
        log.debug("Saved {} context for agent {} in project {} (v{})",
                doc.getKind(), doc.getAgentName(), doc.getProjectId(), doc.getVersion());
        return saved;
    }
}
