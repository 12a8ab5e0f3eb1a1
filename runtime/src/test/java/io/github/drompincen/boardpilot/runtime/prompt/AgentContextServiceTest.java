package io.github.drompincen.boardpilot.runtime.prompt;

import io.github.drompincen.boardpilot.persistence.document.AgentContextDocument;
import io.github.drompincen.boardpilot.persistence.document.AgentContextDocument.Kind;
import io.github.drompincen.boardpilot.persistence.document.AgentContextDocument.TaskEntry;
import io.github.drompincen.boardpilot.persistence.document.AgentContextDocument.TodoItem;
import io.github.drompincen.boardpilot.persistence.document.AgentContextDocument.TodoStatus;
import io.github.drompincen.boardpilot.persistence.repository.AgentContextRepository;
import io.github.drompincen.boardpilot.protocol.api.CardPriority;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class AgentContextServiceTest {

    @Mock private AgentContextRepository repository;

    private AgentContextService service;

    @BeforeEach
    void setUp() {
        service = new AgentContextService(repository);
        when(repository.save(any(AgentContextDocument.class))).thenAnswer(inv -> inv.getArgument(0));
        when(repository.findByProjectIdAndAgentNameAndKind(anyString(), anyString(), any())).thenReturn(Optional.empty());
    }

    private static AgentContextDocument doc(Kind kind) {
        AgentContextDocument doc = new AgentContextDocument();
        doc.setProjectId("p-1");
        doc.setAgentName("architect");
        doc.setKind(kind);
        return doc;
    }

    private void stored(AgentContextDocument... docs) {
        when(repository.findByProjectIdAndAgentName(eq("p-1"), eq("architect"))).thenReturn(List.of(docs));
    }

    @Test
    void fullMode_rendersEverySection() {
        AgentContextDocument plan = doc(Kind.PLAN);
        plan.setContent("Design the event store first.");
        AgentContextDocument tasks = doc(Kind.TASK);
        tasks.setTasks(List.of(new TaskEntry(Instant.parse("2026-01-01T00:00:00Z"), "Schema", "Drafted tables")));
        AgentContextDocument todos = doc(Kind.TODO);
        todos.setTodos(List.of(new TodoItem("t1", "Pick a queue", TodoStatus.PENDING, CardPriority.LOW)));
        stored(plan, tasks, todos);

        String context = service.getTokenOptimizedContext("p-1", "architect", PromptMode.FULL);

        assertThat(context).contains("## Agent Plan\n\nDesign the event store first.");
        assertThat(context).contains("## Recent Tasks").contains("Schema").contains("Drafted tables");
        assertThat(context).contains("## Pending Items").contains("- [ ] LOW Pick a queue (id: t1)");
    }

    @Test
    void summaryMode_keepsLastThreeTasksAndOnlyUrgentTodos() {
        AgentContextDocument tasks = doc(Kind.TASK);
        List<TaskEntry> entries = new ArrayList<>();
        for (int i = 1; i <= 5; i++) {
            entries.add(new TaskEntry(Instant.now(), "Task " + i, null));
        }
        tasks.setTasks(entries);
        AgentContextDocument todos = doc(Kind.TODO);
        todos.setTodos(List.of(
                new TodoItem("a", "Low and open", TodoStatus.PENDING, CardPriority.LOW),
                new TodoItem("b", "Critical", TodoStatus.PENDING, CardPriority.CRITICAL),
                new TodoItem("c", "Working on it", TodoStatus.IN_PROGRESS, CardPriority.LOW),
                new TodoItem("d", "Done already", TodoStatus.COMPLETED, CardPriority.HIGH)));
        stored(tasks, todos);

        String context = service.getTokenOptimizedContext("p-1", "architect", PromptMode.SUMMARY);

        assertThat(context).contains("[2 earlier tasks omitted]");
        assertThat(context).contains("Task 3", "Task 4", "Task 5").doesNotContain("Task 1", "Task 2");
        assertThat(context).contains("Critical", "Working on it").doesNotContain("Low and open", "Done already");
    }

    @Test
    void nothingStored_rendersEmpty() {
        stored();
        assertThat(service.getTokenOptimizedContext("p-1", "architect", PromptMode.FULL)).isEmpty();
    }

    @Test
    void renderTodos_ordersInProgressFirstThenByPriority() {
        String rendered = AgentContextService.renderTodos(List.of(
                new TodoItem("1", "later", TodoStatus.PENDING, CardPriority.LOW),
                new TodoItem("2", "blocked", TodoStatus.BLOCKED, CardPriority.MEDIUM),
                new TodoItem("3", "now", TodoStatus.IN_PROGRESS, CardPriority.HIGH)));

        assertThat(rendered.indexOf("now")).isLessThan(rendered.indexOf("blocked"));
        assertThat(rendered.indexOf("blocked")).isLessThan(rendered.indexOf("later"));
        assertThat(rendered).contains("- [~] HIGH now (id: 3)").contains("- [!] MEDIUM blocked (id: 2)");
    }

    @Test
    void saveTodos_assignsMissingIdsAndCountsTokens() {
        AgentContextDocument saved = service.saveTodos("p-1", "architect",
                List.of(new TodoItem(null, "Write ADR", TodoStatus.PENDING, CardPriority.HIGH)));

        assertThat(saved.getKind()).isEqualTo(Kind.TODO);
        assertThat(saved.getTodos().get(0).getId()).hasSize(8);
        assertThat(saved.getTokenCount()).isPositive();
    }

    @Test
    void appendTask_addsToTheLog() {
        AgentContextDocument saved = service.appendTask("p-1", "architect", "Review", "Looked fine");

        assertThat(saved.getTasks()).extracting(TaskEntry::getTitle).containsExactly("Review");
    }
}
