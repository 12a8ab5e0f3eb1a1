package io.github.drompincen.boardpilot.runtime.phase;

import io.github.drompincen.boardpilot.persistence.document.ProjectDocument;
import io.github.drompincen.boardpilot.persistence.repository.ProjectRepository;
import io.github.drompincen.boardpilot.protocol.api.PhaseStateDto;
import io.github.drompincen.boardpilot.protocol.api.PlanningPhase;
import io.github.drompincen.boardpilot.runtime.NotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class ProjectPhaseServiceTest {

    @Mock private ProjectRepository projectRepository;

    private ProjectPhaseService service;
    private ProjectDocument project;

    @BeforeEach
    void setUp() {
        service = new ProjectPhaseService(projectRepository);
        project = new ProjectDocument();
        project.setProjectId("p-1");
        project.setName("Atlas");
        when(projectRepository.findById("p-1")).thenReturn(Optional.of(project));
        when(projectRepository.findById("missing")).thenReturn(Optional.empty());
        when(projectRepository.save(any(ProjectDocument.class))).thenAnswer(inv -> inv.getArgument(0));
    }

    @Test
    void unsetPhase_readsAsWelcome() {
        assertThat(service.getState("p-1").currentPhase()).isEqualTo(PlanningPhase.WELCOME);
        assertThat(service.getState("p-1").nextPhase()).isEqualTo(PlanningPhase.VISION);
    }

    @Test
    void advanceTo_persistsPhase() {
        service.advanceTo("p-1", PlanningPhase.GOALS);

        assertThat(project.getPhase()).isEqualTo(PlanningPhase.GOALS);
        assertThat(project.getUpdatedAt()).isNotNull();
        assertThat(service.getState("p-1").currentPhase()).isEqualTo(PlanningPhase.GOALS);
    }

    @Test
    void recordResponse_storesTrimmedAnswerUnderPhaseValue() {
        PhaseStateDto state = service.recordResponse("p-1", PlanningPhase.BLUEPRINT_REVIEW, "  looks good  ");

        assertThat(state.responses()).containsEntry("blueprint-review", "looks good");
        assertThat(service.responses("p-1")).containsEntry("blueprint-review", "looks good");
    }

    @Test
    void recordResponse_requiresPhaseAndText() {
        assertThatThrownBy(() -> service.recordResponse("p-1", null, "x"))
                .isInstanceOf(IllegalArgumentException.class).hasMessage("phase is required");
        assertThatThrownBy(() -> service.recordResponse("p-1", PlanningPhase.VISION, " "))
                .isInstanceOf(IllegalArgumentException.class).hasMessage("response is required");
    }

    @Test
    void terminalPhase_hasNoNext() {
        project.setPhase(PlanningPhase.PLANNING_COMPLETE);

        assertThat(service.getState("p-1").nextPhase()).isNull();
    }

    @Test
    void unknownProject_isNotFound() {
        assertThatThrownBy(() -> service.getState("missing"))
                .isInstanceOf(NotFoundException.class)
                .hasMessage("Project not found: missing");
    }
}
