package io.github.drompincen.boardpilot.runtime.phase;

import io.github.drompincen.boardpilot.persistence.document.ProjectDocument;
import io.github.drompincen.boardpilot.persistence.repository.ProjectRepository;
import io.github.drompincen.boardpilot.protocol.api.PhaseStateDto;
import io.github.drompincen.boardpilot.protocol.api.PlanningPhase;
import io.github.drompincen.boardpilot.runtime.NotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Persists a project's planning phase and the operator's answers for each phase.
 */
@Service
public class ProjectPhaseService {

    private static final Logger log = LoggerFactory.getLogger(ProjectPhaseService.class);

    private final ProjectRepository projectRepository;

    public ProjectPhaseService(ProjectRepository projectRepository) {
        this.projectRepository = projectRepository;
    }

    public ProjectDocument advanceTo(String projectId, PlanningPhase phase) {
        ProjectDocument project = requireProject(projectId);
        PlanningPhase previous = project.getPhase();
        project.setPhase(phase);
        project.setUpdatedAt(Instant.now());
        ProjectDocument saved = projectRepository.save(project);
        log.info("Project {} phase {} -> {}", projectId, previous, phase);
        return saved;
    }

    public PhaseStateDto recordResponse(String projectId, PlanningPhase phase, String response) {
        if (phase == null) {
            throw new IllegalArgumentException("phase is required");
        }
        if (response == null || response.isBlank()) {
            throw new IllegalArgumentException("response is required");
        }
        ProjectDocument project = requireProject(projectId);
        Map<String, String> responses = project.getPhaseResponses() == null
                ? new LinkedHashMap<>() : new LinkedHashMap<>(project.getPhaseResponses());
        responses.put(phase.value(), response.trim());
        project.setPhaseResponses(responses);
        project.setUpdatedAt(Instant.now());
        projectRepository.save(project);
        log.info("Recorded {} response for project {}", phase, projectId);
        return toState(project);
    }

    public PhaseStateDto getState(String projectId) {
        return toState(requireProject(projectId));
    }

    public Map<String, String> responses(String projectId) {
        Map<String, String> responses = requireProject(projectId).getPhaseResponses();
        return responses == null ? Map.of() : responses;
    }

    private PhaseStateDto toState(ProjectDocument project) {
        PlanningPhase current = project.getPhase() == null ? PlanningPhase.WELCOME : project.getPhase();
        Map<String, String> responses = project.getPhaseResponses() == null ? Map.of() : project.getPhaseResponses();
        return new PhaseStateDto(project.getProjectId(), current, current.next().orElse(null), responses);
    }

    private ProjectDocument requireProject(String projectId) {
        if (projectId == null) {
            throw new IllegalArgumentException("projectId is required");
        }
        return projectRepository.findById(projectId)
                .orElseThrow(() -> new NotFoundException("Project", projectId));
    }
}
