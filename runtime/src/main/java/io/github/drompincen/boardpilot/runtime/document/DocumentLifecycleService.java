package io.github.drompincen.boardpilot.runtime.document;

import io.github.drompincen.boardpilot.persistence.document.BoardDocument;
import io.github.drompincen.boardpilot.persistence.document.CardDocument;
import io.github.drompincen.boardpilot.persistence.document.LaneDocument;
import io.github.drompincen.boardpilot.persistence.document.PlanningArtifactDocument;
import io.github.drompincen.boardpilot.persistence.document.PlanningRevisionDocument;
import io.github.drompincen.boardpilot.persistence.document.ProjectDocument;
import io.github.drompincen.boardpilot.persistence.document.ProjectTodoDocument;
import io.github.drompincen.boardpilot.persistence.repository.CardRepository;
import io.github.drompincen.boardpilot.persistence.repository.PlanningArtifactRepository;
import io.github.drompincen.boardpilot.persistence.repository.PlanningRevisionRepository;
import io.github.drompincen.boardpilot.persistence.repository.ProjectRepository;
import io.github.drompincen.boardpilot.persistence.repository.ProjectTodoRepository;
import io.github.drompincen.boardpilot.protocol.api.CardPriority;
import io.github.drompincen.boardpilot.protocol.api.CardStatus;
import io.github.drompincen.boardpilot.protocol.api.DocumentType;
import io.github.drompincen.boardpilot.protocol.api.GenerateDocumentRequest;
import io.github.drompincen.boardpilot.protocol.api.GeneratedDocumentDto;
import io.github.drompincen.boardpilot.protocol.api.PlanningDocumentDto;
import io.github.drompincen.boardpilot.protocol.api.PlanningPhase;
import io.github.drompincen.boardpilot.protocol.api.ReviewStatus;
import io.github.drompincen.boardpilot.runtime.NotFoundException;
import io.github.drompincen.boardpilot.runtime.agent.AgentDefinitions;
import io.github.drompincen.boardpilot.runtime.board.BoardService;
import io.github.drompincen.boardpilot.runtime.board.CardHistoryActions;
import io.github.drompincen.boardpilot.runtime.phase.ProjectPhaseService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Generates planning documents from the operator's phase answers and drives their review cards
 * through {@link ReviewCardStateMachine}.
 */
@Service
public class DocumentLifecycleService {

    private static final Logger log = LoggerFactory.getLogger(DocumentLifecycleService.class);

    static final String TODO_CATEGORY = "review";

    private final ProjectRepository projectRepository;
    private final PlanningArtifactRepository artifactRepository;
    private final PlanningRevisionRepository revisionRepository;
    private final ProjectTodoRepository todoRepository;
    private final CardRepository cardRepository;
    private final BoardService boardService;
    private final ReviewCardStateMachine stateMachine;
    private final ProjectPhaseService phaseService;
    private final DocumentFileSink fileSink;

    public DocumentLifecycleService(ProjectRepository projectRepository,
                                    PlanningArtifactRepository artifactRepository,
                                    PlanningRevisionRepository revisionRepository,
                                    ProjectTodoRepository todoRepository,
                                    CardRepository cardRepository,
                                    BoardService boardService,
                                    ReviewCardStateMachine stateMachine,
                                    ProjectPhaseService phaseService,
                                    DocumentFileSink fileSink) {
        this.projectRepository = projectRepository;
        this.artifactRepository = artifactRepository;
        this.revisionRepository = revisionRepository;
        this.todoRepository = todoRepository;
        this.cardRepository = cardRepository;
        this.boardService = boardService;
        this.stateMachine = stateMachine;
        this.phaseService = phaseService;
        this.fileSink = fileSink;
    }

    public GeneratedDocumentDto generate(GenerateDocumentRequest request) {
        if (request == null || request.projectId() == null) {
            throw new IllegalArgumentException("projectId is required");
        }
        DocumentType type = DocumentType.fromValue(request.documentType());
        if (type == null) {
            throw new IllegalArgumentException("documentType is required");
        }
        ProjectDocument project = requireProject(request.projectId());

        CardDocument card = request.shouldCreateReviewCard() ? findOrCreateReviewCard(project, type) : null;

        String content = DocumentTemplates.render(type, project.getName(), project.getPhaseResponses());
        PlanningArtifactDocument artifact = upsertArtifact(project.getProjectId(), type, content);

        String todoId = null;
        if (card != null) {
            card = openForReview(card);
            boardService.recordHistory(card.getCardId(), CardHistoryActions.DOCUMENT_GENERATED, null,
                    null, artifact.getVersion(), AgentDefinitions.CEO_COPILOT, null,
                    Map.<String, Object>of("documentType", type.value(), "version", artifact.getVersion()));
            if (request.shouldCreateTodo()) {
                todoId = upsertTodo(project.getProjectId(), card.getCardId(), type).getTodoId();
            }
        }

        String filePath = null;
        String fileError = null;
        if (project.getLocalPath() != null && !project.getLocalPath().isBlank()) {
            try {
                Path written = fileSink.write(project.getLocalPath(), type, content);
                filePath = written.toString();
            } catch (IOException | RuntimeException e) {
                log.warn("Could not write {} for project {}: {}", type.fileName(), project.getProjectId(), e.getMessage());
                fileError = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
            }
        }

        log.info("Generated {} v{} for project {}", type.displayName(), artifact.getVersion(), project.getProjectId());
        return new GeneratedDocumentDto(type, true, artifact.getVersion(),
                card == null ? null : card.getCardId(),
                card == null ? null : card.getReviewStatus(),
                todoId, filePath, fileError, null);
    }

    /**
     * Generates all four documents in order; one failing type does not stop the rest.
     * Leaves the project in the blueprint review phase.
     */
    public List<GeneratedDocumentDto> generateAll(String projectId) {
        requireProject(projectId);
        List<GeneratedDocumentDto> results = new ArrayList<>();
        for (DocumentType type : DocumentType.values()) {
            try {
                results.add(generate(new GenerateDocumentRequest(projectId, type)));
            } catch (RuntimeException e) {
                log.error("Generating {} for project {} failed: {}", type.displayName(), projectId, e.getMessage());
                results.add(GeneratedDocumentDto.failure(type, e.getMessage()));
            }
        }
        phaseService.advanceTo(projectId, PlanningPhase.BLUEPRINT_REVIEW);
        return results;
    }

    public CardDocument approve(String projectId, DocumentType type, String actor) {
        CardDocument card = requireReviewCard(projectId, type);
        CardDocument approved = stateMachine.transition(card, ReviewStatus.APPROVED, actorOrDefault(actor), null);
        Instant now = Instant.now();
        for (ProjectTodoDocument todo : todoRepository.findByCardId(approved.getCardId())) {
            if (!todo.isCompleted()) {
                todo.setCompleted(true);
                todo.setCompletedAt(now);
                todoRepository.save(todo);
            }
        }
        return approved;
    }

    public CardDocument reject(String projectId, DocumentType type, String actor, String reason) {
        CardDocument card = requireReviewCard(projectId, type);
        return stateMachine.transition(card, ReviewStatus.REJECTED, actorOrDefault(actor), reason);
    }

    public Optional<PlanningDocumentDto> getDocument(String projectId, DocumentType type) {
        return artifactRepository.findByProjectIdAndType(projectId, type).map(DocumentLifecycleService::toDto);
    }

    public List<PlanningDocumentDto> listDocuments(String projectId) {
        return artifactRepository.findByProjectId(projectId).stream().map(DocumentLifecycleService::toDto).toList();
    }

    /** Moves the card to IN_REVIEW, passing through PENDING unless it is already there. */
    private CardDocument openForReview(CardDocument card) {
        ReviewStatus current = ReviewCardStateMachine.currentStatus(card);
        if (current == ReviewStatus.IN_REVIEW) {
            return card;
        }
        CardDocument pending = current == ReviewStatus.PENDING ? card
                : stateMachine.transition(card, ReviewStatus.PENDING, AgentDefinitions.CEO_COPILOT, "Document generated");
        return stateMachine.transition(pending, ReviewStatus.IN_REVIEW, AgentDefinitions.CEO_COPILOT, "Document ready for review");
    }

    CardDocument findOrCreateReviewCard(ProjectDocument project, DocumentType type) {
        BoardDocument board = boardService.primaryBoard(project.getProjectId())
                .orElseThrow(() -> new IllegalStateException("Project " + project.getProjectId() + " has no board"));
        Optional<CardDocument> existing = findReviewCard(board.getBoardId(), project.getName(), type);
        if (existing.isPresent()) {
            CardDocument card = existing.get();
            if (card.getDocumentType() == null) {
                card.setDocumentType(type);
                card = boardService.save(card);
            }
            return card;
        }

        LaneDocument lane = boardService.findLane(board.getBoardId(), type.initialLane())
                .orElseThrow(() -> new IllegalStateException("Lane " + type.initialLane()
                        + " not found on board " + board.getBoardId()));
        CardDocument card = new CardDocument();
        card.setBoardId(board.getBoardId());
        card.setLaneId(lane.getLaneId());
        card.setTitle(type.reviewCardTitle());
        card.setDescription("Review and approve the " + type.displayName() + " document for " + project.getName() + ".");
        card.setType("doc");
        card.setPriority(CardPriority.HIGH);
        card.setAssignedAgent(AgentDefinitions.CEO_COPILOT);
        card.setStatus(CardStatus.PENDING);
        card.setReviewStatus(ReviewStatus.NONE);
        card.setDocumentType(type);
        card.setPosition(boardService.nextPosition(lane.getLaneId()));
        CardDocument saved = boardService.save(card);
        boardService.recordHistory(saved.getCardId(), CardHistoryActions.CREATED, null, null, saved.getTitle(),
                AgentDefinitions.CEO_COPILOT, "Review card for " + type.displayName(),
                Map.<String, Object>of("laneNumber", type.initialLane(), "documentType", type.value()));
        log.info("Created review card {} for {} on board {}", saved.getCardId(), type.displayName(), board.getBoardId());
        return saved;
    }

    private Optional<CardDocument> findReviewCard(String boardId, String projectName, DocumentType type) {
        Optional<CardDocument> tagged = cardRepository.findFirstByBoardIdAndDocumentType(boardId, type);
        if (tagged.isPresent()) {
            return tagged;
        }
        List<String> titles = new ArrayList<>();
        titles.add(type.reviewCardTitle());
        if (projectName != null) {
            titles.add(projectName + " - " + type.displayName());
        }
        titles.add(type.displayName());
        for (String title : titles) {
            Optional<CardDocument> match = cardRepository.findFirstByBoardIdAndTitleIgnoreCase(boardId, title);
            if (match.isPresent()) {
                return match;
            }
        }
        return Optional.empty();
    }

    private CardDocument requireReviewCard(String projectId, DocumentType type) {
        if (type == null) {
            throw new IllegalArgumentException("documentType is required");
        }
        ProjectDocument project = requireProject(projectId);
        BoardDocument board = boardService.primaryBoard(projectId)
                .orElseThrow(() -> new NotFoundException("Board for project", projectId));
        return findReviewCard(board.getBoardId(), project.getName(), type)
                .orElseThrow(() -> new NotFoundException("Review card", type.value()));
    }

    private PlanningArtifactDocument upsertArtifact(String projectId, DocumentType type, String content) {
        Instant now = Instant.now();
        PlanningArtifactDocument artifact = artifactRepository.findByProjectIdAndType(projectId, type)
                .orElseGet(() -> {
                    PlanningArtifactDocument fresh = new PlanningArtifactDocument();
                    fresh.setDocumentId(UUID.randomUUID().toString());
                    fresh.setProjectId(projectId);
                    fresh.setType(type);
                    fresh.setCreatedAt(now);
                    return fresh;
                });
        artifact.setContent(content);
        artifact.setVersion(artifact.getVersion() + 1);
        artifact.setUpdatedAt(now);
        PlanningArtifactDocument saved = artifactRepository.save(artifact);

        PlanningRevisionDocument revision = new PlanningRevisionDocument();
        revision.setRevisionId(UUID.randomUUID().toString());
        revision.setProjectId(projectId);
        revision.setType(type);
        revision.setVersion(saved.getVersion());
        revision.setContent(content);
        revision.setGeneratedBy(AgentDefinitions.CEO_COPILOT);
        revision.setCreatedAt(now);
        revisionRepository.save(revision);
        return saved;
    }

    private ProjectTodoDocument upsertTodo(String projectId, String cardId, DocumentType type) {
        ProjectTodoDocument todo = todoRepository.findFirstByProjectIdAndCardId(projectId, cardId)
                .orElseGet(() -> {
                    ProjectTodoDocument fresh = new ProjectTodoDocument();
                    fresh.setTodoId(UUID.randomUUID().toString());
                    fresh.setProjectId(projectId);
                    fresh.setCardId(cardId);
                    fresh.setCategory(TODO_CATEGORY);
                    fresh.setCreatedAt(Instant.now());
                    return fresh;
                });
        todo.setContent("Review " + type.displayName());
        todo.setCompleted(false);
        todo.setCompletedAt(null);
        return todoRepository.save(todo);
    }

    private ProjectDocument requireProject(String projectId) {
        if (projectId == null) {
            throw new IllegalArgumentException("projectId is required");
        }
        return projectRepository.findById(projectId).orElseThrow(() -> new NotFoundException("Project", projectId));
    }

    private static String actorOrDefault(String actor) {
        return actor == null || actor.isBlank() ? "user" : actor;
    }

    private static PlanningDocumentDto toDto(PlanningArtifactDocument d) {
        return new PlanningDocumentDto(d.getDocumentId(), d.getProjectId(), d.getType(), d.getContent(),
                d.getVersion(), d.getCreatedAt(), d.getUpdatedAt());
    }
}
