package io.github.drompincen.boardpilot.runtime.prompt;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.boardpilot.persistence.document.CardDocument;
import io.github.drompincen.boardpilot.persistence.document.LaneDocument;
import io.github.drompincen.boardpilot.persistence.document.PlanningArtifactDocument;
import io.github.drompincen.boardpilot.persistence.document.ProjectDocument;
import io.github.drompincen.boardpilot.persistence.repository.CardRepository;
import io.github.drompincen.boardpilot.persistence.repository.LaneRepository;
import io.github.drompincen.boardpilot.persistence.repository.PlanningArtifactRepository;
import io.github.drompincen.boardpilot.persistence.repository.ProjectRepository;
import io.github.drompincen.boardpilot.protocol.api.DocumentType;
import io.github.drompincen.boardpilot.protocol.api.TaskComplexity;
import io.github.drompincen.boardpilot.runtime.agent.AgentDefinition;
import io.github.drompincen.boardpilot.runtime.agent.AgentRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Assembles an agent's system prompt and user context under a per-section token budget.
 * A section whose source fails is logged and left out; an unknown agent is an error.
 */
@Service
public class PromptBuilder {

    private static final Logger log = LoggerFactory.getLogger(PromptBuilder.class);

    public static final String SECTION_SEPARATOR = "\n\n---\n\n";
    private static final Set<DocumentType> CONTEXT_DOCUMENTS = Set.of(DocumentType.BLUEPRINT, DocumentType.PRD, DocumentType.MVP);

    private final AgentRegistry agentRegistry;
    private final StyleGuideService styleGuideService;
    private final AgentContextService agentContextService;
    private final ProjectRepository projectRepository;
    private final PlanningArtifactRepository planningArtifactRepository;
    private final CardRepository cardRepository;
    private final LaneRepository laneRepository;
    private final ObjectMapper objectMapper;

    public PromptBuilder(AgentRegistry agentRegistry,
                         StyleGuideService styleGuideService,
                         AgentContextService agentContextService,
                         ProjectRepository projectRepository,
                         PlanningArtifactRepository planningArtifactRepository,
                         CardRepository cardRepository,
                         LaneRepository laneRepository,
                         ObjectMapper objectMapper) {
        this.agentRegistry = agentRegistry;
        this.styleGuideService = styleGuideService;
        this.agentContextService = agentContextService;
        this.projectRepository = projectRepository;
        this.planningArtifactRepository = planningArtifactRepository;
        this.cardRepository = cardRepository;
        this.laneRepository = laneRepository;
        this.objectMapper = objectMapper;
    }

    public BuiltPrompt buildPrompt(PromptContext context, TaskComplexity complexity) {
        PromptMode mode = PromptMode.forComplexity(complexity);
        TokenBudget budget = TokenBudget.forMode(mode);
        log.info("Building prompt for agent {} in project {} (mode={}, complexity={})",
                context.agentName(), context.projectId(), mode, complexity);

        String systemPrompt = buildSystemPrompt(context.agentName(), context.projectId(), budget);
        String userContext = buildUserContext(context, budget);
        int total = TokenEstimator.estimate(systemPrompt) + TokenEstimator.estimate(userContext);
        return new BuiltPrompt(systemPrompt, userContext, total, mode);
    }

    String buildSystemPrompt(String agentName, String projectId, TokenBudget budget) {
        AgentDefinition agent = agentRegistry.require(agentName);
        StringBuilder prompt = new StringBuilder(TokenEstimator.truncate(agent.systemPrompt(), budget.systemPrompt()));

        styleGuideSection(projectId, budget.styleGuide())
                .ifPresent(section -> prompt.append("\n\n").append(section));
        agentContextSection(projectId, agentName, budget)
                .ifPresent(section -> prompt.append("\n\n").append(section));
        return prompt.toString();
    }

    String buildUserContext(PromptContext context, TokenBudget budget) {
        List<String> sections = new ArrayList<>();
        projectSection(context.projectId(), budget.projectContext()).ifPresent(sections::add);

        if (context.cardId() != null) {
            cardSection(context.cardId(), budget.cardContext()).ifPresent(sections::add);
        } else if (context.cardTitle() != null) {
            sections.add("## Current Task\n\n**" + context.cardTitle() + "**\n\n"
                    + (context.cardDescription() == null ? "" : context.cardDescription()));
        }

        if (context.additionalContext() != null && !context.additionalContext().isEmpty()) {
            try {
                sections.add("## Additional Context\n\n"
                        + objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(context.additionalContext()));
            } catch (JsonProcessingException e) {
                log.warn("Omitting additional context: {}", e.getMessage());
            }
        }
        return String.join(SECTION_SEPARATOR, sections);
    }

    private Optional<String> styleGuideSection(String projectId, int maxTokens) {
        try {
            return styleGuideService.getStyleGuide(projectId)
                    .map(styleGuideService::formatForPrompt)
                    .map(formatted -> TokenEstimator.truncate(formatted, maxTokens));
        } catch (RuntimeException e) {
            log.warn("Omitting style guide for project {}: {}", projectId, e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<String> agentContextSection(String projectId, String agentName, TokenBudget budget) {
        if (projectId == null) {
            return Optional.empty();
        }
        try {
            String content = agentContextService.getTokenOptimizedContext(projectId, agentName, budget.agentContextMode());
            if (content == null || content.isBlank()) {
                return Optional.empty();
            }
            return Optional.of("## Your Current Context\n\n" + content);
        } catch (RuntimeException e) {
            log.warn("Omitting agent context for {} in project {}: {}", agentName, projectId, e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<String> projectSection(String projectId, int maxTokens) {
        if (projectId == null) {
            return Optional.empty();
        }
        try {
            Optional<ProjectDocument> found = projectRepository.findById(projectId);
            if (found.isEmpty()) {
                return Optional.empty();
            }
            ProjectDocument project = found.get();
            List<String> lines = new ArrayList<>();
            lines.add("## Project: " + project.getName());
            lines.add("- **Status**: " + project.getStatus());
            lines.add("- **Phase**: " + (project.getPhase() == null ? "welcome" : project.getPhase().value()));

            List<PlanningArtifactDocument> docs = planningArtifactRepository.findByProjectId(projectId).stream()
                    .filter(d -> CONTEXT_DOCUMENTS.contains(d.getType()))
                    .sorted(Comparator.comparing(PlanningArtifactDocument::getType))
                    .toList();

            int remaining = maxTokens - TokenEstimator.estimate(String.join("\n", lines));
            for (PlanningArtifactDocument doc : docs) {
                int docTokens = Math.floorDiv(remaining, docs.size());
                String excerpt = TokenEstimator.truncate(doc.getContent(), docTokens);
                if (!excerpt.isEmpty()) {
                    lines.add("\n### " + doc.getType().name() + " (v" + doc.getVersion() + ")\n\n" + excerpt);
                    remaining -= TokenEstimator.estimate(excerpt);
                }
            }
            return Optional.of(String.join("\n", lines));
        } catch (RuntimeException e) {
            log.warn("Omitting project context for {}: {}", projectId, e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<String> cardSection(String cardId, int maxTokens) {
        try {
            Optional<CardDocument> found = cardRepository.findById(cardId);
            if (found.isEmpty()) {
                return Optional.empty();
            }
            CardDocument card = found.get();
            Optional<LaneDocument> lane = card.getLaneId() == null ? Optional.empty() : laneRepository.findById(card.getLaneId());

            List<String> lines = new ArrayList<>();
            lines.add("## Current Card");
            lines.add("- **Title**: " + card.getTitle());
            lines.add("- **Type**: " + card.getType());
            lines.add("- **Priority**: " + card.getPriority());
            lines.add("- **Status**: " + card.getStatus());
            lane.ifPresent(l -> lines.add("- **Lane**: " + l.getName() + " (" + l.getLaneNumber() + ")"));

            if (card.getDescription() != null && !card.getDescription().isBlank()) {
                lines.add("\n### Description\n\n" + card.getDescription());
            }
            if (card.getParentCardId() != null) {
                cardRepository.findById(card.getParentCardId()).ifPresent(parent ->
                        lines.add("\n### Parent Card\n- " + parent.getType() + ": " + parent.getTitle()));
            }
            List<CardDocument> children = cardRepository.findByParentCardId(cardId);
            if (!children.isEmpty()) {
                lines.add("\n### Child Cards");
                for (CardDocument child : children) {
                    lines.add("- [" + child.getStatus() + "] " + child.getType() + ": " + child.getTitle());
                }
            }
            return Optional.of(TokenEstimator.truncate(String.join("\n", lines), maxTokens));
        } catch (RuntimeException e) {
            log.warn("Omitting card context for {}: {}", cardId, e.getMessage());
            return Optional.empty();
        }
    }
}
