package io.github.drompincen.boardpilot.runtime.agent;

import io.github.drompincen.boardpilot.persistence.document.AgentRunDocument;
import io.github.drompincen.boardpilot.persistence.document.BoardDocument;
import io.github.drompincen.boardpilot.persistence.document.CardDocument;
import io.github.drompincen.boardpilot.persistence.document.LaneDocument;
import io.github.drompincen.boardpilot.persistence.repository.AgentRunRepository;
import io.github.drompincen.boardpilot.protocol.api.AgentRunDto;
import io.github.drompincen.boardpilot.protocol.api.AgentRunStatus;
import io.github.drompincen.boardpilot.protocol.api.CardPriority;
import io.github.drompincen.boardpilot.protocol.api.ModelConfig;
import io.github.drompincen.boardpilot.protocol.api.TaskComplexity;
import io.github.drompincen.boardpilot.runtime.NotFoundException;
import io.github.drompincen.boardpilot.runtime.board.BoardService;
import io.github.drompincen.boardpilot.runtime.board.CardHistoryActions;
import io.github.drompincen.boardpilot.runtime.llm.ChatMessage;
import io.github.drompincen.boardpilot.runtime.llm.ExecutionContext;
import io.github.drompincen.boardpilot.runtime.llm.ExecutionGateway;
import io.github.drompincen.boardpilot.runtime.llm.ExecutionResult;
import io.github.drompincen.boardpilot.runtime.prompt.AgentContextService;
import io.github.drompincen.boardpilot.runtime.prompt.BuiltPrompt;
import io.github.drompincen.boardpilot.runtime.prompt.PromptBuilder;
import io.github.drompincen.boardpilot.runtime.prompt.PromptContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Runs one agent against one card: builds the card's prompt, calls the gateway and keeps an
 * {@link AgentRunDocument} of the outcome.
 */
@Service
public class AgentRunService {

    private static final Logger log = LoggerFactory.getLogger(AgentRunService.class);

    static final int TASK_SUMMARY_CHARS = 300;

    private final AgentRegistry agentRegistry;
    private final BoardService boardService;
    private final PromptBuilder promptBuilder;
    private final ExecutionGateway executionGateway;
    private final AgentContextService agentContextService;
    private final AgentRunRepository agentRunRepository;

    public AgentRunService(AgentRegistry agentRegistry, BoardService boardService, PromptBuilder promptBuilder,
                           ExecutionGateway executionGateway, AgentContextService agentContextService,
                           AgentRunRepository agentRunRepository) {
        this.agentRegistry = agentRegistry;
        this.boardService = boardService;
        this.promptBuilder = promptBuilder;
        this.executionGateway = executionGateway;
        this.agentContextService = agentContextService;
        this.agentRunRepository = agentRunRepository;
    }

    public AgentRunDto run(String cardId, String agentName, String userMessage) {
        if (cardId == null || cardId.isBlank()) {
            throw new IllegalArgumentException("cardId is required");
        }
        agentRegistry.require(agentName);
        CardDocument card = boardService.requireCard(cardId);
        LaneDocument lane = boardService.findLaneById(card.getLaneId())
                .orElseThrow(() -> new NotFoundException("Lane", card.getLaneId()));
        agentRegistry.checkLanePermission(agentName, lane.getLaneNumber());
        String projectId = boardService.findBoard(card.getBoardId()).map(BoardDocument::getProjectId).orElse(null);

        AgentRunDocument run = new AgentRunDocument();
        run.setRunId(UUID.randomUUID().toString());
        run.setCardId(cardId);
        run.setProjectId(projectId);
        run.setAgentName(agentName);
        run.setLaneNumber(lane.getLaneNumber());
        run.setStatus(AgentRunStatus.RUNNING);
        run.setStartedAt(Instant.now());
        agentRunRepository.save(run);
        log.info("Agent run {} started: {} on card {} (lane {})", run.getRunId(), agentName, cardId, lane.getLaneNumber());

        try {
            BuiltPrompt prompt = promptBuilder.buildPrompt(PromptContext.forCard(projectId, agentName, cardId),
                    complexityOf(card));
            StringBuilder user = new StringBuilder(prompt.userContext());
            if (userMessage != null && !userMessage.isBlank()) {
                user.append("\n\n---\n\n").append(userMessage);
            }
            List<ChatMessage> messages = List.of(ChatMessage.system(prompt.systemPrompt()),
                    ChatMessage.user(user.toString()));
            ExecutionContext context = new ExecutionContext(projectId, null, cardId, lane.getLaneNumber(), null, null);
            ExecutionResult result = executionGateway.converse(agentName, context, messages, ModelConfig.agentDefaults());

            run.setStatus(AgentRunStatus.COMPLETED);
            run.setOutput(result.content());
            run.setInputTokens(result.inputTokens());
            run.setOutputTokens(result.outputTokens());
            run.setCost(result.cost());
            run.setPrice(result.price());
            run.setFinishedAt(Instant.now());
            agentRunRepository.save(run);

            boardService.recordHistory(cardId, CardHistoryActions.AGENT_RUN, null, null, AgentRunStatus.COMPLETED,
                    agentName, null, Map.of("runId", run.getRunId()));
            if (projectId != null) {
                agentContextService.appendTask(projectId, agentName, card.getTitle(), summarize(result.content()));
            }
            log.info("Agent run {} completed ({} in / {} out)", run.getRunId(), result.inputTokens(), result.outputTokens());
            return toDto(run);
        } catch (RuntimeException e) {
            run.setStatus(AgentRunStatus.FAILED);
            run.setError(e.getMessage());
            run.setFinishedAt(Instant.now());
            agentRunRepository.save(run);
            log.error("Agent run {} failed: {}", run.getRunId(), e.getMessage());
            throw e;
        }
    }

    public List<AgentRunDto> runsForCard(String cardId) {
        return agentRunRepository.findByCardIdOrderByStartedAtDesc(cardId).stream().map(AgentRunService::toDto).toList();
    }

    static TaskComplexity complexityOf(CardDocument card) {
        if (card.getPriority() == CardPriority.CRITICAL) {
            return TaskComplexity.COMPLEX;
        }
        String description = card.getDescription();
        if (card.getPriority() == CardPriority.LOW && (description == null || description.length() < 500)) {
            return TaskComplexity.SIMPLE;
        }
        return TaskComplexity.MODERATE;
    }

    private static String summarize(String output) {
        String trimmed = output.strip();
        return trimmed.length() <= TASK_SUMMARY_CHARS ? trimmed : trimmed.substring(0, TASK_SUMMARY_CHARS) + "...";
    }

    static AgentRunDto toDto(AgentRunDocument r) {
        return new AgentRunDto(r.getRunId(), r.getCardId(), r.getProjectId(), r.getAgentName(), r.getLaneNumber(),
                r.getStatus(), r.getOutput(), r.getError(), r.getInputTokens(), r.getOutputTokens(),
                r.getCost(), r.getPrice(), r.getStartedAt(), r.getFinishedAt());
    }
}
