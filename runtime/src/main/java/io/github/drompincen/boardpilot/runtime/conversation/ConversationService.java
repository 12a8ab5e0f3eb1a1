package io.github.drompincen.boardpilot.runtime.conversation;

import io.github.drompincen.boardpilot.persistence.document.BoardDocument;
import io.github.drompincen.boardpilot.persistence.document.ConversationDocument;
import io.github.drompincen.boardpilot.persistence.document.MessageDocument;
import io.github.drompincen.boardpilot.persistence.repository.ConversationRepository;
import io.github.drompincen.boardpilot.persistence.repository.MessageRepository;
import io.github.drompincen.boardpilot.protocol.api.ActionSummary;
import io.github.drompincen.boardpilot.protocol.api.ConversationDto;
import io.github.drompincen.boardpilot.protocol.api.ConversationStatus;
import io.github.drompincen.boardpilot.protocol.api.ConversationStreamEvent;
import io.github.drompincen.boardpilot.protocol.api.ConversationTurnRequest;
import io.github.drompincen.boardpilot.protocol.api.ConversationTurnResponse;
import io.github.drompincen.boardpilot.protocol.api.CreateConversationRequest;
import io.github.drompincen.boardpilot.protocol.api.GeneratedDocumentDto;
import io.github.drompincen.boardpilot.protocol.api.MessageDto;
import io.github.drompincen.boardpilot.protocol.api.ModelConfig;
import io.github.drompincen.boardpilot.protocol.api.PlanningPhase;
import io.github.drompincen.boardpilot.protocol.api.TaskComplexity;
import io.github.drompincen.boardpilot.runtime.NotFoundException;
import io.github.drompincen.boardpilot.runtime.action.ActionExecutor;
import io.github.drompincen.boardpilot.runtime.action.ActionParser;
import io.github.drompincen.boardpilot.runtime.action.ParsedReply;
import io.github.drompincen.boardpilot.runtime.agent.AgentDefinitions;
import io.github.drompincen.boardpilot.runtime.board.BoardService;
import io.github.drompincen.boardpilot.runtime.document.DocumentLifecycleService;
import io.github.drompincen.boardpilot.runtime.llm.ChatMessage;
import io.github.drompincen.boardpilot.runtime.llm.ExecutionContext;
import io.github.drompincen.boardpilot.runtime.llm.ExecutionGateway;
import io.github.drompincen.boardpilot.runtime.llm.ExecutionResult;
import io.github.drompincen.boardpilot.runtime.phase.PhaseStateMachine;
import io.github.drompincen.boardpilot.runtime.phase.PhaseTransition;
import io.github.drompincen.boardpilot.runtime.phase.ProjectPhaseService;
import io.github.drompincen.boardpilot.runtime.prompt.BuiltPrompt;
import io.github.drompincen.boardpilot.runtime.prompt.PromptBuilder;
import io.github.drompincen.boardpilot.runtime.prompt.PromptContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * One planning conversation turn: prompt, model call, directive execution, phase evaluation.
 */
@Service
public class ConversationService {

    private static final Logger log = LoggerFactory.getLogger(ConversationService.class);

    static final int HISTORY_LIMIT = 20;
    static final int RESPONSE_EXCERPT_CHARS = 200;
    static final String DEFAULT_CONTEXT = "planning";

    private final ConversationRepository conversationRepository;
    private final MessageRepository messageRepository;
    private final PromptBuilder promptBuilder;
    private final ExecutionGateway executionGateway;
    private final ActionParser actionParser;
    private final ActionExecutor actionExecutor;
    private final BoardService boardService;
    private final PhaseStateMachine phaseStateMachine;
    private final ProjectPhaseService projectPhaseService;
    private final DocumentLifecycleService documentLifecycleService;
    private final ModelConfig chatConfig;

    public ConversationService(ConversationRepository conversationRepository,
                               MessageRepository messageRepository,
                               PromptBuilder promptBuilder,
                               ExecutionGateway executionGateway,
                               ActionParser actionParser,
                               ActionExecutor actionExecutor,
                               BoardService boardService,
                               PhaseStateMachine phaseStateMachine,
                               ProjectPhaseService projectPhaseService,
                               DocumentLifecycleService documentLifecycleService,
                               @Value("${boardpilot.chat.temperature:0.7}") double temperature,
                               @Value("${boardpilot.chat.max-tokens:2048}") int maxTokens) {
        this.conversationRepository = conversationRepository;
        this.messageRepository = messageRepository;
        this.promptBuilder = promptBuilder;
        this.executionGateway = executionGateway;
        this.actionParser = actionParser;
        this.actionExecutor = actionExecutor;
        this.boardService = boardService;
        this.phaseStateMachine = phaseStateMachine;
        this.projectPhaseService = projectPhaseService;
        this.documentLifecycleService = documentLifecycleService;
        this.chatConfig = new ModelConfig(null, temperature, maxTokens);
    }

    /** State shared between the model call and the post-processing of one turn. */
    private record Turn(ConversationDocument conversation, ConversationTurnRequest request,
                        PlanningPhase phase, List<ChatMessage> messages) {}

    public ConversationTurnResponse handleTurn(String tenantId, ConversationTurnRequest request) {
        Turn turn = prepare(tenantId, request);
        ExecutionResult result = executionGateway.converse(AgentDefinitions.CEO_COPILOT, contextOf(turn),
                turn.messages(), chatConfig);
        return complete(turn, result.content());
    }

    /**
     * Streams the reply as {@code chunk} events followed by one {@code complete} event. Nothing is
     * persisted after the subscription is cancelled.
     */
    public Flux<ConversationStreamEvent> streamTurn(String tenantId, ConversationTurnRequest request) {
        return Flux.defer(() -> {
            Turn turn = prepare(tenantId, request);
            return executionGateway.streamConverse(AgentDefinitions.CEO_COPILOT, contextOf(turn),
                            turn.messages(), chatConfig)
                    .concatMap(chunk -> chunk.done()
                            ? Mono.fromCallable(() -> ConversationStreamEvent.complete(
                                    complete(turn, chunk.result().content())))
                            : Mono.just(ConversationStreamEvent.chunk(chunk.content())));
        });
    }

    private Turn prepare(String tenantId, ConversationTurnRequest request) {
        if (request == null || request.message() == null || request.message().isBlank()) {
            throw new IllegalArgumentException("message is required");
        }
        PlanningPhase phase = resolvePhase(request);
        ConversationDocument existing = existingConversation(tenantId, request);
        String systemPrompt = systemPrompt(request, phase);

        ConversationDocument conversation = existing != null ? existing
                : newConversation(tenantId, contextLabel(request.context()), request.projectId(), request.cardId(), null);
        List<MessageDocument> history = existing != null
                ? messageRepository.findByConversationIdOrderBySeqAsc(conversation.getConversationId())
                : List.of();

        List<ChatMessage> messages = new ArrayList<>();
        messages.add(ChatMessage.system(systemPrompt));
        int from = Math.max(0, history.size() - HISTORY_LIMIT);
        for (MessageDocument message : history.subList(from, history.size())) {
            messages.add(ChatMessage.of(message.getRole(), message.getContent()));
        }
        messages.add(ChatMessage.user(request.message()));

        appendMessage(conversation, "user", request.message(), request.metadata());
        return new Turn(conversation, request, phase, messages);
    }

    private ConversationTurnResponse complete(Turn turn, String reply) {
        ConversationTurnRequest request = turn.request();
        ParsedReply parsed = actionParser.parse(reply);
        ActionSummary actions = executeActions(parsed, request.projectId());

        MessageDocument saved = appendMessage(turn.conversation(), "assistant", parsed.cleanedText(), null);

        PhaseTransition transition = phaseStateMachine.evaluate(turn.phase(), parsed.cleanedText());
        List<GeneratedDocumentDto> documents = List.of();
        if (transition.advances() && request.projectId() != null) {
            documents = advance(request.projectId(), transition.nextPhase());
        }
        return new ConversationTurnResponse(turn.conversation().getConversationId(), saved.getMessageId(),
                parsed.cleanedText(), transition.currentPhase(), transition.nextPhase(),
                transition.phaseComplete(), actions, documents);
    }

    private ActionSummary executeActions(ParsedReply parsed, String projectId) {
        if (parsed.actions().isEmpty()) {
            return ActionSummary.empty();
        }
        try {
            String boardId = boardService.primaryBoard(projectId).map(BoardDocument::getBoardId).orElse(null);
            ActionSummary summary = actionExecutor.execute(parsed.actions(), projectId, boardId);
            log.info("Executed {} actions: {} created, {} moved, {} updated, {} errors", parsed.actions().size(),
                    summary.cardsCreated().size(), summary.cardsMoved().size(), summary.cardsUpdated().size(),
                    summary.errors().size());
            return summary;
        } catch (RuntimeException e) {
            log.error("Action execution failed for project {}: {}", projectId, e.getMessage());
            return ActionSummary.failed("Action execution failed: " + e.getMessage());
        }
    }

    private List<GeneratedDocumentDto> advance(String projectId, PlanningPhase next) {
        try {
            projectPhaseService.advanceTo(projectId, next);
            if (next == PlanningPhase.BLUEPRINT_REVIEW) {
                return documentLifecycleService.generateAll(projectId);
            }
        } catch (RuntimeException e) {
            log.error("Could not advance project {} to {}: {}", projectId, next, e.getMessage());
        }
        return List.of();
    }

    /** The caller owns the phase; a turn without one starts at welcome. */
    private PlanningPhase resolvePhase(ConversationTurnRequest request) {
        if (request.phase() != null && !request.phase().isBlank()) {
            return PlanningPhase.fromValue(request.phase());
        }
        return PlanningPhase.WELCOME;
    }

    private String systemPrompt(ConversationTurnRequest request, PlanningPhase phase) {
        PromptContext promptContext = new PromptContext(request.projectId(), AgentDefinitions.CEO_COPILOT,
                request.cardId(), null, null, null);
        BuiltPrompt built = promptBuilder.buildPrompt(promptContext, TaskComplexity.MODERATE);

        StringBuilder prompt = new StringBuilder(built.systemPrompt());
        prompt.append(PromptBuilder.SECTION_SEPARATOR).append(CopilotInstructions.TEXT);
        prompt.append(PromptBuilder.SECTION_SEPARATOR)
                .append("Current Context: ").append(contextLabel(request.context())).append('\n')
                .append("Current Planning Phase: ").append(phase.value());

        String guidance = phaseStateMachine.guidanceFor(phase);
        if (guidance != null && !guidance.isBlank()) {
            prompt.append("\n\n## Phase Guidance\n\n").append(guidance);
        }
        String previous = previousResponses(request.projectId());
        if (!previous.isEmpty()) {
            prompt.append("\n\n## What We Have Discussed\n\n").append(previous);
        }
        if (built.userContext() != null && !built.userContext().isBlank()) {
            prompt.append(PromptBuilder.SECTION_SEPARATOR).append(built.userContext());
        }
        return prompt.toString();
    }

    private String previousResponses(String projectId) {
        if (projectId == null) {
            return "";
        }
        Map<String, String> responses;
        try {
            responses = projectPhaseService.responses(projectId);
        } catch (RuntimeException e) {
            log.warn("Omitting previous responses for project {}: {}", projectId, e.getMessage());
            return "";
        }
        StringBuilder out = new StringBuilder();
        for (Map.Entry<String, String> entry : responses.entrySet()) {
            String response = entry.getValue();
            if (response.length() > RESPONSE_EXCERPT_CHARS) {
                response = response.substring(0, RESPONSE_EXCERPT_CHARS) + "...";
            }
            out.append("- ").append(entry.getKey()).append(": ").append(response).append('\n');
        }
        return out.toString().stripTrailing();
    }

    // --- conversations ---

    public ConversationDto createConversation(String tenantId, CreateConversationRequest request) {
        String context = request == null ? null : request.context();
        ConversationDocument conversation = newConversation(tenantId, contextLabel(context),
                request == null ? null : request.projectId(),
                request == null ? null : request.cardId(),
                request == null ? null : request.title());
        return toDto(conversation, List.of());
    }

    public List<ConversationDto> listConversations(String tenantId) {
        return conversationRepository.findTop20ByTenantIdAndStatusOrderByUpdatedAtDesc(tenantId, ConversationStatus.ACTIVE)
                .stream().map(c -> toDto(c, null)).toList();
    }

    public ConversationDto getConversation(String tenantId, String conversationId) {
        ConversationDocument conversation = requireConversation(tenantId, conversationId);
        List<MessageDto> messages = messageRepository.findByConversationIdOrderBySeqAsc(conversationId).stream()
                .map(ConversationService::toDto).toList();
        return toDto(conversation, messages);
    }

    public ConversationDto closeConversation(String tenantId, String conversationId) {
        ConversationDocument conversation = requireConversation(tenantId, conversationId);
        conversation.setStatus(ConversationStatus.CLOSED);
        conversation.setUpdatedAt(Instant.now());
        ConversationDocument saved = conversationRepository.save(conversation);
        log.info("Closed conversation {}", conversationId);
        return toDto(saved, null);
    }

    /** The open conversation the turn continues, or null when the turn starts a new one. */
    private ConversationDocument existingConversation(String tenantId, ConversationTurnRequest request) {
        if (request.conversationId() == null || request.conversationId().isBlank()) {
            return null;
        }
        ConversationDocument conversation = requireConversation(tenantId, request.conversationId());
        if (conversation.getStatus() == ConversationStatus.CLOSED) {
            throw new IllegalStateException("Conversation is closed: " + conversation.getConversationId());
        }
        return conversation;
    }

    private ConversationDocument requireConversation(String tenantId, String conversationId) {
        return conversationRepository.findById(conversationId)
                .filter(c -> c.getTenantId() != null && c.getTenantId().equals(tenantId))
                .orElseThrow(() -> new NotFoundException("Conversation", conversationId));
    }

    private ConversationDocument newConversation(String tenantId, String context, String projectId,
                                                 String cardId, String title) {
        ConversationDocument conversation = new ConversationDocument();
        conversation.setConversationId(UUID.randomUUID().toString());
        conversation.setTenantId(tenantId);
        conversation.setProjectId(projectId);
        conversation.setCardId(cardId);
        conversation.setContext(context);
        conversation.setTitle(title != null && !title.isBlank() ? title : context + " conversation");
        conversation.setStatus(ConversationStatus.ACTIVE);
        conversation.setCreatedAt(Instant.now());
        conversation.setUpdatedAt(Instant.now());
        ConversationDocument saved = conversationRepository.save(conversation);
        log.info("Created conversation {} for tenant {}", saved.getConversationId(), tenantId);
        return saved;
    }

    private MessageDocument appendMessage(ConversationDocument conversation, String role, String content,
                                          Map<String, Object> metadata) {
        MessageDocument message = new MessageDocument();
        message.setMessageId(UUID.randomUUID().toString());
        message.setConversationId(conversation.getConversationId());
        message.setSeq(messageRepository.countByConversationId(conversation.getConversationId()) + 1);
        message.setRole(role);
        message.setContent(content);
        message.setMetadata(metadata);
        message.setTimestamp(Instant.now());
        MessageDocument saved = messageRepository.save(message);
        conversation.setUpdatedAt(Instant.now());
        conversationRepository.save(conversation);
        return saved;
    }

    private static ExecutionContext contextOf(Turn turn) {
        return ExecutionContext.forConversation(turn.request().projectId(), turn.conversation().getConversationId());
    }

    private static String contextLabel(String context) {
        return context == null || context.isBlank() ? DEFAULT_CONTEXT : context;
    }

    private static ConversationDto toDto(ConversationDocument c, List<MessageDto> messages) {
        return new ConversationDto(c.getConversationId(), c.getTenantId(), c.getProjectId(), c.getCardId(),
                c.getContext(), c.getTitle(), c.getStatus(), messages, c.getCreatedAt(), c.getUpdatedAt());
    }

    private static MessageDto toDto(MessageDocument m) {
        return new MessageDto(m.getMessageId(), m.getConversationId(), m.getSeq(), m.getRole(), m.getContent(),
                m.getMetadata(), m.getTimestamp());
    }
}
