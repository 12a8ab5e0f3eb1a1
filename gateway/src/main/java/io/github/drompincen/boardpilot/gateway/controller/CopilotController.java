package io.github.drompincen.boardpilot.gateway.controller;

import io.github.drompincen.boardpilot.persistence.document.CardDocument;
import io.github.drompincen.boardpilot.protocol.api.ConversationStreamEvent;
import io.github.drompincen.boardpilot.protocol.api.ConversationTurnRequest;
import io.github.drompincen.boardpilot.protocol.api.CreateConversationRequest;
import io.github.drompincen.boardpilot.protocol.api.DocumentType;
import io.github.drompincen.boardpilot.protocol.api.GenerateDocumentRequest;
import io.github.drompincen.boardpilot.protocol.api.PhaseResponseRequest;
import io.github.drompincen.boardpilot.protocol.api.PlanningPhase;
import io.github.drompincen.boardpilot.protocol.api.ReviewDecisionRequest;
import io.github.drompincen.boardpilot.runtime.board.BoardService;
import io.github.drompincen.boardpilot.runtime.conversation.ConversationService;
import io.github.drompincen.boardpilot.runtime.document.DocumentLifecycleService;
import io.github.drompincen.boardpilot.runtime.phase.ProjectPhaseService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;

import java.util.Map;

/**
 * CEO copilot endpoints: conversation turns (plain and streamed), conversation CRUD,
 * phase responses and the planning document review cycle.
 */
@RestController
@RequestMapping("/api/copilot")
public class CopilotController {

    private static final Logger log = LoggerFactory.getLogger(CopilotController.class);

    static final String TENANT_HEADER = "X-Tenant-Id";
    static final String DEFAULT_TENANT = "default";

    private final ConversationService conversationService;
    private final ProjectPhaseService phaseService;
    private final DocumentLifecycleService documentService;

    public CopilotController(ConversationService conversationService,
                             ProjectPhaseService phaseService,
                             DocumentLifecycleService documentService) {
        this.conversationService = conversationService;
        this.phaseService = phaseService;
        this.documentService = documentService;
    }

    // ---- conversation turns ----

    @PostMapping("/chat")
    public ResponseEntity<?> chat(@RequestHeader(value = TENANT_HEADER, defaultValue = DEFAULT_TENANT) String tenantId,
                                  @RequestBody ConversationTurnRequest request) {
        try {
            return ResponseEntity.ok(conversationService.handleTurn(tenantId, request));
        } catch (RuntimeException e) {
            return ApiErrors.toResponse(e);
        }
    }

    @PostMapping(value = "/chat/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<ConversationStreamEvent>> chatStream(
            @RequestHeader(value = TENANT_HEADER, defaultValue = DEFAULT_TENANT) String tenantId,
            @RequestBody ConversationTurnRequest request) {
        return conversationService.streamTurn(tenantId, request)
                .onErrorResume(e -> {
                    log.warn("Streamed turn failed: {}", e.getMessage());
                    return Flux.just(ConversationStreamEvent.error(ApiErrors.messageOf(e)));
                })
                .map(event -> ServerSentEvent.<ConversationStreamEvent>builder()
                        .event(event.event())
                        .data(event)
                        .build());
    }

    // ---- conversations ----

    @GetMapping("/conversations")
    public ResponseEntity<?> listConversations(
            @RequestHeader(value = TENANT_HEADER, defaultValue = DEFAULT_TENANT) String tenantId) {
        return ResponseEntity.ok(conversationService.listConversations(tenantId));
    }

    @PostMapping("/conversations")
    public ResponseEntity<?> createConversation(
            @RequestHeader(value = TENANT_HEADER, defaultValue = DEFAULT_TENANT) String tenantId,
            @RequestBody(required = false) CreateConversationRequest request) {
        try {
            return ResponseEntity.ok(conversationService.createConversation(tenantId, request));
        } catch (RuntimeException e) {
            return ApiErrors.toResponse(e);
        }
    }

    @GetMapping("/conversations/{conversationId}")
    public ResponseEntity<?> getConversation(
            @RequestHeader(value = TENANT_HEADER, defaultValue = DEFAULT_TENANT) String tenantId,
            @PathVariable String conversationId) {
        try {
            return ResponseEntity.ok(conversationService.getConversation(tenantId, conversationId));
        } catch (RuntimeException e) {
            return ApiErrors.toResponse(e);
        }
    }

    @DeleteMapping("/conversations/{conversationId}")
    public ResponseEntity<?> closeConversation(
            @RequestHeader(value = TENANT_HEADER, defaultValue = DEFAULT_TENANT) String tenantId,
            @PathVariable String conversationId) {
        try {
            return ResponseEntity.ok(conversationService.closeConversation(tenantId, conversationId));
        } catch (RuntimeException e) {
            return ApiErrors.toResponse(e);
        }
    }

    // ---- phases ----

    @PostMapping("/phase")
    public ResponseEntity<?> recordPhaseResponse(@RequestBody PhaseResponseRequest request) {
        if (request == null || request.projectId() == null || request.projectId().isBlank()) {
            return ApiErrors.badRequest("projectId is required");
        }
        try {
            PlanningPhase phase = PlanningPhase.fromValue(request.phase());
            return ResponseEntity.ok(phaseService.recordResponse(request.projectId(), phase, request.response()));
        } catch (RuntimeException e) {
            return ApiErrors.toResponse(e);
        }
    }

    @GetMapping("/phase/{projectId}")
    public ResponseEntity<?> getPhase(@PathVariable String projectId) {
        try {
            return ResponseEntity.ok(phaseService.getState(projectId));
        } catch (RuntimeException e) {
            return ApiErrors.toResponse(e);
        }
    }

    // ---- documents ----

    @PostMapping("/generate")
    public ResponseEntity<?> generate(@RequestBody GenerateDocumentRequest request) {
        try {
            return ResponseEntity.ok(documentService.generate(request));
        } catch (RuntimeException e) {
            return ApiErrors.toResponse(e);
        }
    }

    @PostMapping("/generate-all")
    public ResponseEntity<?> generateAll(@RequestBody Map<String, String> body) {
        String projectId = body == null ? null : body.get("projectId");
        if (projectId == null || projectId.isBlank()) {
            return ApiErrors.badRequest("projectId is required");
        }
        try {
            return ResponseEntity.ok(documentService.generateAll(projectId));
        } catch (RuntimeException e) {
            return ApiErrors.toResponse(e);
        }
    }

    @GetMapping("/documents/{projectId}")
    public ResponseEntity<?> listDocuments(@PathVariable String projectId) {
        return ResponseEntity.ok(documentService.listDocuments(projectId));
    }

    @PostMapping("/approve-review")
    public ResponseEntity<?> approveReview(@RequestBody ReviewDecisionRequest request) {
        return decide(request, true);
    }

    @PostMapping("/reject-review")
    public ResponseEntity<?> rejectReview(@RequestBody ReviewDecisionRequest request) {
        return decide(request, false);
    }

    private ResponseEntity<?> decide(ReviewDecisionRequest request, boolean approve) {
        if (request == null || request.projectId() == null || request.projectId().isBlank()) {
            return ApiErrors.badRequest("projectId is required");
        }
        try {
            DocumentType type = DocumentType.fromValue(request.documentType());
            if (type == null) {
                return ApiErrors.badRequest("documentType is required");
            }
            CardDocument card = approve
                    ? documentService.approve(request.projectId(), type, request.actor())
                    : documentService.reject(request.projectId(), type, request.actor(), request.reason());
            return ResponseEntity.ok(BoardService.toDto(card));
        } catch (RuntimeException e) {
            return ApiErrors.toResponse(e);
        }
    }
}
