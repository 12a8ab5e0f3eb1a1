package io.github.drompincen.boardpilot.runtime.action;

import io.github.drompincen.boardpilot.persistence.document.CardDocument;
import io.github.drompincen.boardpilot.persistence.document.LaneDocument;
import io.github.drompincen.boardpilot.persistence.repository.CardRepository;
import io.github.drompincen.boardpilot.protocol.api.ActionSummary;
import io.github.drompincen.boardpilot.protocol.api.CardDto;
import io.github.drompincen.boardpilot.protocol.api.CardPriority;
import io.github.drompincen.boardpilot.protocol.api.CardStatus;
import io.github.drompincen.boardpilot.runtime.agent.AgentRoute;
import io.github.drompincen.boardpilot.runtime.agent.AgentRoutingTable;
import io.github.drompincen.boardpilot.runtime.board.BoardService;
import io.github.drompincen.boardpilot.runtime.board.CardHistoryActions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Applies parsed card actions to a board. Each action succeeds or fails on its own; a failure
 * is reported in {@link ActionSummary#errors()} and never stops the remaining actions.
 */
@Service
public class ActionExecutor {

    private static final Logger log = LoggerFactory.getLogger(ActionExecutor.class);

    static final String DEDUP_REASON =
            "CoPilot CREATE_CARD action - updated existing card instead of creating duplicate";

    private final BoardService boardService;
    private final CardRepository cardRepository;
    private final AgentRoutingTable routingTable;

    public ActionExecutor(BoardService boardService, CardRepository cardRepository, AgentRoutingTable routingTable) {
        this.boardService = boardService;
        this.cardRepository = cardRepository;
        this.routingTable = routingTable;
    }

    public ActionSummary execute(List<CardAction> actions, String projectId, String boardId) {
        if (projectId == null || projectId.isBlank() || boardId == null || boardId.isBlank()) {
            String error = "Missing projectId (" + projectId + ") or boardId (" + boardId + ") - cannot execute actions";
            log.error(error);
            if (actions == null || actions.isEmpty()) {
                return ActionSummary.failed(error);
            }
            List<String> errors = new ArrayList<>();
            for (CardAction action : actions) {
                errors.add(action.type() + ": " + error);
            }
            return new ActionSummary(List.of(), List.of(), List.of(), errors);
        }
        if (actions == null || actions.isEmpty()) {
            return ActionSummary.empty();
        }

        log.info("Executing {} card actions on board {} (project {})", actions.size(), boardId, projectId);
        List<CardDto> created = new ArrayList<>();
        List<CardDto> moved = new ArrayList<>();
        List<CardDto> updated = new ArrayList<>();
        List<String> errors = new ArrayList<>();

        for (CardAction action : actions) {
            try {
                switch (action.type()) {
                    case CREATE_CARD -> createCard(action, boardId, errors).ifPresent(created::add);
                    case MOVE_CARD -> moveCard(action, boardId, errors).ifPresent(moved::add);
                    case UPDATE_CARD -> updateCard(action, boardId, errors).ifPresent(updated::add);
                }
            } catch (RuntimeException e) {
                log.error("Card action {} failed: {}", action.type(), e.getMessage(), e);
                errors.add(action.type() + " failed: " + e.getMessage());
            }
        }
        log.info("Card actions done: {} created, {} moved, {} updated, {} errors",
                created.size(), moved.size(), updated.size(), errors.size());
        return new ActionSummary(created, moved, updated, errors);
    }

    private Optional<CardDto> createCard(CardAction action, String boardId, List<String> errors) {
        String agent = routingTable.effectiveAgent(action.get("agent"));
        AgentRoute route = routingTable.routeFor(agent);

        Optional<LaneDocument> lane = boardService.findLane(boardId, route.defaultLane());
        if (lane.isEmpty()) {
            errors.add("Lane " + route.defaultLane() + " not found for agent " + agent);
            return Optional.empty();
        }
        String title = action.get("title");
        String description = action.get("description");
        CardPriority priority = CardPriority.parse(action.get("priority")).orElse(route.priority());

        Optional<CardDocument> existing = cardRepository.findFirstByBoardIdAndTitle(boardId, title);
        if (existing.isPresent()) {
            CardDocument card = existing.get();
            String previousDescription = card.getDescription();
            boardService.placeInLane(card, lane.get());
            card.setDescription(description != null ? description : previousDescription);
            card.setPriority(priority);
            card.setAssignedAgent(agent);
            card.setStatus(CardStatus.PENDING);
            CardDocument saved = boardService.save(card);
            boardService.recordHistory(saved.getCardId(), CardHistoryActions.UPDATED, "description",
                    previousDescription, description, agent, DEDUP_REASON, null);
            log.info("Updated existing card {} '{}' instead of creating a duplicate", saved.getCardId(), title);
            return Optional.of(BoardService.toDto(saved));
        }

        CardDocument card = new CardDocument();
        card.setBoardId(boardId);
        card.setLaneId(lane.get().getLaneId());
        card.setTitle(title);
        card.setDescription(description == null ? "" : description);
        card.setType("task");
        card.setPriority(priority);
        card.setAssignedAgent(agent);
        card.setStatus(CardStatus.PENDING);
        card.setPosition(boardService.nextPosition(lane.get().getLaneId()));
        CardDocument saved = boardService.save(card);
        boardService.recordHistory(saved.getCardId(), CardHistoryActions.CREATED, null, null, title, agent,
                "Created by CoPilot", Map.of("laneNumber", lane.get().getLaneNumber()));
        log.info("Created card {} '{}' in lane {}", saved.getCardId(), title, lane.get().getLaneNumber());
        return Optional.of(BoardService.toDto(saved));
    }

    private Optional<CardDto> moveCard(CardAction action, String boardId, List<String> errors) {
        String cardId = action.get("cardId");
        String rawLane = action.get("toLane");
        int laneNumber;
        try {
            laneNumber = Integer.parseInt(rawLane.trim());
        } catch (NumberFormatException e) {
            errors.add("Invalid lane number '" + rawLane + "' for card " + cardId);
            return Optional.empty();
        }
        Optional<LaneDocument> lane = boardService.findLane(boardId, laneNumber);
        if (lane.isEmpty()) {
            errors.add("Lane " + laneNumber + " not found on board " + boardId);
            return Optional.empty();
        }
        Optional<CardDocument> found = findOnBoard(cardId, boardId, errors);
        if (found.isEmpty()) {
            return Optional.empty();
        }
        CardDocument card = found.get();
        String previousLaneId = card.getLaneId();
        card.setPosition(boardService.nextPosition(lane.get().getLaneId()));
        card.setLaneId(lane.get().getLaneId());
        CardDocument saved = boardService.save(card);
        boardService.recordHistory(cardId, CardHistoryActions.MOVED, "laneId", previousLaneId,
                saved.getLaneId(), routingTable.baselineAgent(), "CoPilot MOVE_CARD action",
                Map.of("toLane", laneNumber));
        return Optional.of(BoardService.toDto(saved));
    }

    private Optional<CardDto> updateCard(CardAction action, String boardId, List<String> errors) {
        String cardId = action.get("cardId");
        Optional<CardStatus> status = Optional.empty();
        Optional<CardPriority> priority = Optional.empty();
        if (action.has("status")) {
            status = CardStatus.parse(action.get("status"));
            if (status.isEmpty()) {
                errors.add("Invalid status '" + action.get("status") + "' for card " + cardId);
                return Optional.empty();
            }
        }
        if (action.has("priority")) {
            priority = CardPriority.parse(action.get("priority"));
            if (priority.isEmpty()) {
                errors.add("Invalid priority '" + action.get("priority") + "' for card " + cardId);
                return Optional.empty();
            }
        }
        Optional<CardDocument> found = findOnBoard(cardId, boardId, errors);
        if (found.isEmpty()) {
            return Optional.empty();
        }
        CardDocument card = found.get();
        String actor = routingTable.baselineAgent();
        List<Runnable> history = new ArrayList<>();

        if (status.isPresent() && status.get() != card.getStatus()) {
            CardStatus previous = card.getStatus();
            card.setStatus(status.get());
            history.add(() -> boardService.recordHistory(cardId, CardHistoryActions.STATUS_CHANGE, "status",
                    previous, card.getStatus(), actor, "CoPilot UPDATE_CARD action", null));
        }
        if (priority.isPresent() && priority.get() != card.getPriority()) {
            CardPriority previous = card.getPriority();
            card.setPriority(priority.get());
            history.add(() -> boardService.recordHistory(cardId, CardHistoryActions.UPDATED, "priority",
                    previous, card.getPriority(), actor, "CoPilot UPDATE_CARD action", null));
        }
        String agent = action.get("assignedAgent");
        if (agent != null && !Objects.equals(agent, card.getAssignedAgent())) {
            String previous = card.getAssignedAgent();
            card.setAssignedAgent(agent);
            history.add(() -> boardService.recordHistory(cardId, CardHistoryActions.UPDATED, "assignedAgent",
                    previous, agent, actor, "CoPilot UPDATE_CARD action", null));
        }

        CardDocument saved = history.isEmpty() ? card : boardService.save(card);
        history.forEach(Runnable::run);
        return Optional.of(BoardService.toDto(saved));
    }

    private Optional<CardDocument> findOnBoard(String cardId, String boardId, List<String> errors) {
        Optional<CardDocument> card = boardService.findCard(cardId);
        if (card.isEmpty() || !boardId.equals(card.get().getBoardId())) {
            errors.add("Card not found: " + cardId);
            return Optional.empty();
        }
        return card;
    }
}
