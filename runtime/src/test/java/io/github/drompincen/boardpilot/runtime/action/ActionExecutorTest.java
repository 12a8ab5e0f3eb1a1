package io.github.drompincen.boardpilot.runtime.action;

import io.github.drompincen.boardpilot.persistence.document.CardDocument;
import io.github.drompincen.boardpilot.persistence.document.CardHistoryDocument;
import io.github.drompincen.boardpilot.protocol.api.ActionSummary;
import io.github.drompincen.boardpilot.protocol.api.CardActionType;
import io.github.drompincen.boardpilot.protocol.api.CardDto;
import io.github.drompincen.boardpilot.protocol.api.CardPriority;
import io.github.drompincen.boardpilot.protocol.api.CardStatus;
import io.github.drompincen.boardpilot.runtime.agent.AgentRoutingTable;
import io.github.drompincen.boardpilot.runtime.board.CardHistoryActions;
import io.github.drompincen.boardpilot.runtime.board.InMemoryBoard;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ActionExecutorTest {

    private static final String PROJECT = "p-1";
    private static final String BOARD = "b-1";

    private InMemoryBoard board;
    private ActionExecutor executor;

    @BeforeEach
    void setUp() {
        board = new InMemoryBoard(PROJECT, BOARD, 0, 1, 2, 3, 4, 5, 6, 7, 8, 9);
        executor = new ActionExecutor(board.boardService, board.cardRepository, AgentRoutingTable.defaults());
    }

    private static CardAction action(CardActionType type, String... kv) {
        Map<String, String> data = new LinkedHashMap<>();
        for (int i = 0; i < kv.length; i += 2) {
            data.put(kv[i], kv[i + 1]);
        }
        return new CardAction(type, data);
    }

    // ------------------------------------------------------------------
    // CREATE_CARD
    // ------------------------------------------------------------------

    @Test
    void create_usesAgentDefaultLaneAndPriority() {
        ActionSummary summary = executor.execute(List.of(
                action(CardActionType.CREATE_CARD, "title", "Landing page", "agent", "frontend-agent")), PROJECT, BOARD);

        assertThat(summary.errors()).isEmpty();
        CardDto card = summary.cardsCreated().get(0);
        assertThat(card.laneId()).isEqualTo("lane-5");
        assertThat(card.priority()).isEqualTo(CardPriority.HIGH);
        assertThat(card.status()).isEqualTo(CardStatus.PENDING);
        assertThat(card.type()).isEqualTo("task");
        assertThat(card.assignedAgent()).isEqualTo("frontend-agent");
        assertThat(card.position()).isZero();
        assertThat(board.historyFor(card.cardId())).extracting(CardHistoryDocument::getAction)
                .containsExactly(CardHistoryActions.CREATED);
    }

    @Test
    void create_agentAliasRoutesToNamedAgent() {
        ActionSummary summary = executor.execute(List.of(
                action(CardActionType.CREATE_CARD, "title", "Schema", "agent", "database")), PROJECT, BOARD);

        CardDto card = summary.cardsCreated().get(0);
        assertThat(card.assignedAgent()).isEqualTo("database-agent");
        assertThat(card.laneId()).isEqualTo("lane-3");
    }

    @Test
    void create_unknownAgentFallsBackToBaseline() {
        ActionSummary summary = executor.execute(List.of(
                action(CardActionType.CREATE_CARD, "title", "Kickoff", "agent", "astrologer", "priority", "low")),
                PROJECT, BOARD);

        CardDto card = summary.cardsCreated().get(0);
        assertThat(card.assignedAgent()).isEqualTo("ceo-copilot");
        assertThat(card.laneId()).isEqualTo("lane-0");
        assertThat(card.priority()).isEqualTo(CardPriority.LOW);
    }

    @Test
    void create_sameTitleTwice_updatesInsteadOfDuplicating() {
        CardAction first = action(CardActionType.CREATE_CARD, "title", "API", "agent", "backend-agent",
                "description", "v1");
        CardAction second = action(CardActionType.CREATE_CARD, "title", "API", "agent", "backend-agent",
                "description", "v2");

        executor.execute(List.of(first), PROJECT, BOARD);
        ActionSummary summary = executor.execute(List.of(second), PROJECT, BOARD);

        assertThat(board.cards.values()).filteredOn(c -> "API".equals(c.getTitle())).hasSize(1);
        CardDocument card = board.cardTitled("API").orElseThrow();
        assertThat(card.getDescription()).isEqualTo("v2");
        assertThat(summary.cardsCreated()).hasSize(1);
        List<CardHistoryDocument> updates = board.historyFor(card.getCardId()).stream()
                .filter(h -> h.getAction().equals(CardHistoryActions.UPDATED)).toList();
        assertThat(updates).hasSize(1);
        assertThat(updates.get(0).getReason()).isEqualTo(ActionExecutor.DEDUP_REASON);
        assertThat(updates.get(0).getPreviousValue()).isEqualTo("v1");
    }

    @Test
    void create_positionsAreUniqueAndIncreasingInLane() {
        board.addCard("existing", "Existing", 5, 3);

        ActionSummary summary = executor.execute(List.of(
                action(CardActionType.CREATE_CARD, "title", "A", "agent", "frontend-agent"),
                action(CardActionType.CREATE_CARD, "title", "B", "agent", "backend-agent"),
                action(CardActionType.CREATE_CARD, "title", "C", "agent", "frontend-agent")), PROJECT, BOARD);

        assertThat(summary.cardsCreated()).extracting(CardDto::position).containsExactly(4, 5, 6);
    }

    @Test
    void create_missingLane_isReportedPerAction() {
        board.lanes.remove("lane-9");

        ActionSummary summary = executor.execute(List.of(
                action(CardActionType.CREATE_CARD, "title", "Guide", "agent", "docs-agent"),
                action(CardActionType.CREATE_CARD, "title", "Tests", "agent", "qa-agent")), PROJECT, BOARD);

        assertThat(summary.errors()).containsExactly("Lane 9 not found for agent docs-agent");
        assertThat(summary.cardsCreated()).extracting(CardDto::title).containsExactly("Tests");
    }

    // ------------------------------------------------------------------
    // MOVE_CARD / UPDATE_CARD
    // ------------------------------------------------------------------

    @Test
    void move_toMissingLane_failsAloneWhileSiblingsApply() {
        board.addCard("c-1", "One", 5, 0);
        board.addCard("c-2", "Two", 5, 1);

        ActionSummary summary = executor.execute(List.of(
                action(CardActionType.MOVE_CARD, "cardId", "c-1", "toLane", "99"),
                action(CardActionType.MOVE_CARD, "cardId", "c-2", "toLane", "7")), PROJECT, BOARD);

        assertThat(summary.errors()).containsExactly("Lane 99 not found on board " + BOARD);
        assertThat(summary.cardsMoved()).extracting(CardDto::cardId).containsExactly("c-2");
        assertThat(board.cards.get("c-1").getLaneId()).isEqualTo("lane-5");
        assertThat(board.cards.get("c-2").getLaneId()).isEqualTo("lane-7");
        assertThat(board.cards.get("c-2").getPosition()).isZero();
    }

    @Test
    void move_nonNumericLaneAndUnknownCard() {
        ActionSummary summary = executor.execute(List.of(
                action(CardActionType.MOVE_CARD, "cardId", "c-1", "toLane", "seven"),
                action(CardActionType.MOVE_CARD, "cardId", "ghost", "toLane", "7")), PROJECT, BOARD);

        assertThat(summary.errors()).containsExactly(
                "Invalid lane number 'seven' for card c-1",
                "Card not found: ghost");
    }

    @Test
    void move_recordsHistoryWithBaselineActor() {
        board.addCard("c-1", "One", 5, 0);

        executor.execute(List.of(action(CardActionType.MOVE_CARD, "cardId", "c-1", "toLane", "6")), PROJECT, BOARD);

        CardHistoryDocument moved = board.historyFor("c-1").get(0);
        assertThat(moved.getAction()).isEqualTo(CardHistoryActions.MOVED);
        assertThat(moved.getPreviousValue()).isEqualTo("lane-5");
        assertThat(moved.getNewValue()).isEqualTo("lane-6");
        assertThat(moved.getPerformedBy()).isEqualTo("ceo-copilot");
    }

    @Test
    void update_changesStatusAndPriority_withHistoryPerField() {
        board.addCard("c-1", "One", 5, 0);

        ActionSummary summary = executor.execute(List.of(
                action(CardActionType.UPDATE_CARD, "cardId", "c-1", "status", "in progress", "priority", "Critical")),
                PROJECT, BOARD);

        assertThat(summary.cardsUpdated()).hasSize(1);
        CardDocument card = board.cards.get("c-1");
        assertThat(card.getStatus()).isEqualTo(CardStatus.IN_PROGRESS);
        assertThat(card.getPriority()).isEqualTo(CardPriority.CRITICAL);
        assertThat(board.historyFor("c-1")).extracting(CardHistoryDocument::getAction)
                .containsExactly(CardHistoryActions.STATUS_CHANGE, CardHistoryActions.UPDATED);
    }

    @Test
    void update_invalidStatus_appliesNothing() {
        board.addCard("c-1", "One", 5, 0);

        ActionSummary summary = executor.execute(List.of(
                action(CardActionType.UPDATE_CARD, "cardId", "c-1", "status", "sleeping", "priority", "high")),
                PROJECT, BOARD);

        assertThat(summary.errors()).containsExactly("Invalid status 'sleeping' for card c-1");
        assertThat(board.cards.get("c-1").getPriority()).isEqualTo(CardPriority.MEDIUM);
        assertThat(board.history).isEmpty();
    }

    // ------------------------------------------------------------------
    // Preconditions
    // ------------------------------------------------------------------

    @Test
    void missingBoard_reportsOneErrorPerActionAndTouchesNothing() {
        ActionSummary summary = executor.execute(List.of(
                action(CardActionType.CREATE_CARD, "title", "X"),
                action(CardActionType.UPDATE_CARD, "cardId", "c-1")), PROJECT, null);

        assertThat(summary.errors()).hasSize(2);
        assertThat(summary.errors().get(0)).startsWith("CREATE_CARD: Missing projectId");
        assertThat(board.cards).isEmpty();
        assertThat(board.history).isEmpty();
    }

    @Test
    void noActions_isEmptySummary() {
        ActionSummary summary = executor.execute(List.of(), PROJECT, BOARD);

        assertThat(summary.hasErrors()).isFalse();
        assertThat(summary.cardsCreated()).isEmpty();
    }
}
