package io.github.drompincen.boardpilot.runtime.board;

import io.github.drompincen.boardpilot.persistence.document.BoardDocument;
import io.github.drompincen.boardpilot.persistence.document.CardDocument;
import io.github.drompincen.boardpilot.persistence.document.CardHistoryDocument;
import io.github.drompincen.boardpilot.persistence.document.LaneDocument;
import io.github.drompincen.boardpilot.persistence.repository.BoardRepository;
import io.github.drompincen.boardpilot.persistence.repository.CardHistoryRepository;
import io.github.drompincen.boardpilot.persistence.repository.CardRepository;
import io.github.drompincen.boardpilot.persistence.repository.LaneRepository;
import io.github.drompincen.boardpilot.protocol.api.CardPriority;
import io.github.drompincen.boardpilot.protocol.api.CardStatus;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * A board with numbered lanes backed by mocked repositories that keep their data in memory,
 * so position and history rules run through the real {@link BoardService}.
 */
public class InMemoryBoard {

    public final BoardRepository boardRepository = mock(BoardRepository.class);
    public final LaneRepository laneRepository = mock(LaneRepository.class);
    public final CardRepository cardRepository = mock(CardRepository.class);
    public final CardHistoryRepository cardHistoryRepository = mock(CardHistoryRepository.class);

    public final Map<String, CardDocument> cards = new LinkedHashMap<>();
    public final Map<String, LaneDocument> lanes = new LinkedHashMap<>();
    public final List<CardHistoryDocument> history = new ArrayList<>();

    public final BoardDocument board = new BoardDocument();
    public final BoardService boardService;

    public InMemoryBoard(String projectId, String boardId, int... laneNumbers) {
        board.setBoardId(boardId);
        board.setProjectId(projectId);
        board.setName("Main board");
        board.setCreatedAt(Instant.now());
        for (int n : laneNumbers) {
            LaneDocument lane = new LaneDocument();
            lane.setLaneId("lane-" + n);
            lane.setBoardId(boardId);
            lane.setLaneNumber(n);
            lane.setName("Lane " + n);
            lanes.put(lane.getLaneId(), lane);
        }

        when(boardRepository.findFirstByProjectIdOrderByCreatedAtAsc(projectId)).thenReturn(Optional.of(board));
        when(boardRepository.findById(boardId)).thenReturn(Optional.of(board));

        when(laneRepository.findByBoardIdAndLaneNumber(anyString(), anyInt())).thenAnswer(inv ->
                lanes.values().stream()
                        .filter(l -> l.getBoardId().equals(inv.getArgument(0))
                                && l.getLaneNumber() == inv.<Integer>getArgument(1))
                        .findFirst());
        when(laneRepository.findById(anyString())).thenAnswer(inv -> Optional.ofNullable(lanes.get(inv.getArgument(0))));
        when(laneRepository.findByBoardIdOrderByLaneNumberAsc(anyString())).thenAnswer(inv ->
                lanes.values().stream().sorted(Comparator.comparingInt(LaneDocument::getLaneNumber)).toList());

        when(cardRepository.save(any(CardDocument.class))).thenAnswer(inv -> {
            CardDocument card = inv.getArgument(0);
            cards.put(card.getCardId(), card);
            return card;
        });
        when(cardRepository.findById(anyString())).thenAnswer(inv -> Optional.ofNullable(cards.get(inv.getArgument(0))));
        when(cardRepository.findFirstByLaneIdOrderByPositionDesc(anyString())).thenAnswer(inv ->
                cards.values().stream()
                        .filter(c -> Objects.equals(c.getLaneId(), inv.getArgument(0)))
                        .max(Comparator.comparingInt(CardDocument::getPosition)));
        when(cardRepository.findFirstByBoardIdAndTitle(anyString(), anyString())).thenAnswer(inv ->
                cards.values().stream()
                        .filter(c -> c.getBoardId().equals(inv.getArgument(0)) && inv.getArgument(1).equals(c.getTitle()))
                        .findFirst());
        when(cardRepository.findFirstByBoardIdAndTitleIgnoreCase(anyString(), anyString())).thenAnswer(inv ->
                cards.values().stream()
                        .filter(c -> c.getBoardId().equals(inv.getArgument(0))
                                && ((String) inv.getArgument(1)).equalsIgnoreCase(c.getTitle()))
                        .findFirst());
        when(cardRepository.findFirstByBoardIdAndDocumentType(anyString(), any())).thenAnswer(inv ->
                cards.values().stream()
                        .filter(c -> c.getBoardId().equals(inv.getArgument(0))
                                && c.getDocumentType() != null && c.getDocumentType() == inv.getArgument(1))
                        .findFirst());
        when(cardRepository.findByBoardIdOrderByPositionAsc(anyString())).thenAnswer(inv ->
                cards.values().stream()
                        .filter(c -> c.getBoardId().equals(inv.getArgument(0)))
                        .sorted(Comparator.comparingInt(CardDocument::getPosition))
                        .toList());

        when(cardHistoryRepository.save(any(CardHistoryDocument.class))).thenAnswer(inv -> {
            CardHistoryDocument entry = inv.getArgument(0);
            history.add(entry);
            return entry;
        });
        when(cardHistoryRepository.findByCardIdOrderByTimestampAsc(anyString())).thenAnswer(inv ->
                history.stream().filter(h -> h.getCardId().equals(inv.getArgument(0))).toList());

        boardService = new BoardService(boardRepository, laneRepository, cardRepository, cardHistoryRepository);
    }

    public LaneDocument lane(int laneNumber) {
        return lanes.get("lane-" + laneNumber);
    }

    public CardDocument addCard(String cardId, String title, int laneNumber, int position) {
        CardDocument card = new CardDocument();
        card.setCardId(cardId);
        card.setBoardId(board.getBoardId());
        card.setLaneId(lane(laneNumber).getLaneId());
        card.setTitle(title);
        card.setDescription("");
        card.setType("task");
        card.setPriority(CardPriority.MEDIUM);
        card.setStatus(CardStatus.PENDING);
        card.setPosition(position);
        card.setCreatedAt(Instant.now());
        card.setUpdatedAt(Instant.now());
        cards.put(cardId, card);
        return card;
    }

    public List<CardHistoryDocument> historyFor(String cardId) {
        return history.stream().filter(h -> h.getCardId().equals(cardId)).toList();
    }

    public Optional<CardDocument> cardTitled(String title) {
        return cards.values().stream().filter(c -> title.equals(c.getTitle())).findFirst();
    }
}
