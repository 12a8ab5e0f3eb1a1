package io.github.drompincen.boardpilot.runtime.board;

import io.github.drompincen.boardpilot.persistence.document.BoardDocument;
import io.github.drompincen.boardpilot.persistence.document.CardDocument;
import io.github.drompincen.boardpilot.persistence.document.CardHistoryDocument;
import io.github.drompincen.boardpilot.persistence.document.LaneDocument;
import io.github.drompincen.boardpilot.persistence.repository.BoardRepository;
import io.github.drompincen.boardpilot.persistence.repository.CardHistoryRepository;
import io.github.drompincen.boardpilot.persistence.repository.CardRepository;
import io.github.drompincen.boardpilot.persistence.repository.LaneRepository;
import io.github.drompincen.boardpilot.protocol.api.CardDto;
import io.github.drompincen.boardpilot.protocol.api.CardHistoryDto;
import io.github.drompincen.boardpilot.protocol.api.LaneDto;
import io.github.drompincen.boardpilot.runtime.NotFoundException;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Board, lane and card access shared by the action executor and the document lifecycle.
 * Owns the position rule (max + 1 in the lane) and the append-only card history.
 */
@Service
public class BoardService {

    private final BoardRepository boardRepository;
    private final LaneRepository laneRepository;
    private final CardRepository cardRepository;
    private final CardHistoryRepository cardHistoryRepository;

    public BoardService(BoardRepository boardRepository, LaneRepository laneRepository,
                        CardRepository cardRepository, CardHistoryRepository cardHistoryRepository) {
        this.boardRepository = boardRepository;
        this.laneRepository = laneRepository;
        this.cardRepository = cardRepository;
        this.cardHistoryRepository = cardHistoryRepository;
    }

    /** The board actions execute against: the project's first board. */
    public Optional<BoardDocument> primaryBoard(String projectId) {
        if (projectId == null) {
            return Optional.empty();
        }
        return boardRepository.findFirstByProjectIdOrderByCreatedAtAsc(projectId);
    }

    public Optional<BoardDocument> findBoard(String boardId) {
        return boardId == null ? Optional.empty() : boardRepository.findById(boardId);
    }

    public Optional<LaneDocument> findLane(String boardId, int laneNumber) {
        return laneRepository.findByBoardIdAndLaneNumber(boardId, laneNumber);
    }

    public Optional<LaneDocument> findLaneById(String laneId) {
        return laneId == null ? Optional.empty() : laneRepository.findById(laneId);
    }

    public Optional<CardDocument> findCard(String cardId) {
        return cardId == null ? Optional.empty() : cardRepository.findById(cardId);
    }

    public CardDocument requireCard(String cardId) {
        return findCard(cardId).orElseThrow(() -> new NotFoundException("Card", cardId));
    }

    /** Position for a card entering the lane: 0 for an empty lane, else max + 1. */
    public int nextPosition(String laneId) {
        return cardRepository.findFirstByLaneIdOrderByPositionDesc(laneId)
                .map(c -> c.getPosition() + 1)
                .orElse(0);
    }

    /** Moves the card to the lane and re-positions it there. No-op position-wise if already in it. */
    public void placeInLane(CardDocument card, LaneDocument lane) {
        if (!lane.getLaneId().equals(card.getLaneId())) {
            card.setPosition(nextPosition(lane.getLaneId()));
            card.setLaneId(lane.getLaneId());
        }
    }

    public CardDocument save(CardDocument card) {
        if (card.getCardId() == null) {
            card.setCardId(UUID.randomUUID().toString());
        }
        Instant now = Instant.now();
        if (card.getCreatedAt() == null) {
            card.setCreatedAt(now);
        }
        card.setUpdatedAt(now);
        return cardRepository.save(card);
    }

    public CardHistoryDocument recordHistory(String cardId, String action, String field, Object previousValue,
                                             Object newValue, String performedBy, String reason,
                                             Map<String, Object> metadata) {
        CardHistoryDocument entry = new CardHistoryDocument();
        entry.setHistoryId(UUID.randomUUID().toString());
        entry.setCardId(cardId);
        entry.setAction(action);
        entry.setField(field);
        entry.setPreviousValue(previousValue == null ? null : String.valueOf(previousValue));
        entry.setNewValue(newValue == null ? null : String.valueOf(newValue));
        entry.setPerformedBy(performedBy);
        entry.setReason(reason);
        entry.setMetadata(metadata);
        entry.setTimestamp(Instant.now());
        return cardHistoryRepository.save(entry);
    }

    public List<CardDto> listCards(String boardId) {
        return cardRepository.findByBoardIdOrderByPositionAsc(boardId).stream().map(BoardService::toDto).toList();
    }

    public List<LaneDto> listLanes(String boardId) {
        return laneRepository.findByBoardIdOrderByLaneNumberAsc(boardId).stream()
                .map(l -> new LaneDto(l.getLaneId(), l.getBoardId(), l.getLaneNumber(), l.getName()))
                .toList();
    }

    public List<CardHistoryDto> history(String cardId) {
        requireCard(cardId);
        return cardHistoryRepository.findByCardIdOrderByTimestampAsc(cardId).stream()
                .map(h -> new CardHistoryDto(h.getHistoryId(), h.getCardId(), h.getAction(), h.getField(),
                        h.getPreviousValue(), h.getNewValue(), h.getPerformedBy(), h.getReason(),
                        h.getMetadata(), h.getTimestamp()))
                .toList();
    }

    public static CardDto toDto(CardDocument c) {
        return new CardDto(c.getCardId(), c.getBoardId(), c.getLaneId(), c.getParentCardId(), c.getTitle(),
                c.getDescription(), c.getType(), c.getPriority(), c.getAssignedAgent(), c.getStatus(),
                c.getPosition(), c.getDocumentType(), c.getReviewStatus(), c.getCreatedAt(), c.getUpdatedAt());
    }
}
