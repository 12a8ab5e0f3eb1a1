package io.github.drompincen.boardpilot.runtime.document;

import io.github.drompincen.boardpilot.persistence.document.CardDocument;
import io.github.drompincen.boardpilot.persistence.document.LaneDocument;
import io.github.drompincen.boardpilot.protocol.api.CardStatus;
import io.github.drompincen.boardpilot.protocol.api.ReviewStatus;
import io.github.drompincen.boardpilot.runtime.board.BoardService;
import io.github.drompincen.boardpilot.runtime.board.CardHistoryActions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Lifecycle of a document review card:
 * <pre>
 *   NONE -> PENDING -> IN_REVIEW -> APPROVED
 *                          |            |
 *                          v            v (regenerated)
 *                      REJECTED ---> PENDING
 * </pre>
 * IN_REVIEW places the card in the review lane, APPROVED in the complete lane.
 */
@Component
public class ReviewCardStateMachine {

    private static final Logger log = LoggerFactory.getLogger(ReviewCardStateMachine.class);

    public static final int REVIEW_LANE = 6;
    public static final int COMPLETE_LANE = 7;

    private static final Map<ReviewStatus, Set<ReviewStatus>> ALLOWED = new EnumMap<>(ReviewStatus.class);

    static {
        ALLOWED.put(ReviewStatus.NONE, EnumSet.of(ReviewStatus.PENDING));
        ALLOWED.put(ReviewStatus.PENDING, EnumSet.of(ReviewStatus.IN_REVIEW));
        ALLOWED.put(ReviewStatus.IN_REVIEW, EnumSet.of(ReviewStatus.APPROVED, ReviewStatus.REJECTED));
        ALLOWED.put(ReviewStatus.REJECTED, EnumSet.of(ReviewStatus.PENDING));
        ALLOWED.put(ReviewStatus.APPROVED, EnumSet.of(ReviewStatus.PENDING));
    }

    private final BoardService boardService;

    public ReviewCardStateMachine(BoardService boardService) {
        this.boardService = boardService;
    }

    public static boolean canTransition(ReviewStatus from, ReviewStatus to) {
        return ALLOWED.getOrDefault(normalize(from), Set.of()).contains(to);
    }

    public static ReviewStatus currentStatus(CardDocument card) {
        return normalize(card.getReviewStatus());
    }

    private static ReviewStatus normalize(ReviewStatus status) {
        return status == null ? ReviewStatus.NONE : status;
    }

    /**
     * Applies one transition: review status, card status, lane, then a history entry.
     *
     * @throws IllegalStateException if the move is not in the transition table
     */
    public CardDocument transition(CardDocument card, ReviewStatus target, String actor, String reason) {
        ReviewStatus from = currentStatus(card);
        if (!canTransition(from, target)) {
            throw new IllegalStateException("Illegal review transition " + from + " -> " + target
                    + " for card " + card.getCardId());
        }
        CardStatus previousStatus = card.getStatus();
        String previousLaneId = card.getLaneId();

        card.setReviewStatus(target);
        card.setStatus(cardStatusFor(target));
        targetLane(target).flatMap(n -> lane(card, n)).ifPresent(lane -> boardService.placeInLane(card, lane));
        CardDocument saved = boardService.save(card);

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("previousStatus", String.valueOf(previousStatus));
        metadata.put("newStatus", String.valueOf(saved.getStatus()));
        metadata.put("laneChanged", !Objects.equals(saved.getLaneId(), previousLaneId));
        if (saved.getDocumentType() != null) {
            metadata.put("documentType", saved.getDocumentType().value());
        }
        boardService.recordHistory(saved.getCardId(), CardHistoryActions.REVIEW_TRANSITION, "reviewStatus",
                from, target, actor, reason, metadata);
        log.info("Review card {} {} -> {} by {}", saved.getCardId(), from, target, actor);
        return saved;
    }

    static CardStatus cardStatusFor(ReviewStatus status) {
        return switch (status) {
            case NONE, PENDING -> CardStatus.PENDING;
            case IN_REVIEW -> CardStatus.READY;
            case APPROVED -> CardStatus.DONE;
            case REJECTED -> CardStatus.BLOCKED;
        };
    }

    private static Optional<Integer> targetLane(ReviewStatus status) {
        return switch (status) {
            case IN_REVIEW -> Optional.of(REVIEW_LANE);
            case APPROVED -> Optional.of(COMPLETE_LANE);
            default -> Optional.empty();
        };
    }

    private Optional<LaneDocument> lane(CardDocument card, int laneNumber) {
        Optional<LaneDocument> lane = boardService.findLane(card.getBoardId(), laneNumber);
        if (lane.isEmpty()) {
            log.warn("Lane {} missing on board {}; card {} stays in its lane", laneNumber, card.getBoardId(), card.getCardId());
        }
        return lane;
    }
}
