package io.github.drompincen.boardpilot.persistence.repository;

import io.github.drompincen.boardpilot.persistence.document.LaneDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;
import java.util.Optional;

public interface LaneRepository extends MongoRepository<LaneDocument, String> {
    Optional<LaneDocument> findByBoardIdAndLaneNumber(String boardId, int laneNumber);
    List<LaneDocument> findByBoardIdOrderByLaneNumberAsc(String boardId);
}
