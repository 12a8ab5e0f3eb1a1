package io.github.drompincen.boardpilot.persistence.repository;

import io.github.drompincen.boardpilot.persistence.document.CardDocument;
import io.github.drompincen.boardpilot.protocol.api.DocumentType;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;
import java.util.Optional;

public interface CardRepository extends MongoRepository<CardDocument, String> {
    Optional<CardDocument> findFirstByBoardIdAndTitle(String boardId, String title);
    Optional<CardDocument> findFirstByBoardIdAndTitleIgnoreCase(String boardId, String title);
    Optional<CardDocument> findFirstByBoardIdAndDocumentType(String boardId, DocumentType documentType);
    Optional<CardDocument> findFirstByLaneIdOrderByPositionDesc(String laneId);
    List<CardDocument> findByBoardIdOrderByPositionAsc(String boardId);
    List<CardDocument> findByParentCardId(String parentCardId);
}
