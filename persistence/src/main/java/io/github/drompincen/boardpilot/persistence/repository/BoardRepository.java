package io.github.drompincen.boardpilot.persistence.repository;

import io.github.drompincen.boardpilot.persistence.document.BoardDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.Optional;

public interface BoardRepository extends MongoRepository<BoardDocument, String> {
    Optional<BoardDocument> findFirstByProjectIdOrderByCreatedAtAsc(String projectId);
}
