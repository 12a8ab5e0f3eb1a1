package io.github.drompincen.boardpilot.persistence.repository;

import io.github.drompincen.boardpilot.persistence.document.ProjectTodoDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;
import java.util.Optional;

public interface ProjectTodoRepository extends MongoRepository<ProjectTodoDocument, String> {
    Optional<ProjectTodoDocument> findFirstByProjectIdAndCardId(String projectId, String cardId);
    List<ProjectTodoDocument> findByCardId(String cardId);
}
