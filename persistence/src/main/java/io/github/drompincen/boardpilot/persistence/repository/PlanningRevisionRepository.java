package io.github.drompincen.boardpilot.persistence.repository;

import io.github.drompincen.boardpilot.persistence.document.PlanningRevisionDocument;
import io.github.drompincen.boardpilot.protocol.api.DocumentType;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface PlanningRevisionRepository extends MongoRepository<PlanningRevisionDocument, String> {
    List<PlanningRevisionDocument> findByProjectIdAndTypeOrderByVersionDesc(String projectId, DocumentType type);
}
