package io.github.drompincen.boardpilot.persistence.repository;

import io.github.drompincen.boardpilot.persistence.document.PlanningArtifactDocument;
import io.github.drompincen.boardpilot.protocol.api.DocumentType;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;
import java.util.Optional;

public interface PlanningArtifactRepository extends MongoRepository<PlanningArtifactDocument, String> {
    Optional<PlanningArtifactDocument> findByProjectIdAndType(String projectId, DocumentType type);
    List<PlanningArtifactDocument> findByProjectId(String projectId);
}
