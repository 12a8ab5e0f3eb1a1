package io.github.drompincen.boardpilot.persistence.repository;

import io.github.drompincen.boardpilot.persistence.document.StyleGuideDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.Optional;

public interface StyleGuideRepository extends MongoRepository<StyleGuideDocument, String> {
    Optional<StyleGuideDocument> findByProjectId(String projectId);
}
