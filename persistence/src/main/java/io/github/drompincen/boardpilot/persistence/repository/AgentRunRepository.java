package io.github.drompincen.boardpilot.persistence.repository;

import io.github.drompincen.boardpilot.persistence.document.AgentRunDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface AgentRunRepository extends MongoRepository<AgentRunDocument, String> {
    List<AgentRunDocument> findByCardIdOrderByStartedAtDesc(String cardId);
}
