package io.github.drompincen.boardpilot.persistence.repository;

import io.github.drompincen.boardpilot.persistence.document.AgentContextDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;
import java.util.Optional;

public interface AgentContextRepository extends MongoRepository<AgentContextDocument, String> {
    List<AgentContextDocument> findByProjectIdAndAgentName(String projectId, String agentName);
    Optional<AgentContextDocument> findByProjectIdAndAgentNameAndKind(String projectId, String agentName,
                                                                      AgentContextDocument.Kind kind);
}
