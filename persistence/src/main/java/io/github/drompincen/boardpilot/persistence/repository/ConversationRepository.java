package io.github.drompincen.boardpilot.persistence.repository;

import io.github.drompincen.boardpilot.persistence.document.ConversationDocument;
import io.github.drompincen.boardpilot.protocol.api.ConversationStatus;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface ConversationRepository extends MongoRepository<ConversationDocument, String> {
    List<ConversationDocument> findTop20ByTenantIdAndStatusOrderByUpdatedAtDesc(String tenantId, ConversationStatus status);
}
