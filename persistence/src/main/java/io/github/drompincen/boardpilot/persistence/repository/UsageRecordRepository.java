package io.github.drompincen.boardpilot.persistence.repository;

import io.github.drompincen.boardpilot.persistence.document.UsageRecordDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface UsageRecordRepository extends MongoRepository<UsageRecordDocument, String> {
    List<UsageRecordDocument> findByProjectIdOrderByTimestampDesc(String projectId);
    List<UsageRecordDocument> findByConversationIdOrderByTimestampDesc(String conversationId);
}
