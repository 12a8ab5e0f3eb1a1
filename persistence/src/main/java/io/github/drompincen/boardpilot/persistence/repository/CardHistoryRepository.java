package io.github.drompincen.boardpilot.persistence.repository;

import io.github.drompincen.boardpilot.persistence.document.CardHistoryDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface CardHistoryRepository extends MongoRepository<CardHistoryDocument, String> {
    List<CardHistoryDocument> findByCardIdOrderByTimestampAsc(String cardId);
}
