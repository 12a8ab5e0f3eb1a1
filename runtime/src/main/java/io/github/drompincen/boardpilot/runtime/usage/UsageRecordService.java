package io.github.drompincen.boardpilot.runtime.usage;

import io.github.drompincen.boardpilot.persistence.document.UsageRecordDocument;
import io.github.drompincen.boardpilot.persistence.repository.UsageRecordRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Service
public class UsageRecordService implements UsageSink {

    private static final Logger log = LoggerFactory.getLogger(UsageRecordService.class);

    private final UsageRecordRepository usageRecordRepository;

    public UsageRecordService(UsageRecordRepository usageRecordRepository) {
        this.usageRecordRepository = usageRecordRepository;
    }

    @Override
    public void record(UsageRecord usage) {
        UsageRecordDocument doc = new UsageRecordDocument();
        doc.setUsageId(UUID.randomUUID().toString());
        doc.setAgentName(usage.agentName());
        doc.setProjectId(usage.projectId());
        doc.setConversationId(usage.conversationId());
        doc.setCardId(usage.cardId());
        doc.setProvider(usage.provider());
        doc.setModel(usage.model());
        doc.setInputTokens(usage.inputTokens());
        doc.setOutputTokens(usage.outputTokens());
        doc.setCost(usage.cost());
        doc.setPrice(usage.price());
        doc.setDurationMs(usage.durationMs());
        doc.setStreamed(usage.streamed());
        doc.setTimestamp(Instant.now());
        usageRecordRepository.save(doc);
        log.debug("Usage {} {} tokens in / {} out, price {}", usage.agentName(),
                usage.inputTokens(), usage.outputTokens(), usage.price());
    }

    public List<UsageRecordDocument> forProject(String projectId) {
        return usageRecordRepository.findByProjectIdOrderByTimestampDesc(projectId);
    }

    public BigDecimal totalPrice(String projectId) {
        return forProject(projectId).stream()
                .map(UsageRecordDocument::getPrice)
                .filter(p -> p != null)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }
}
