package io.github.drompincen.boardpilot.persistence.document;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * One record per completed model call, for cost tracking and billing.
 */
@Document(collection = "usage_records")
@CompoundIndexes({
        @CompoundIndex(name = "project_time", def = "{'projectId': 1, 'timestamp': -1}"),
        @CompoundIndex(name = "conversation_time", def = "{'conversationId': 1, 'timestamp': -1}")
})
public class UsageRecordDocument {

    @Id
    private String usageId;
    private String agentName;
    private String projectId;
    private String conversationId;
    private String cardId;
    private String provider;         // "anthropic" or "openai"
    private String model;
    private int inputTokens;
    private int outputTokens;
    private BigDecimal cost;         // provider cost, USD
    private BigDecimal price;        // billed price after markup
    private long durationMs;
    private boolean streamed;
    @Indexed(direction = org.springframework.data.mongodb.core.index.IndexDirection.DESCENDING)
    private Instant timestamp;

    public UsageRecordDocument() {}

    public String getUsageId() { return usageId; }
    public void setUsageId(String usageId) { this.usageId = usageId; }

    public String getAgentName() { return agentName; }
    public void setAgentName(String agentName) { this.agentName = agentName; }

    public String getProjectId() { return projectId; }
    public void setProjectId(String projectId) { this.projectId = projectId; }

    public String getConversationId() { return conversationId; }
    public void setConversationId(String conversationId) { this.conversationId = conversationId; }

    public String getCardId() { return cardId; }
    public void setCardId(String cardId) { this.cardId = cardId; }

    public String getProvider() { return provider; }
    public void setProvider(String provider) { this.provider = provider; }

    public String getModel() { return model; }
    public void setModel(String model) { this.model = model; }

    public int getInputTokens() { return inputTokens; }
    public void setInputTokens(int inputTokens) { this.inputTokens = inputTokens; }

    public int getOutputTokens() { return outputTokens; }
    public void setOutputTokens(int outputTokens) { this.outputTokens = outputTokens; }

    public BigDecimal getCost() { return cost; }
    public void setCost(BigDecimal cost) { this.cost = cost; }

    public BigDecimal getPrice() { return price; }
    public void setPrice(BigDecimal price) { this.price = price; }

    public long getDurationMs() { return durationMs; }
    public void setDurationMs(long durationMs) { this.durationMs = durationMs; }

    public boolean isStreamed() { return streamed; }
    public void setStreamed(boolean streamed) { this.streamed = streamed; }

    public Instant getTimestamp() { return timestamp; }
    public void setTimestamp(Instant timestamp) { this.timestamp = timestamp; }
}
