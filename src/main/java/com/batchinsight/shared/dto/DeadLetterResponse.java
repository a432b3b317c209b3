package com.batchinsight.shared.dto;

import com.batchinsight.shared.model.DeadLetterEntry;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * DTO for a dead-letter entry.
 */
public class DeadLetterResponse {

    private Long id;
    private String deadLetterQueue;
    private String sourceQueue;
    private String tier;
    private UUID jobId;
    private UUID batchId;
    private String documentReference;
    private int attemptCount;
    private String reason;
    private String lastError;
    private List<Map<String, Object>> failureHistory;
    private Instant createdAt;
    private Instant replayedAt;
    private UUID replayBatchId;

    public DeadLetterResponse() {
    }

    public static DeadLetterResponse from(DeadLetterEntry entry) {
        DeadLetterResponse dto = new DeadLetterResponse();
        dto.id = entry.getId();
        dto.deadLetterQueue = entry.getDeadLetterQueue();
        dto.sourceQueue = entry.getSourceQueue();
        dto.tier = entry.getTier().name();
        dto.jobId = entry.getJobUuid();
        dto.batchId = entry.getBatchUuid();
        dto.documentReference = entry.getDocumentReference();
        dto.attemptCount = entry.getAttemptCount();
        dto.reason = entry.getReason();
        dto.lastError = entry.getLastError();
        dto.failureHistory = entry.getFailureHistory();
        dto.createdAt = entry.getCreatedAt();
        dto.replayedAt = entry.getReplayedAt();
        dto.replayBatchId = entry.getReplayBatchUuid();
        return dto;
    }

    public Long getId() {
        return id;
    }

    public String getDeadLetterQueue() {
        return deadLetterQueue;
    }

    public String getSourceQueue() {
        return sourceQueue;
    }

    public String getTier() {
        return tier;
    }

    public UUID getJobId() {
        return jobId;
    }

    public UUID getBatchId() {
        return batchId;
    }

    public String getDocumentReference() {
        return documentReference;
    }

    public int getAttemptCount() {
        return attemptCount;
    }

    public String getReason() {
        return reason;
    }

    public String getLastError() {
        return lastError;
    }

    public List<Map<String, Object>> getFailureHistory() {
        return failureHistory;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getReplayedAt() {
        return replayedAt;
    }

    public UUID getReplayBatchId() {
        return replayBatchId;
    }
}
