package com.batchinsight.shared.model;

import jakarta.persistence.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * A message moved to a tier's dead-letter queue, kept with its failure history
 * for inspection and replay.
 */
@Entity
@Table(name = "dead_letter_entries", indexes = {
    @Index(name = "idx_dead_letter_entries_queue_created", columnList = "dead_letter_queue, created_at"),
    @Index(name = "idx_dead_letter_entries_batch", columnList = "batch_uuid")
})
public class DeadLetterEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "dead_letter_queue", nullable = false, length = 64)
    private String deadLetterQueue;

    @Column(name = "source_queue", nullable = false, length = 64)
    private String sourceQueue;

    @Enumerated(EnumType.STRING)
    @Column(name = "tier", nullable = false, length = 10)
    private QueueTier tier;

    @Column(name = "message_uuid", nullable = false, unique = true)
    private UUID messageUuid;

    @Column(name = "job_uuid", nullable = false)
    private UUID jobUuid;

    @Column(name = "batch_uuid", nullable = false)
    private UUID batchUuid;

    @Column(name = "document_reference", nullable = false, length = 1024)
    private String documentReference;

    @Column(name = "payload", nullable = false, columnDefinition = "TEXT")
    private String payload;

    @Column(name = "attempt_count", nullable = false)
    private int attemptCount;

    @Column(name = "reason", nullable = false, length = 40)
    private String reason;

    @Column(name = "last_error", columnDefinition = "TEXT")
    private String lastError;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "failure_history", columnDefinition = "JSONB")
    private List<Map<String, Object>> failureHistory;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "replayed_at")
    private Instant replayedAt;

    @Column(name = "replay_batch_uuid")
    private UUID replayBatchUuid;

    public DeadLetterEntry() {
    }

    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public String getDeadLetterQueue() {
        return deadLetterQueue;
    }

    public void setDeadLetterQueue(String deadLetterQueue) {
        this.deadLetterQueue = deadLetterQueue;
    }

    public String getSourceQueue() {
        return sourceQueue;
    }

    public void setSourceQueue(String sourceQueue) {
        this.sourceQueue = sourceQueue;
    }

    public QueueTier getTier() {
        return tier;
    }

    public void setTier(QueueTier tier) {
        this.tier = tier;
    }

    public UUID getMessageUuid() {
        return messageUuid;
    }

    public void setMessageUuid(UUID messageUuid) {
        this.messageUuid = messageUuid;
    }

    public UUID getJobUuid() {
        return jobUuid;
    }

    public void setJobUuid(UUID jobUuid) {
        this.jobUuid = jobUuid;
    }

    public UUID getBatchUuid() {
        return batchUuid;
    }

    public void setBatchUuid(UUID batchUuid) {
        this.batchUuid = batchUuid;
    }

    public String getDocumentReference() {
        return documentReference;
    }

    public void setDocumentReference(String documentReference) {
        this.documentReference = documentReference;
    }

    public String getPayload() {
        return payload;
    }

    public void setPayload(String payload) {
        this.payload = payload;
    }

    public int getAttemptCount() {
        return attemptCount;
    }

    public void setAttemptCount(int attemptCount) {
        this.attemptCount = attemptCount;
    }

    public String getReason() {
        return reason;
    }

    public void setReason(String reason) {
        this.reason = reason;
    }

    public String getLastError() {
        return lastError;
    }

    public void setLastError(String lastError) {
        this.lastError = lastError;
    }

    public List<Map<String, Object>> getFailureHistory() {
        return failureHistory;
    }

    public void setFailureHistory(List<Map<String, Object>> failureHistory) {
        this.failureHistory = failureHistory;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getReplayedAt() {
        return replayedAt;
    }

    public void setReplayedAt(Instant replayedAt) {
        this.replayedAt = replayedAt;
    }

    public UUID getReplayBatchUuid() {
        return replayBatchUuid;
    }

    public void setReplayBatchUuid(UUID replayBatchUuid) {
        this.replayBatchUuid = replayBatchUuid;
    }
}
