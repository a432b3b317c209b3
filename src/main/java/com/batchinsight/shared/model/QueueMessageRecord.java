package com.batchinsight.shared.model;

import jakarta.persistence.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * A message sitting in one of the tier queues. A message is invisible to receivers
 * until visible_at; each receive issues a fresh receipt handle.
 */
@Entity
@Table(name = "queue_messages", indexes = {
    @Index(name = "idx_queue_messages_receive", columnList = "queue_name, visible_at, id"),
    @Index(name = "idx_queue_messages_batch", columnList = "batch_uuid")
})
public class QueueMessageRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "message_uuid", nullable = false, unique = true, updatable = false)
    private UUID messageUuid;

    @Column(name = "queue_name", nullable = false, length = 64)
    private String queueName;

    @Column(name = "job_uuid", nullable = false)
    private UUID jobUuid;

    @Column(name = "batch_uuid", nullable = false)
    private UUID batchUuid;

    @Column(name = "payload", nullable = false, columnDefinition = "TEXT")
    private String payload;

    @Column(name = "receive_count", nullable = false)
    private int receiveCount;

    @Column(name = "receipt_handle", unique = true)
    private UUID receiptHandle;

    @Column(name = "visible_at", nullable = false)
    private Instant visibleAt;

    @Column(name = "enqueued_at", nullable = false)
    private Instant enqueuedAt;

    @Column(name = "last_received_at")
    private Instant lastReceivedAt;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "failure_history", columnDefinition = "JSONB")
    private List<Map<String, Object>> failureHistory = new ArrayList<>();

    public QueueMessageRecord() {
        this.messageUuid = UUID.randomUUID();
    }

    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public UUID getMessageUuid() {
        return messageUuid;
    }

    public void setMessageUuid(UUID messageUuid) {
        this.messageUuid = messageUuid;
    }

    public String getQueueName() {
        return queueName;
    }

    public void setQueueName(String queueName) {
        this.queueName = queueName;
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

    public String getPayload() {
        return payload;
    }

    public void setPayload(String payload) {
        this.payload = payload;
    }

    public int getReceiveCount() {
        return receiveCount;
    }

    public void setReceiveCount(int receiveCount) {
        this.receiveCount = receiveCount;
    }

    public UUID getReceiptHandle() {
        return receiptHandle;
    }

    public void setReceiptHandle(UUID receiptHandle) {
        this.receiptHandle = receiptHandle;
    }

    public Instant getVisibleAt() {
        return visibleAt;
    }

    public void setVisibleAt(Instant visibleAt) {
        this.visibleAt = visibleAt;
    }

    public Instant getEnqueuedAt() {
        return enqueuedAt;
    }

    public void setEnqueuedAt(Instant enqueuedAt) {
        this.enqueuedAt = enqueuedAt;
    }

    public Instant getLastReceivedAt() {
        return lastReceivedAt;
    }

    public void setLastReceivedAt(Instant lastReceivedAt) {
        this.lastReceivedAt = lastReceivedAt;
    }

    public List<Map<String, Object>> getFailureHistory() {
        return failureHistory;
    }

    public void setFailureHistory(List<Map<String, Object>> failureHistory) {
        this.failureHistory = failureHistory;
    }
}
