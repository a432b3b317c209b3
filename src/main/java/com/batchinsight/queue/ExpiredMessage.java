package com.batchinsight.queue;

import com.batchinsight.shared.model.QueueTier;

import java.util.UUID;

/**
 * A message the queue will not deliver again: it hit the redelivery ceiling or its body
 * cannot be decoded. It is held invisible under {@link #getReceiptHandle()} until its failed
 * outcome is recorded and it is moved to the dead-letter queue.
 */
public final class ExpiredMessage {

    private final UUID receiptHandle;
    private final QueueTier tier;
    private final UUID jobId;
    private final UUID batchId;
    private final String documentReference;
    private final int attemptCount;
    private final String reason;
    private final FailureRecord failure;

    public ExpiredMessage(UUID receiptHandle, QueueTier tier, UUID jobId, UUID batchId, String documentReference,
                          int attemptCount, String reason, FailureRecord failure) {
        this.receiptHandle = receiptHandle;
        this.tier = tier;
        this.jobId = jobId;
        this.batchId = batchId;
        this.documentReference = documentReference;
        this.attemptCount = attemptCount;
        this.reason = reason;
        this.failure = failure;
    }

    public UUID getReceiptHandle() {
        return receiptHandle;
    }

    public QueueTier getTier() {
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

    public FailureRecord getFailure() {
        return failure;
    }
}
