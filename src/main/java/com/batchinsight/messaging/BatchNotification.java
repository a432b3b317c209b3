package com.batchinsight.messaging;

import java.time.Instant;
import java.util.UUID;

/**
 * Event emitted once a batch reaches a terminal state.
 */
public class BatchNotification {

    private final UUID batchId;
    private final String owner;
    private final String status;
    private final String summary;
    private final int succeeded;
    private final int failed;
    private final Instant completedAt;

    public BatchNotification(UUID batchId, String owner, String status, String summary,
                             int succeeded, int failed, Instant completedAt) {
        this.batchId = batchId;
        this.owner = owner;
        this.status = status;
        this.summary = summary;
        this.succeeded = succeeded;
        this.failed = failed;
        this.completedAt = completedAt;
    }

    public UUID getBatchId() {
        return batchId;
    }

    public String getOwner() {
        return owner;
    }

    public String getStatus() {
        return status;
    }

    public String getSummary() {
        return summary;
    }

    public int getSucceeded() {
        return succeeded;
    }

    public int getFailed() {
        return failed;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }
}
