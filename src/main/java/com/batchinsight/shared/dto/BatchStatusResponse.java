package com.batchinsight.shared.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.UUID;

/**
 * DTO for batch status. {@code result} is only present once the batch is terminal.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class BatchStatusResponse {

    private UUID batchId;
    private String owner;
    private String status;
    private String priority;
    private ProgressInfo progress;
    private String errorMessage;
    private Instant createdAt;
    private Instant deadlineAt;
    private Instant completedAt;
    private AggregateResult result;

    public BatchStatusResponse() {
    }

    public UUID getBatchId() {
        return batchId;
    }

    public void setBatchId(UUID batchId) {
        this.batchId = batchId;
    }

    public String getOwner() {
        return owner;
    }

    public void setOwner(String owner) {
        this.owner = owner;
    }

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }

    public String getPriority() {
        return priority;
    }

    public void setPriority(String priority) {
        this.priority = priority;
    }

    public ProgressInfo getProgress() {
        return progress;
    }

    public void setProgress(ProgressInfo progress) {
        this.progress = progress;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public void setErrorMessage(String errorMessage) {
        this.errorMessage = errorMessage;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getDeadlineAt() {
        return deadlineAt;
    }

    public void setDeadlineAt(Instant deadlineAt) {
        this.deadlineAt = deadlineAt;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }

    public void setCompletedAt(Instant completedAt) {
        this.completedAt = completedAt;
    }

    public AggregateResult getResult() {
        return result;
    }

    public void setResult(AggregateResult result) {
        this.result = result;
    }

    /**
     * Nested DTO for progress counters.
     */
    public static class ProgressInfo {
        private Integer expected;
        private int succeeded;
        private int failed;
        private Integer percentComplete;

        public ProgressInfo() {
        }

        public ProgressInfo(Integer expected, int succeeded, int failed) {
            this.expected = expected;
            this.succeeded = succeeded;
            this.failed = failed;
            if (expected != null && expected > 0) {
                this.percentComplete = (succeeded + failed) * 100 / expected;
            } else if (expected != null) {
                this.percentComplete = 100;
            }
        }

        public Integer getExpected() {
            return expected;
        }

        public void setExpected(Integer expected) {
            this.expected = expected;
        }

        public int getSucceeded() {
            return succeeded;
        }

        public void setSucceeded(int succeeded) {
            this.succeeded = succeeded;
        }

        public int getFailed() {
            return failed;
        }

        public void setFailed(int failed) {
            this.failed = failed;
        }

        public Integer getPercentComplete() {
            return percentComplete;
        }

        public void setPercentComplete(Integer percentComplete) {
            this.percentComplete = percentComplete;
        }
    }
}
