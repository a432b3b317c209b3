package com.batchinsight.shared.dto;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Batch-level result: counters, per-document outcomes and the decided status.
 */
public class AggregateResult {

    private UUID batchId;
    private String status;
    private int total;
    private int succeeded;
    private int failed;
    private boolean deadlineExceeded;
    private List<DocumentOutcome> outcomes = new ArrayList<>();

    public AggregateResult() {
    }

    public AggregateResult(UUID batchId, String status, int total, int succeeded, int failed,
                           boolean deadlineExceeded, List<DocumentOutcome> outcomes) {
        this.batchId = batchId;
        this.status = status;
        this.total = total;
        this.succeeded = succeeded;
        this.failed = failed;
        this.deadlineExceeded = deadlineExceeded;
        this.outcomes = outcomes;
    }

    public UUID getBatchId() {
        return batchId;
    }

    public void setBatchId(UUID batchId) {
        this.batchId = batchId;
    }

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }

    public int getTotal() {
        return total;
    }

    public void setTotal(int total) {
        this.total = total;
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

    public boolean isDeadlineExceeded() {
        return deadlineExceeded;
    }

    public void setDeadlineExceeded(boolean deadlineExceeded) {
        this.deadlineExceeded = deadlineExceeded;
    }

    public List<DocumentOutcome> getOutcomes() {
        return outcomes;
    }

    public void setOutcomes(List<DocumentOutcome> outcomes) {
        this.outcomes = outcomes;
    }
}
