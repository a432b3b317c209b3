package com.batchinsight.shared.dto;

import java.util.UUID;

/**
 * DTO returned after a batch is accepted.
 */
public class SubmitBatchResponse {

    private UUID batchId;
    private String status;
    private String statusUrl;

    public SubmitBatchResponse() {
    }

    public SubmitBatchResponse(UUID batchId, String status, String statusUrl) {
        this.batchId = batchId;
        this.status = status;
        this.statusUrl = statusUrl;
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

    public String getStatusUrl() {
        return statusUrl;
    }

    public void setStatusUrl(String statusUrl) {
        this.statusUrl = statusUrl;
    }
}
