package com.batchinsight.shared.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Size;

import java.util.List;
import java.util.Map;

/**
 * Request body for batch submission. Document-level checks are done by
 * BatchRequestValidator after the batch row exists.
 */
@Schema(description = "Batch submission request")
public class SubmitBatchRequest {

    @Size(max = 255, message = "owner must be at most 255 characters")
    @Schema(description = "Submitting owner", example = "claims-team")
    private String owner;

    @Schema(description = "Document references to analyze", example = "[\"local://inbox/a.txt\"]")
    private List<String> documents;

    @Schema(description = "Batch priority", allowableValues = {"high", "normal", "low"}, example = "normal")
    private String priority;

    @Schema(description = "Opaque analysis options passed to every job")
    private Map<String, Object> options;

    public SubmitBatchRequest() {
    }

    public SubmitBatchRequest(String owner, List<String> documents, String priority, Map<String, Object> options) {
        this.owner = owner;
        this.documents = documents;
        this.priority = priority;
        this.options = options;
    }

    public String getOwner() {
        return owner;
    }

    public void setOwner(String owner) {
        this.owner = owner;
    }

    public List<String> getDocuments() {
        return documents;
    }

    public void setDocuments(List<String> documents) {
        this.documents = documents;
    }

    public String getPriority() {
        return priority;
    }

    public void setPriority(String priority) {
        this.priority = priority;
    }

    public Map<String, Object> getOptions() {
        return options;
    }

    public void setOptions(Map<String, Object> options) {
        this.options = options;
    }
}
