package com.batchinsight.queue;

import com.batchinsight.shared.model.QueueTier;

import java.util.Map;
import java.util.UUID;

/**
 * Wire body of a job message. Serialized as JSON into the queue_messages payload column.
 */
public class QueueMessage {

    private UUID jobId;
    private UUID batchId;
    private String documentReference;
    private int attempt;
    private QueueTier priority;
    private Map<String, Object> options;

    public QueueMessage() {
    }

    public QueueMessage(UUID jobId, UUID batchId, String documentReference, QueueTier priority,
                        Map<String, Object> options) {
        this.jobId = jobId;
        this.batchId = batchId;
        this.documentReference = documentReference;
        this.priority = priority;
        this.options = options;
    }

    public UUID getJobId() {
        return jobId;
    }

    public void setJobId(UUID jobId) {
        this.jobId = jobId;
    }

    public UUID getBatchId() {
        return batchId;
    }

    public void setBatchId(UUID batchId) {
        this.batchId = batchId;
    }

    public String getDocumentReference() {
        return documentReference;
    }

    public void setDocumentReference(String documentReference) {
        this.documentReference = documentReference;
    }

    public int getAttempt() {
        return attempt;
    }

    public void setAttempt(int attempt) {
        this.attempt = attempt;
    }

    public QueueTier getPriority() {
        return priority;
    }

    public void setPriority(QueueTier priority) {
        this.priority = priority;
    }

    public Map<String, Object> getOptions() {
        return options;
    }

    public void setOptions(Map<String, Object> options) {
        this.options = options;
    }
}
