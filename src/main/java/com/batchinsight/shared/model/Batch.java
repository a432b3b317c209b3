package com.batchinsight.shared.model;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.UpdateTimestamp;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Entity representing a submitted batch of documents.
 * Maps to the batches table. Status is only changed through BatchStateMachine.
 */
@Entity
@Table(name = "batches", indexes = {
    @Index(name = "idx_batches_status_created", columnList = "status, created_at"),
    @Index(name = "idx_batches_status_deadline", columnList = "status, deadline_at")
})
public class Batch {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "batch_uuid", nullable = false, unique = true, updatable = false)
    @NotNull
    private UUID batchUuid;

    @Column(name = "owner", nullable = false, length = 255)
    @Size(max = 255)
    private String owner;

    @Enumerated(EnumType.STRING)
    @Column(name = "priority", nullable = false, length = 10)
    private QueueTier priority = QueueTier.NORMAL;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private BatchStatus status = BatchStatus.PENDING;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "documents", nullable = false, columnDefinition = "JSONB")
    private List<String> documents = new ArrayList<>();

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "options", columnDefinition = "JSONB")
    private Map<String, Object> options;

    @Column(name = "expected_job_count")
    private Integer expectedJobCount;

    @Column(name = "succeeded_count", nullable = false)
    private int succeededCount;

    @Column(name = "failed_count", nullable = false)
    private int failedCount;

    @Column(name = "prepare_attempts", nullable = false)
    private int prepareAttempts;

    @Column(name = "deadline_exceeded", nullable = false)
    private boolean deadlineExceeded;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @Column(name = "result_summary", columnDefinition = "TEXT")
    private String resultSummary;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "deadline_at")
    private Instant deadlineAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "notified_at")
    private Instant notifiedAt;

    public Batch() {
        this.batchUuid = UUID.randomUUID();
    }

    public Batch(UUID batchUuid) {
        this.batchUuid = batchUuid;
    }

    /**
     * Number of jobs with a recorded terminal outcome.
     */
    public int getTerminalCount() {
        return succeededCount + failedCount;
    }

    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public UUID getBatchUuid() {
        return batchUuid;
    }

    public void setBatchUuid(UUID batchUuid) {
        this.batchUuid = batchUuid;
    }

    public String getOwner() {
        return owner;
    }

    public void setOwner(String owner) {
        this.owner = owner;
    }

    public QueueTier getPriority() {
        return priority;
    }

    public void setPriority(QueueTier priority) {
        this.priority = priority;
    }

    public BatchStatus getStatus() {
        return status;
    }

    public void setStatus(BatchStatus status) {
        this.status = status;
    }

    public List<String> getDocuments() {
        return documents;
    }

    public void setDocuments(List<String> documents) {
        this.documents = documents;
    }

    public Map<String, Object> getOptions() {
        return options;
    }

    public void setOptions(Map<String, Object> options) {
        this.options = options;
    }

    public Integer getExpectedJobCount() {
        return expectedJobCount;
    }

    public void setExpectedJobCount(Integer expectedJobCount) {
        this.expectedJobCount = expectedJobCount;
    }

    public int getSucceededCount() {
        return succeededCount;
    }

    public void setSucceededCount(int succeededCount) {
        this.succeededCount = succeededCount;
    }

    public int getFailedCount() {
        return failedCount;
    }

    public void setFailedCount(int failedCount) {
        this.failedCount = failedCount;
    }

    public int getPrepareAttempts() {
        return prepareAttempts;
    }

    public void setPrepareAttempts(int prepareAttempts) {
        this.prepareAttempts = prepareAttempts;
    }

    public boolean isDeadlineExceeded() {
        return deadlineExceeded;
    }

    public void setDeadlineExceeded(boolean deadlineExceeded) {
        this.deadlineExceeded = deadlineExceeded;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public void setErrorMessage(String errorMessage) {
        this.errorMessage = errorMessage;
    }

    public String getResultSummary() {
        return resultSummary;
    }

    public void setResultSummary(String resultSummary) {
        this.resultSummary = resultSummary;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public void setStartedAt(Instant startedAt) {
        this.startedAt = startedAt;
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

    public Instant getNotifiedAt() {
        return notifiedAt;
    }

    public void setNotifiedAt(Instant notifiedAt) {
        this.notifiedAt = notifiedAt;
    }
}
