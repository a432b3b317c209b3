package com.batchinsight.shared.model;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.time.Instant;
import java.util.UUID;

/**
 * Entity representing one per-document job of a batch.
 * Maps to the batch_jobs table.
 */
@Entity
@Table(name = "batch_jobs", indexes = {
    @Index(name = "idx_batch_jobs_batch_status", columnList = "batch_uuid, status")
})
public class BatchJob {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "job_uuid", nullable = false, unique = true, updatable = false)
    @NotNull
    private UUID jobUuid;

    @Column(name = "batch_uuid", nullable = false, updatable = false)
    @NotNull
    private UUID batchUuid;

    @Column(name = "ordinal", nullable = false)
    private int ordinal;

    @Column(name = "document_reference", nullable = false, length = 1024)
    @Size(max = 1024)
    private String documentReference;

    @Enumerated(EnumType.STRING)
    @Column(name = "priority", nullable = false, length = 10)
    private QueueTier priority;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private JobStatus status = JobStatus.QUEUED;

    @Column(name = "attempt_count", nullable = false)
    private int attemptCount;

    @Column(name = "last_error", columnDefinition = "TEXT")
    private String lastError;

    @Column(name = "enqueued_at")
    private Instant enqueuedAt;

    @Column(name = "last_dequeued_at")
    private Instant lastDequeuedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    public BatchJob() {
        this.jobUuid = UUID.randomUUID();
    }

    public BatchJob(UUID batchUuid, int ordinal, String documentReference, QueueTier priority) {
        this.jobUuid = UUID.randomUUID();
        this.batchUuid = batchUuid;
        this.ordinal = ordinal;
        this.documentReference = documentReference;
        this.priority = priority;
    }

    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
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

    public int getOrdinal() {
        return ordinal;
    }

    public void setOrdinal(int ordinal) {
        this.ordinal = ordinal;
    }

    public String getDocumentReference() {
        return documentReference;
    }

    public void setDocumentReference(String documentReference) {
        this.documentReference = documentReference;
    }

    public QueueTier getPriority() {
        return priority;
    }

    public void setPriority(QueueTier priority) {
        this.priority = priority;
    }

    public JobStatus getStatus() {
        return status;
    }

    public void setStatus(JobStatus status) {
        this.status = status;
    }

    public int getAttemptCount() {
        return attemptCount;
    }

    public void setAttemptCount(int attemptCount) {
        this.attemptCount = attemptCount;
    }

    public String getLastError() {
        return lastError;
    }

    public void setLastError(String lastError) {
        this.lastError = lastError;
    }

    public Instant getEnqueuedAt() {
        return enqueuedAt;
    }

    public void setEnqueuedAt(Instant enqueuedAt) {
        this.enqueuedAt = enqueuedAt;
    }

    public Instant getLastDequeuedAt() {
        return lastDequeuedAt;
    }

    public void setLastDequeuedAt(Instant lastDequeuedAt) {
        this.lastDequeuedAt = lastDequeuedAt;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }

    public void setCompletedAt(Instant completedAt) {
        this.completedAt = completedAt;
    }
}
