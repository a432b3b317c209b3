package com.batchinsight.shared.dto;

import com.batchinsight.shared.model.JobOutcome;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.UUID;

/**
 * Per-document entry of an aggregate result.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DocumentOutcome {

    private UUID jobId;
    private int ordinal;
    private String documentReference;
    private boolean succeeded;
    private String verdict;
    private Double confidenceScore;
    private String errorKind;
    private String errorMessage;
    private int attempts;

    public DocumentOutcome() {
    }

    public static DocumentOutcome from(JobOutcome outcome) {
        DocumentOutcome dto = new DocumentOutcome();
        dto.jobId = outcome.getJobUuid();
        dto.ordinal = outcome.getOrdinal();
        dto.documentReference = outcome.getDocumentReference();
        dto.succeeded = outcome.isSucceeded();
        dto.verdict = outcome.getVerdict();
        dto.confidenceScore = outcome.getConfidenceScore();
        dto.errorKind = outcome.getErrorKind() != null ? outcome.getErrorKind().name() : null;
        dto.errorMessage = outcome.getErrorMessage();
        dto.attempts = outcome.getAttempts();
        return dto;
    }

    public UUID getJobId() {
        return jobId;
    }

    public void setJobId(UUID jobId) {
        this.jobId = jobId;
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

    public boolean isSucceeded() {
        return succeeded;
    }

    public void setSucceeded(boolean succeeded) {
        this.succeeded = succeeded;
    }

    public String getVerdict() {
        return verdict;
    }

    public void setVerdict(String verdict) {
        this.verdict = verdict;
    }

    public Double getConfidenceScore() {
        return confidenceScore;
    }

    public void setConfidenceScore(Double confidenceScore) {
        this.confidenceScore = confidenceScore;
    }

    public String getErrorKind() {
        return errorKind;
    }

    public void setErrorKind(String errorKind) {
        this.errorKind = errorKind;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public void setErrorMessage(String errorMessage) {
        this.errorMessage = errorMessage;
    }

    public int getAttempts() {
        return attempts;
    }

    public void setAttempts(int attempts) {
        this.attempts = attempts;
    }
}
