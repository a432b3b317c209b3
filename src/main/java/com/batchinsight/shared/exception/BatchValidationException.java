package com.batchinsight.shared.exception;

import java.util.Map;
import java.util.UUID;

/**
 * Thrown when a submitted batch is rejected before any job is created.
 * The batch row is kept in FAILED state with the same message.
 */
public class BatchValidationException extends RuntimeException {

    private final UUID batchId;
    private final Map<String, String> errors;

    public BatchValidationException(UUID batchId, String message, Map<String, String> errors) {
        super(message);
        this.batchId = batchId;
        this.errors = errors == null ? Map.of() : Map.copyOf(errors);
    }

    public UUID getBatchId() {
        return batchId;
    }

    public Map<String, String> getErrors() {
        return errors;
    }
}
