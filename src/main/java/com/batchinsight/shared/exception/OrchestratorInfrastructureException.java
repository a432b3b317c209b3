package com.batchinsight.shared.exception;

/**
 * A queue or store the orchestrator depends on is unavailable.
 * Surfaces as HTTP 503 when it reaches a caller.
 */
public class OrchestratorInfrastructureException extends RuntimeException {

    public OrchestratorInfrastructureException(String message) {
        super(message);
    }

    public OrchestratorInfrastructureException(String message, Throwable cause) {
        super(message, cause);
    }
}
