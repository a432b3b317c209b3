package com.batchinsight.shared.exception;

import com.batchinsight.shared.model.BatchStatus;

import java.util.UUID;

public class IllegalBatchTransitionException extends IllegalStateException {

    public IllegalBatchTransitionException(UUID batchId, BatchStatus from, BatchStatus to) {
        super("Batch " + batchId + " cannot move from " + from + " to " + to);
    }
}
