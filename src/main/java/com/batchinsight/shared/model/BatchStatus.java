package com.batchinsight.shared.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle states of a batch.
 * Transitions only move forward along
 * PENDING -> PREPARING -> RUNNING -> AGGREGATING -> terminal.
 */
public enum BatchStatus {
    PENDING,
    PREPARING,
    RUNNING,
    AGGREGATING,
    SUCCEEDED,
    PARTIALLY_FAILED,
    FAILED,
    TIMED_OUT;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == PARTIALLY_FAILED || this == FAILED || this == TIMED_OUT;
    }

    /**
     * States reachable from this one in a single step.
     */
    public Set<BatchStatus> allowedTargets() {
        switch (this) {
            case PENDING:
                return EnumSet.of(PREPARING, FAILED);
            case PREPARING:
                // SUCCEEDED is the empty-batch short circuit
                return EnumSet.of(RUNNING, SUCCEEDED, FAILED);
            case RUNNING:
                return EnumSet.of(AGGREGATING, FAILED, TIMED_OUT);
            case AGGREGATING:
                return EnumSet.of(SUCCEEDED, PARTIALLY_FAILED, FAILED, TIMED_OUT);
            default:
                return EnumSet.noneOf(BatchStatus.class);
        }
    }

    public boolean canTransitionTo(BatchStatus target) {
        return allowedTargets().contains(target);
    }
}
