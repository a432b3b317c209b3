package com.batchinsight.orchestration;

import com.batchinsight.shared.exception.IllegalBatchTransitionException;
import com.batchinsight.shared.model.Batch;
import com.batchinsight.shared.model.BatchStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * The only place a batch's status is changed. Callers must hold the batch row lock.
 */
@Component
public class BatchStateMachine {

    private static final Logger logger = LoggerFactory.getLogger(BatchStateMachine.class);

    /**
     * Moves the batch to {@code target}.
     *
     * @throws IllegalBatchTransitionException if the transition table does not allow the move
     */
    public void transition(Batch batch, BatchStatus target) {
        BatchStatus current = batch.getStatus();
        if (!current.canTransitionTo(target)) {
            throw new IllegalBatchTransitionException(batch.getBatchUuid(), current, target);
        }
        Instant now = Instant.now();
        batch.setStatus(target);
        if (target == BatchStatus.RUNNING && batch.getStartedAt() == null) {
            batch.setStartedAt(now);
        }
        if (target.isTerminal()) {
            batch.setCompletedAt(now);
        }
        logger.info("Batch {} transitioned {} -> {}", batch.getBatchUuid(), current, target);
    }
}
