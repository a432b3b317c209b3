package com.batchinsight.orchestration;

import com.batchinsight.shared.model.Batch;
import com.batchinsight.shared.model.BatchStatus;
import com.batchinsight.shared.repository.BatchRepository;
import com.batchinsight.util.Strings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;
import java.util.UUID;

/**
 * Records orchestration failures on the batch. Runs in its own transaction so the
 * record survives the rollback of the step that failed.
 */
@Service
public class BatchErrorHandler {

    private static final Logger logger = LoggerFactory.getLogger(BatchErrorHandler.class);
    private static final int MAX_ERROR_LENGTH = 2000;

    private final BatchRepository batchRepository;
    private final BatchStateMachine stateMachine;

    public BatchErrorHandler(BatchRepository batchRepository, BatchStateMachine stateMachine) {
        this.batchRepository = batchRepository;
        this.stateMachine = stateMachine;
    }

    /**
     * Moves a non-terminal batch to FAILED with the given error.
     *
     * @return false if the batch is missing or already terminal
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean forceFailed(UUID batchId, String error) {
        Optional<Batch> locked = batchRepository.findByBatchUuidForUpdate(batchId);
        if (locked.isEmpty() || locked.get().getStatus().isTerminal()) {
            return false;
        }
        Batch batch = locked.get();
        stateMachine.transition(batch, BatchStatus.FAILED);
        batch.setErrorMessage(Strings.truncate(error, MAX_ERROR_LENGTH));
        batchRepository.save(batch);
        logger.error("Batch {} forced to FAILED: {}", batchId, error);
        return true;
    }

    /**
     * Counts a failed preparation attempt on a batch that is still PENDING.
     *
     * @return the attempt count after this failure, 0 if the batch is no longer PENDING
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public int recordPrepareFailure(UUID batchId, String error) {
        Optional<Batch> locked = batchRepository.findByBatchUuidForUpdate(batchId);
        if (locked.isEmpty() || locked.get().getStatus() != BatchStatus.PENDING) {
            return 0;
        }
        Batch batch = locked.get();
        batch.setPrepareAttempts(batch.getPrepareAttempts() + 1);
        batch.setErrorMessage(Strings.truncate(error, MAX_ERROR_LENGTH));
        batchRepository.save(batch);
        logger.warn("Preparation of batch {} failed (attempt {}): {}", batchId, batch.getPrepareAttempts(), error);
        return batch.getPrepareAttempts();
    }
}
