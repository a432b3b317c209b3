package com.batchinsight.processing;

import com.batchinsight.shared.model.BatchStatus;
import com.batchinsight.shared.repository.BatchJobRepository;
import com.batchinsight.shared.repository.BatchRepository;
import com.batchinsight.util.Strings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.UUID;

/**
 * Per-attempt job bookkeeping done by workers. Terminal job states are written only by the
 * aggregator when it records an outcome.
 * This is a separate bean to avoid @Transactional self-invocation.
 */
@Service
public class JobStateService {

    private static final Logger logger = LoggerFactory.getLogger(JobStateService.class);
    private static final int MAX_ERROR_LENGTH = 2000;

    private final BatchRepository batchRepository;
    private final BatchJobRepository batchJobRepository;

    public JobStateService(BatchRepository batchRepository, BatchJobRepository batchJobRepository) {
        this.batchRepository = batchRepository;
        this.batchJobRepository = batchJobRepository;
    }

    /**
     * True while the batch accepts job outcomes. Cancelled, timed-out and deleted batches are not running.
     */
    @Transactional(readOnly = true)
    public boolean isBatchRunning(UUID batchId) {
        return batchRepository.findByBatchUuid(batchId)
                .map(batch -> batch.getStatus() == BatchStatus.RUNNING)
                .orElse(false);
    }

    /**
     * Marks the job IN_FLIGHT for the given attempt.
     *
     * @return false if the job is already terminal or no longer exists
     */
    @Transactional
    public boolean markInFlight(UUID jobId, int attempt) {
        int updated = batchJobRepository.markInFlight(jobId, attempt, Instant.now());
        if (updated == 0) {
            logger.debug("Job {} is terminal or missing; skipping attempt {}", jobId, attempt);
            return false;
        }
        return true;
    }

    @Transactional
    public void markRetryable(UUID jobId, String error) {
        batchJobRepository.markRetryable(jobId, Strings.truncate(error, MAX_ERROR_LENGTH));
    }
}
