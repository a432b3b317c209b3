package com.batchinsight.orchestration;

import com.batchinsight.shared.dto.AggregateResult;
import com.batchinsight.shared.dto.DocumentOutcome;
import com.batchinsight.shared.event.JobOutcomeEvent;
import com.batchinsight.shared.exception.BatchNotFoundException;
import com.batchinsight.shared.model.Batch;
import com.batchinsight.shared.model.BatchJob;
import com.batchinsight.shared.model.BatchStatus;
import com.batchinsight.shared.model.JobOutcome;
import com.batchinsight.shared.model.JobStatus;
import com.batchinsight.shared.repository.BatchJobRepository;
import com.batchinsight.shared.repository.BatchRepository;
import com.batchinsight.shared.repository.JobOutcomeRepository;
import com.batchinsight.util.Strings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Folds per-job outcomes into the batch tally and decides the terminal status.
 * Every mutation runs under the batch row lock, so outcome application is serialized per batch.
 */
@Service
public class Aggregator {

    private static final Logger logger = LoggerFactory.getLogger(Aggregator.class);
    private static final int MAX_ERROR_LENGTH = 2000;

    private final BatchRepository batchRepository;
    private final BatchJobRepository batchJobRepository;
    private final JobOutcomeRepository jobOutcomeRepository;
    private final BatchStateMachine stateMachine;
    private final DecisionPolicy decisionPolicy;

    public Aggregator(BatchRepository batchRepository,
                      BatchJobRepository batchJobRepository,
                      JobOutcomeRepository jobOutcomeRepository,
                      BatchStateMachine stateMachine,
                      DecisionPolicy decisionPolicy) {
        this.batchRepository = batchRepository;
        this.batchJobRepository = batchJobRepository;
        this.jobOutcomeRepository = jobOutcomeRepository;
        this.stateMachine = stateMachine;
        this.decisionPolicy = decisionPolicy;
    }

    /**
     * Applies one job outcome. Duplicates and outcomes for batches that are no longer
     * RUNNING are ignored.
     *
     * @return true if this outcome completed the batch and moved it to AGGREGATING
     */
    @Transactional
    public boolean recordOutcome(JobOutcomeEvent event) {
        Optional<Batch> locked = batchRepository.findByBatchUuidForUpdate(event.getBatchId());
        if (locked.isEmpty()) {
            logger.warn("Ignoring outcome of job {}: batch {} does not exist", event.getJobId(), event.getBatchId());
            return false;
        }
        Batch batch = locked.get();
        if (batch.getStatus() != BatchStatus.RUNNING) {
            logger.info("Ignoring outcome of job {}: batch {} is {}", event.getJobId(), batch.getBatchUuid(),
                    batch.getStatus());
            return false;
        }
        if (jobOutcomeRepository.existsByJobUuid(event.getJobId())) {
            logger.info("Ignoring duplicate outcome of job {}", event.getJobId());
            return false;
        }
        Optional<BatchJob> jobLookup = batchJobRepository.findByJobUuid(event.getJobId());
        if (jobLookup.isEmpty() || !jobLookup.get().getBatchUuid().equals(batch.getBatchUuid())) {
            logger.warn("Ignoring outcome of job {}: not part of batch {}", event.getJobId(), batch.getBatchUuid());
            return false;
        }
        BatchJob job = jobLookup.get();

        Instant now = Instant.now();
        JobOutcome outcome = new JobOutcome();
        outcome.setJobUuid(job.getJobUuid());
        outcome.setBatchUuid(batch.getBatchUuid());
        outcome.setOrdinal(job.getOrdinal());
        outcome.setDocumentReference(job.getDocumentReference());
        outcome.setSucceeded(event.isSucceeded());
        outcome.setAttempts(Math.max(event.getAttempts(), job.getAttemptCount()));
        outcome.setRecordedAt(now);
        if (event.isSucceeded()) {
            outcome.setVerdict(event.getVerdict());
            outcome.setConfidenceScore(event.getConfidenceScore());
            batch.setSucceededCount(batch.getSucceededCount() + 1);
            job.setStatus(JobStatus.SUCCEEDED);
            job.setLastError(null);
        } else {
            outcome.setErrorKind(event.getFailureKind());
            outcome.setErrorMessage(Strings.truncate(event.getErrorMessage(), MAX_ERROR_LENGTH));
            batch.setFailedCount(batch.getFailedCount() + 1);
            job.setStatus(JobStatus.FAILED_TERMINAL);
            job.setLastError(Strings.truncate(event.getErrorMessage(), MAX_ERROR_LENGTH));
        }
        job.setAttemptCount(outcome.getAttempts());
        job.setCompletedAt(now);
        jobOutcomeRepository.save(outcome);
        batchJobRepository.save(job);

        int expected = batch.getExpectedJobCount() != null ? batch.getExpectedJobCount() : 0;
        logger.debug("Batch {} tally: {} succeeded, {} failed of {}", batch.getBatchUuid(),
                batch.getSucceededCount(), batch.getFailedCount(), expected);
        boolean complete = batch.getTerminalCount() >= expected;
        if (complete) {
            stateMachine.transition(batch, BatchStatus.AGGREGATING);
        }
        batchRepository.save(batch);
        return complete;
    }

    /**
     * Resolves an AGGREGATING batch to its terminal status. Calling it again for a batch
     * that is already terminal just returns the stored result.
     */
    @Transactional
    public AggregateResult finalizeBatch(UUID batchId) {
        Batch batch = batchRepository.findByBatchUuidForUpdate(batchId)
                .orElseThrow(() -> new BatchNotFoundException(batchId));
        if (batch.getStatus() == BatchStatus.AGGREGATING) {
            int total = batch.getExpectedJobCount() != null ? batch.getExpectedJobCount() : 0;
            BatchStatus decided = decisionPolicy.decide(total, batch.getFailedCount(), batch.isDeadlineExceeded());
            stateMachine.transition(batch, decided);
            batch.setResultSummary(decisionPolicy.summarize(decided, total, batch.getSucceededCount(),
                    batch.getFailedCount()));
            batchRepository.save(batch);
        } else if (!batch.getStatus().isTerminal()) {
            throw new IllegalStateException("Batch " + batchId + " cannot be finalized while " + batch.getStatus());
        }
        return toResult(batch);
    }

    /**
     * Current aggregate view, built from the stored outcomes.
     */
    @Transactional(readOnly = true)
    public AggregateResult snapshot(UUID batchId) {
        Batch batch = batchRepository.findByBatchUuid(batchId)
                .orElseThrow(() -> new BatchNotFoundException(batchId));
        return toResult(batch);
    }

    AggregateResult toResult(Batch batch) {
        List<DocumentOutcome> outcomes = jobOutcomeRepository.findByBatchUuidOrderByOrdinalAsc(batch.getBatchUuid())
                .stream()
                .map(DocumentOutcome::from)
                .toList();
        int total = batch.getExpectedJobCount() != null ? batch.getExpectedJobCount() : batch.getDocuments().size();
        return new AggregateResult(batch.getBatchUuid(), batch.getStatus().name(), total,
                batch.getSucceededCount(), batch.getFailedCount(), batch.isDeadlineExceeded(), outcomes);
    }
}
