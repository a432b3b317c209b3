package com.batchinsight.orchestration;

import com.batchinsight.queue.PriorityQueueSet;
import com.batchinsight.queue.QueueMessage;
import com.batchinsight.shared.dto.SubmitBatchRequest;
import com.batchinsight.shared.exception.BatchNotFoundException;
import com.batchinsight.shared.exception.BatchValidationException;
import com.batchinsight.shared.model.Batch;
import com.batchinsight.shared.model.BatchJob;
import com.batchinsight.shared.model.BatchStatus;
import com.batchinsight.shared.model.FailureKind;
import com.batchinsight.shared.model.JobOutcome;
import com.batchinsight.shared.model.JobStatus;
import com.batchinsight.shared.model.QueueTier;
import com.batchinsight.shared.repository.BatchJobRepository;
import com.batchinsight.shared.repository.BatchRepository;
import com.batchinsight.shared.repository.JobOutcomeRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Transactional steps of the batch lifecycle: submission, preparation (split and enqueue),
 * cancellation and deadline expiry.
 * This is a separate bean from {@link BatchOrchestrator} to avoid @Transactional self-invocation.
 */
@Service
public class BatchLifecycleService {

    private static final Logger logger = LoggerFactory.getLogger(BatchLifecycleService.class);

    static final String DEFAULT_OWNER = "anonymous";
    static final String CANCELLED = "cancelled";
    static final String TIMEOUT = "timeout";

    private static final EnumSet<JobStatus> OUTSTANDING =
            EnumSet.of(JobStatus.QUEUED, JobStatus.IN_FLIGHT, JobStatus.FAILED_RETRYABLE);

    private final BatchRepository batchRepository;
    private final BatchJobRepository batchJobRepository;
    private final JobOutcomeRepository jobOutcomeRepository;
    private final PriorityQueueSet queueSet;
    private final BatchStateMachine stateMachine;
    private final BatchRequestValidator validator;
    private final Duration batchTimeout;

    public BatchLifecycleService(BatchRepository batchRepository,
                                 BatchJobRepository batchJobRepository,
                                 JobOutcomeRepository jobOutcomeRepository,
                                 PriorityQueueSet queueSet,
                                 BatchStateMachine stateMachine,
                                 BatchRequestValidator validator,
                                 @Value("${app.batch.timeout:2h}") Duration batchTimeout) {
        this.batchRepository = batchRepository;
        this.batchJobRepository = batchJobRepository;
        this.jobOutcomeRepository = jobOutcomeRepository;
        this.queueSet = queueSet;
        this.stateMachine = stateMachine;
        this.validator = validator;
        this.batchTimeout = batchTimeout;
    }

    /**
     * Persists the batch as PENDING and validates it. An invalid request leaves the batch
     * in FAILED with the validation message, and the exception carries its id.
     *
     * @throws BatchValidationException if the request is invalid
     */
    @Transactional(noRollbackFor = BatchValidationException.class)
    public Batch submit(SubmitBatchRequest request) {
        Batch batch = new Batch();
        String owner = request.getOwner();
        if (owner == null || owner.isBlank()) {
            owner = DEFAULT_OWNER;
        } else if (owner.length() > BatchRequestValidator.MAX_OWNER_LENGTH) {
            owner = owner.substring(0, BatchRequestValidator.MAX_OWNER_LENGTH);
        }
        batch.setOwner(owner);
        batch.setDocuments(request.getDocuments() != null ? new ArrayList<>(request.getDocuments()) : new ArrayList<>());
        batch.setOptions(request.getOptions());

        Map<String, String> errors = validator.validate(request);
        if (errors.containsKey("priority")) {
            batch.setPriority(QueueTier.NORMAL);
        } else {
            batch.setPriority(QueueTier.fromPriority(request.getPriority()));
        }
        batchRepository.save(batch);

        if (!errors.isEmpty()) {
            String message = "Batch validation failed: " + errors.values().iterator().next();
            stateMachine.transition(batch, BatchStatus.FAILED);
            batch.setErrorMessage(message);
            batchRepository.save(batch);
            logger.warn("Rejected batch {}: {}", batch.getBatchUuid(), errors);
            throw new BatchValidationException(batch.getBatchUuid(), message, errors);
        }

        logger.info("Accepted batch {} from {}: {} document(s), priority {}", batch.getBatchUuid(), owner,
                batch.getDocuments().size(), batch.getPriority());
        return batch;
    }

    /**
     * Claims a PENDING batch and splits it into jobs, enqueuing one message per document.
     * Job rows and queue messages commit together with the RUNNING transition.
     *
     * @return the resulting status, or empty if the batch was not claimable
     */
    @Transactional
    public Optional<BatchStatus> prepare(UUID batchId) {
        Optional<Batch> claimed = batchRepository.claimPendingBatch(batchId);
        if (claimed.isEmpty()) {
            logger.debug("Batch {} is not claimable", batchId);
            return Optional.empty();
        }
        Batch batch = claimed.get();
        stateMachine.transition(batch, BatchStatus.PREPARING);

        List<String> documents = batch.getDocuments();
        if (documents.isEmpty()) {
            batch.setExpectedJobCount(0);
            batch.setResultSummary("Empty batch: no documents to analyze");
            stateMachine.transition(batch, BatchStatus.SUCCEEDED);
            batchRepository.save(batch);
            return Optional.of(batch.getStatus());
        }

        Instant now = Instant.now();
        for (int ordinal = 0; ordinal < documents.size(); ordinal++) {
            BatchJob job = new BatchJob(batch.getBatchUuid(), ordinal, documents.get(ordinal), batch.getPriority());
            job.setEnqueuedAt(now);
            batchJobRepository.save(job);
            queueSet.enqueue(new QueueMessage(job.getJobUuid(), batch.getBatchUuid(), job.getDocumentReference(),
                    batch.getPriority(), batch.getOptions()), batch.getPriority());
        }
        batch.setExpectedJobCount(documents.size());
        batch.setDeadlineAt(now.plus(batchTimeout));
        stateMachine.transition(batch, BatchStatus.RUNNING);
        batchRepository.save(batch);
        logger.info("Prepared batch {}: {} job(s) on {} queue, deadline {}", batch.getBatchUuid(),
                documents.size(), batch.getPriority().queueName(), batch.getDeadlineAt());
        return Optional.of(batch.getStatus());
    }

    /**
     * Marks a non-terminal batch FAILED with cause "cancelled". Outstanding jobs become
     * FAILED_TERMINAL and their messages are purged.
     *
     * @throws BatchNotFoundException if the batch does not exist
     * @throws com.batchinsight.shared.exception.IllegalBatchTransitionException if it is already terminal
     */
    @Transactional
    public Batch cancel(UUID batchId) {
        Batch batch = batchRepository.findByBatchUuidForUpdate(batchId)
                .orElseThrow(() -> new BatchNotFoundException(batchId));
        stateMachine.transition(batch, BatchStatus.FAILED);
        int forced = failOutstandingJobs(batch, FailureKind.CANCELLED, CANCELLED);
        int purged = queueSet.purgeBatch(batchId);
        batch.setErrorMessage(CANCELLED);
        batchRepository.save(batch);
        logger.info("Cancelled batch {}: {} outstanding job(s) failed, {} message(s) purged", batchId, forced, purged);
        return batch;
    }

    /**
     * Forces a RUNNING batch whose deadline passed into AGGREGATING. Outstanding jobs are
     * recorded as timed out.
     *
     * @return true if the batch was expired by this call
     */
    @Transactional
    public boolean expire(UUID batchId) {
        Optional<Batch> locked = batchRepository.findByBatchUuidForUpdate(batchId);
        if (locked.isEmpty()) {
            return false;
        }
        Batch batch = locked.get();
        if (batch.getStatus() != BatchStatus.RUNNING || batch.getDeadlineAt() == null
                || batch.getDeadlineAt().isAfter(Instant.now())) {
            return false;
        }
        int forced = failOutstandingJobs(batch, FailureKind.BATCH_TIMEOUT, TIMEOUT);
        int purged = queueSet.purgeBatch(batchId);
        batch.setDeadlineExceeded(true);
        stateMachine.transition(batch, BatchStatus.AGGREGATING);
        batchRepository.save(batch);
        logger.warn("Batch {} exceeded its deadline: {} outstanding job(s) timed out, {} message(s) purged",
                batchId, forced, purged);
        return true;
    }

    private int failOutstandingJobs(Batch batch, FailureKind kind, String error) {
        List<BatchJob> outstanding = batchJobRepository.findByBatchUuidAndStatusIn(batch.getBatchUuid(), OUTSTANDING);
        Instant now = Instant.now();
        int forced = 0;
        for (BatchJob job : outstanding) {
            job.setStatus(JobStatus.FAILED_TERMINAL);
            job.setLastError(error);
            job.setCompletedAt(now);
            batchJobRepository.save(job);
            if (jobOutcomeRepository.existsByJobUuid(job.getJobUuid())) {
                continue;
            }
            JobOutcome outcome = new JobOutcome();
            outcome.setJobUuid(job.getJobUuid());
            outcome.setBatchUuid(batch.getBatchUuid());
            outcome.setOrdinal(job.getOrdinal());
            outcome.setDocumentReference(job.getDocumentReference());
            outcome.setSucceeded(false);
            outcome.setErrorKind(kind);
            outcome.setErrorMessage(error);
            outcome.setAttempts(job.getAttemptCount());
            outcome.setRecordedAt(now);
            jobOutcomeRepository.save(outcome);
            batch.setFailedCount(batch.getFailedCount() + 1);
            forced++;
        }
        return forced;
    }
}
