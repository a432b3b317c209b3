package com.batchinsight.processing;

import com.batchinsight.observability.BatchMetricsServiceInterface;
import com.batchinsight.observability.TracingServiceInterface;
import com.batchinsight.queue.FailureRecord;
import com.batchinsight.queue.PriorityQueueSet;
import com.batchinsight.queue.QueueMessage;
import com.batchinsight.queue.ReceivedMessage;
import com.batchinsight.shared.event.JobOutcomeEvent;
import com.batchinsight.shared.model.DeadLetterEntry;
import com.batchinsight.shared.model.FailureKind;
import com.batchinsight.storage.DocumentStore;
import com.batchinsight.storage.MalformedDocumentException;
import com.batchinsight.util.MdcKeys;
import com.batchinsight.util.Strings;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs one delivered job message: fetch, analyze under the per-job timeout, report the outcome,
 * then acknowledge, release or dead-letter the message.
 */
@Service
public class JobExecutor {

    private static final Logger logger = LoggerFactory.getLogger(JobExecutor.class);

    private final PriorityQueueSet queueSet;
    private final DocumentStore documentStore;
    private final AnalysisCapability analysisCapability;
    private final RetryPolicy retryPolicy;
    private final JobStateService jobStateService;
    private final ApplicationEventPublisher eventPublisher;
    private final BatchMetricsServiceInterface metricsService;
    private final TracingServiceInterface tracingService;
    private final Duration jobTimeout;
    private final ExecutorService analysisExecutor;

    public JobExecutor(PriorityQueueSet queueSet,
                       DocumentStore documentStore,
                       AnalysisCapability analysisCapability,
                       RetryPolicy retryPolicy,
                       JobStateService jobStateService,
                       ApplicationEventPublisher eventPublisher,
                       BatchMetricsServiceInterface metricsService,
                       TracingServiceInterface tracingService,
                       @Value("${app.worker.job-timeout:5m}") Duration jobTimeout) {
        this.queueSet = queueSet;
        this.documentStore = documentStore;
        this.analysisCapability = analysisCapability;
        this.retryPolicy = retryPolicy;
        this.jobStateService = jobStateService;
        this.eventPublisher = eventPublisher;
        this.metricsService = metricsService;
        this.tracingService = tracingService;
        this.jobTimeout = jobTimeout;
        CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("analysis-");
        threadFactory.setDaemon(true);
        this.analysisExecutor = Executors.newCachedThreadPool(threadFactory);
    }

    @PreDestroy
    void shutdown() {
        analysisExecutor.shutdownNow();
    }

    public void execute(ReceivedMessage message) {
        QueueMessage body = message.getBody();
        MDC.put(MdcKeys.BATCH_ID, body.getBatchId().toString());
        MDC.put(MdcKeys.JOB_ID, body.getJobId().toString());
        try {
            tracingService.trace("batch.job.execute", Map.of(
                    "batch.id", body.getBatchId().toString(),
                    "job.id", body.getJobId().toString(),
                    "queue.tier", message.getTier().name(),
                    "job.attempt", String.valueOf(message.getReceiveCount())),
                    () -> process(message));
        } finally {
            MDC.remove(MdcKeys.BATCH_ID);
            MDC.remove(MdcKeys.JOB_ID);
        }
    }

    private void process(ReceivedMessage message) {
        QueueMessage body = message.getBody();
        int attempt = message.getReceiveCount();

        if (!jobStateService.isBatchRunning(body.getBatchId())) {
            logger.info("Dropping job {}: batch {} is no longer running", body.getJobId(), body.getBatchId());
            queueSet.acknowledge(message.getReceiptHandle());
            return;
        }
        if (!jobStateService.markInFlight(body.getJobId(), attempt)) {
            logger.info("Dropping duplicate delivery of finished job {}", body.getJobId());
            queueSet.acknowledge(message.getReceiptHandle());
            return;
        }

        logger.info("Processing job {} ({}) attempt {}", body.getJobId(), body.getDocumentReference(), attempt);
        long start = System.currentTimeMillis();
        AnalysisVerdict verdict;
        try {
            byte[] content = documentStore.fetch(body.getDocumentReference());
            verdict = analyzeWithTimeout(new AnalysisRequest(body.getDocumentReference(),
                    new String(content, StandardCharsets.UTF_8), body.getOptions()));
        } catch (AnalysisException e) {
            handleFailure(message, e.getKind(), Strings.describe(e));
            return;
        } catch (MalformedDocumentException e) {
            handleFailure(message, FailureKind.MALFORMED, Strings.describe(e));
            return;
        } catch (IOException e) {
            handleFailure(message, FailureKind.TRANSIENT, "Document store error: " + Strings.describe(e));
            return;
        } catch (RuntimeException e) {
            logger.error("Unexpected error processing job {}", body.getJobId(), e);
            handleFailure(message, FailureKind.TRANSIENT, Strings.describe(e));
            return;
        }

        long durationMs = System.currentTimeMillis() - start;
        try {
            eventPublisher.publishEvent(JobOutcomeEvent.success(body.getBatchId(), body.getJobId(),
                    body.getDocumentReference(), verdict.getVerdict(), verdict.getConfidenceScore(), attempt));
        } catch (RuntimeException e) {
            logger.error("Failed to record outcome of job {}; it will be redelivered", body.getJobId(), e);
            handleFailure(message, FailureKind.TRANSIENT, "Outcome recording failed: " + Strings.describe(e));
            return;
        }
        queueSet.acknowledge(message.getReceiptHandle());
        metricsService.recordJobSuccess(message.getTier(), durationMs);
        logger.info("Job {} succeeded in {}ms with verdict {}", body.getJobId(), durationMs, verdict.getVerdict());
    }

    AnalysisVerdict analyzeWithTimeout(AnalysisRequest request) throws AnalysisException {
        Future<AnalysisVerdict> future = analysisExecutor.submit(() -> analysisCapability.analyze(request));
        try {
            return future.get(jobTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new AnalysisException(FailureKind.TIMEOUT, "Analysis exceeded " + jobTimeout, e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new AnalysisException(FailureKind.TRANSIENT, "Interrupted while waiting for analysis", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof AnalysisException) {
                throw (AnalysisException) cause;
            }
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new AnalysisException(FailureKind.TRANSIENT, Strings.describe(cause), cause);
        }
    }

    private void handleFailure(ReceivedMessage message, FailureKind kind, String error) {
        QueueMessage body = message.getBody();
        int attempt = message.getReceiveCount();
        RetryDecision decision = retryPolicy.decide(queueSet.policy(message.getTier()), attempt, kind,
                jobStateService.isBatchRunning(body.getBatchId()));
        FailureRecord failure = FailureRecord.of(attempt, kind, error);

        if (decision.getAction() == RetryDecision.Action.RETRY) {
            logger.warn("Job {} attempt {} failed ({}): {}; retrying in {}", body.getJobId(), attempt, kind,
                    error, decision.getDelay());
            jobStateService.markRetryable(body.getJobId(), error);
            queueSet.release(message.getReceiptHandle(), decision.getDelay(), failure);
            metricsService.recordRetry(message.getTier(), kind);
            tracingService.addEvent("job.retry", Map.of("failure.kind", kind.name(),
                    "retry.delay_ms", String.valueOf(decision.getDelay().toMillis())));
        } else if (decision.getAction() == RetryDecision.Action.DEAD_LETTER) {
            // The outcome must be recorded while the message can still be redelivered
            try {
                eventPublisher.publishEvent(JobOutcomeEvent.failure(body.getBatchId(), body.getJobId(),
                        body.getDocumentReference(), kind, error, attempt));
            } catch (RuntimeException e) {
                Duration delay = retryPolicy.backoff(attempt, queueSet.policy(message.getTier()).getVisibilityTimeout());
                logger.error("Failed to record terminal outcome of job {}; releasing it for another attempt in {}",
                        body.getJobId(), delay, e);
                queueSet.release(message.getReceiptHandle(), delay, failure);
                return;
            }
            Optional<DeadLetterEntry> entry = queueSet.deadLetter(message.getReceiptHandle(),
                    decision.getReason(), failure);
            if (entry.isEmpty()) {
                logger.warn("Job {} could not be dead-lettered: receipt handle is stale", body.getJobId());
                return;
            }
            logger.warn("Job {} failed terminally after {} attempt(s) ({}): {}", body.getJobId(), attempt,
                    kind, error);
            metricsService.recordJobFailure(message.getTier(), kind);
            tracingService.addEvent("job.dead_letter", Map.of("failure.kind", kind.name(),
                    "dead_letter.queue", message.getTier().deadLetterQueueName()));
        } else {
            logger.info("Abandoning job {}: {}", body.getJobId(), decision.getReason());
            queueSet.acknowledge(message.getReceiptHandle());
        }
    }
}
