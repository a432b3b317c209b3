package com.batchinsight.orchestration;

import com.batchinsight.processing.JobExecutor;
import com.batchinsight.queue.PriorityQueueSet;
import com.batchinsight.queue.ReceivedMessage;
import com.batchinsight.shared.dto.AggregateResult;
import com.batchinsight.shared.dto.DocumentOutcome;
import com.batchinsight.shared.dto.SubmitBatchRequest;
import com.batchinsight.shared.event.JobOutcomeEvent;
import com.batchinsight.shared.exception.BatchValidationException;
import com.batchinsight.shared.exception.IllegalBatchTransitionException;
import com.batchinsight.shared.model.Batch;
import com.batchinsight.shared.model.BatchJob;
import com.batchinsight.shared.model.BatchStatus;
import com.batchinsight.shared.model.DeadLetterEntry;
import com.batchinsight.shared.model.JobStatus;
import com.batchinsight.shared.model.QueueTier;
import com.batchinsight.shared.repository.BatchJobRepository;
import com.batchinsight.shared.repository.BatchRepository;
import com.batchinsight.shared.repository.DeadLetterEntryRepository;
import com.batchinsight.shared.repository.QueueMessageRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowable;

/**
 * End-to-end batch scenarios against PostgreSQL: submission, preparation, job execution
 * through the queues and aggregation into the final batch status. Workers and schedulers
 * are disabled; the test drives each step.
 */
@SpringBootTest
@ActiveProfiles("test")
@Testcontainers(disabledWithoutDocker = true)
class BatchProcessingScenarioTest {

    private static final Path STORAGE_DIR = createStorageDir();

    @Container
    @SuppressWarnings("resource")
    static final PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:15-alpine")
            .withDatabaseName("batchinsight_test")
            .withUsername("postgres")
            .withPassword("postgres");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("app.storage.local-dir", STORAGE_DIR::toString);
    }

    @Autowired
    private BatchOrchestrator orchestrator;

    @Autowired
    private BatchQueryService queryService;

    @Autowired
    private DeadLetterService deadLetterService;

    @Autowired
    private PriorityQueueSet queueSet;

    @Autowired
    private JobExecutor jobExecutor;

    @Autowired
    private BatchRepository batchRepository;

    @Autowired
    private BatchJobRepository jobRepository;

    @Autowired
    private QueueMessageRepository queueMessageRepository;

    @Autowired
    private DeadLetterEntryRepository deadLetterEntryRepository;

    private static Path createStorageDir() {
        try {
            return Files.createTempDirectory("batchinsight-scenario");
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    @BeforeEach
    void cleanQueues() {
        queueMessageRepository.deleteAll();
        deadLetterEntryRepository.deleteAll();
    }

    private String document(String name, String content) throws IOException {
        Files.writeString(STORAGE_DIR.resolve(name), content, StandardCharsets.UTF_8);
        return "local://" + name;
    }

    private UUID submitAndPrepare(String priority, List<String> documents) {
        Batch batch = orchestrator.submit(new SubmitBatchRequest("claims", documents, priority, Map.of("language", "en")));
        orchestrator.prepare(batch.getBatchUuid());
        return batch.getBatchUuid();
    }

    /**
     * Runs jobs until every queue is empty. Returns the number of executed deliveries.
     */
    private int drainQueues() {
        int executed = 0;
        while (true) {
            List<ReceivedMessage> messages = queueSet.dequeueNext(Duration.ofMillis(200));
            if (messages.isEmpty()) {
                return executed;
            }
            for (ReceivedMessage message : messages) {
                jobExecutor.execute(message);
                executed++;
            }
        }
    }

    private Batch reload(UUID batchId) {
        return batchRepository.findByBatchUuid(batchId).orElseThrow();
    }

    @Test
    void allDocumentsSucceed_batchSucceeds() throws IOException {
        // Given
        List<String> documents = List.of(
                document("ok-1.txt", "Quarterly summary for the claims team."),
                document("ok-2.txt", "Routine policy renewal notice."),
                document("ok-3.txt", "Adjuster notes with nothing unusual."));

        // When
        UUID batchId = submitAndPrepare("high", documents);
        assertThat(reload(batchId).getStatus()).isEqualTo(BatchStatus.RUNNING);
        assertThat(reload(batchId).getExpectedJobCount()).isEqualTo(3);
        int executed = drainQueues();

        // Then
        assertThat(executed).isEqualTo(3);
        Batch batch = reload(batchId);
        assertThat(batch.getStatus()).isEqualTo(BatchStatus.SUCCEEDED);
        assertThat(batch.getSucceededCount()).isEqualTo(3);
        assertThat(batch.getFailedCount()).isZero();
        assertThat(batch.getCompletedAt()).isNotNull();
        assertThat(batch.getNotifiedAt()).isNotNull();
        assertThat(batch.getResultSummary()).isEqualTo("3 of 3 document(s) succeeded, 0 failed");

        AggregateResult result = queryService.getResult(batchId);
        assertThat(result.getOutcomes()).extracting(DocumentOutcome::getOrdinal).containsExactly(0, 1, 2);
        assertThat(result.getOutcomes()).allMatch(DocumentOutcome::isSucceeded);
        assertThat(result.getOutcomes()).extracting(DocumentOutcome::getVerdict).containsOnly("low");
        assertThat(jobRepository.findByBatchUuidOrderByOrdinalAsc(batchId))
                .extracting(BatchJob::getStatus).containsOnly(JobStatus.SUCCEEDED);
    }

    @Test
    void someDocumentsFail_batchPartiallyFailsAndFailuresAreDeadLettered() throws IOException {
        // Given: one rejected document and one that does not exist
        List<String> documents = List.of(
                document("mixed-1.txt", "Routine renewal."),
                document("mixed-2.txt", "This text carries [[reject]] and is refused."),
                document("mixed-3.txt", "Claims backlog report."),
                "local://does-not-exist.txt",
                document("mixed-5.txt", "Premium adjustment letter."));

        // When
        UUID batchId = submitAndPrepare("normal", documents);
        drainQueues();

        // Then
        Batch batch = reload(batchId);
        assertThat(batch.getStatus()).isEqualTo(BatchStatus.PARTIALLY_FAILED);
        assertThat(batch.getSucceededCount()).isEqualTo(3);
        assertThat(batch.getFailedCount()).isEqualTo(2);

        AggregateResult result = queryService.getResult(batchId);
        assertThat(result.getTotal()).isEqualTo(5);
        List<String> failedKinds = new ArrayList<>();
        for (DocumentOutcome outcome : result.getOutcomes()) {
            if (!outcome.isSucceeded()) {
                failedKinds.add(outcome.getErrorKind());
            }
        }
        assertThat(failedKinds).containsExactly("REJECTED", "MALFORMED");

        List<DeadLetterEntry> deadLetters = deadLetterEntryRepository.findByBatchUuid(batchId);
        assertThat(deadLetters).hasSize(2);
        assertThat(deadLetters).extracting(DeadLetterEntry::getDeadLetterQueue)
                .containsOnly(QueueTier.NORMAL.deadLetterQueueName());
    }

    @Test
    void everyDocumentFails_batchFails() throws IOException {
        UUID batchId = submitAndPrepare("low", List.of(
                document("bad-1.txt", "[[reject]]"),
                "local://missing-too.txt"));
        drainQueues();

        Batch batch = reload(batchId);
        assertThat(batch.getStatus()).isEqualTo(BatchStatus.FAILED);
        assertThat(batch.getResultSummary()).isEqualTo("0 of 2 document(s) succeeded, 2 failed");
    }

    @Test
    void emptyBatch_succeedsWithoutQueueingJobs() {
        UUID batchId = submitAndPrepare("normal", List.of());

        Batch batch = reload(batchId);
        assertThat(batch.getStatus()).isEqualTo(BatchStatus.SUCCEEDED);
        assertThat(batch.getExpectedJobCount()).isZero();
        assertThat(batch.getResultSummary()).isEqualTo("Empty batch: no documents to analyze");
        assertThat(queueMessageRepository.findByBatchUuid(batchId)).isEmpty();
    }

    @Test
    void invalidBatch_isStoredAsFailedAndRejected() {
        SubmitBatchRequest request = new SubmitBatchRequest("claims", List.of("local://a.txt", " "), "normal", null);

        Throwable thrown = catchThrowable(() -> orchestrator.submit(request));

        assertThat(thrown).isInstanceOf(BatchValidationException.class);
        UUID batchId = ((BatchValidationException) thrown).getBatchId();
        Batch batch = reload(batchId);
        assertThat(batch.getStatus()).isEqualTo(BatchStatus.FAILED);
        assertThat(batch.getErrorMessage()).startsWith("Batch validation failed");
        assertThat(jobRepository.countByBatchUuid(batchId)).isZero();
    }

    @Test
    void deadlineExceeded_batchTimesOut() throws IOException {
        // Given: a running batch whose deadline has passed before any job ran
        UUID batchId = submitAndPrepare("normal", List.of(
                document("late-1.txt", "Slow document one."),
                document("late-2.txt", "Slow document two.")));
        Batch running = reload(batchId);
        running.setDeadlineAt(Instant.now().minusSeconds(5));
        batchRepository.save(running);

        // When
        boolean expired = orchestrator.timeOut(batchId);

        // Then
        assertThat(expired).isTrue();
        Batch batch = reload(batchId);
        assertThat(batch.getStatus()).isEqualTo(BatchStatus.TIMED_OUT);
        assertThat(batch.isDeadlineExceeded()).isTrue();
        assertThat(batch.getFailedCount()).isEqualTo(2);
        assertThat(batch.getResultSummary()).endsWith("(batch deadline exceeded)");
        assertThat(queueMessageRepository.findByBatchUuid(batchId)).isEmpty();
        assertThat(drainQueues()).isZero();
    }

    @Test
    void timeOut_beforeDeadline_leavesBatchRunning() throws IOException {
        UUID batchId = submitAndPrepare("normal", List.of(document("early.txt", "Not late yet.")));

        assertThat(orchestrator.timeOut(batchId)).isFalse();
        assertThat(reload(batchId).getStatus()).isEqualTo(BatchStatus.RUNNING);
        drainQueues();
        assertThat(reload(batchId).getStatus()).isEqualTo(BatchStatus.SUCCEEDED);
    }

    @Test
    void cancel_runningBatch_failsItAndDiscardsQueuedJobs() throws IOException {
        // Given
        UUID batchId = submitAndPrepare("low", List.of(
                document("cancel-1.txt", "First."),
                document("cancel-2.txt", "Second.")));

        // When
        Batch cancelled = orchestrator.cancel(batchId);

        // Then
        assertThat(cancelled.getStatus()).isEqualTo(BatchStatus.FAILED);
        assertThat(queueMessageRepository.findByBatchUuid(batchId)).isEmpty();
        assertThat(jobRepository.findByBatchUuidOrderByOrdinalAsc(batchId))
                .extracting(BatchJob::getStatus).containsOnly(JobStatus.FAILED_TERMINAL);
        assertThatThrownBy(() -> orchestrator.cancel(batchId))
                .isInstanceOf(IllegalBatchTransitionException.class);
    }

    @Test
    void duplicateOutcome_isIgnored() throws IOException {
        // Given: a completed single-document batch
        UUID batchId = submitAndPrepare("high", List.of(document("dup.txt", "Once only.")));
        drainQueues();
        BatchJob job = jobRepository.findByBatchUuidOrderByOrdinalAsc(batchId).get(0);

        // When: the same outcome arrives again
        orchestrator.onJobOutcome(JobOutcomeEvent.success(batchId, job.getJobUuid(), job.getDocumentReference(),
                "low", 0.9, 2));

        // Then
        Batch batch = reload(batchId);
        assertThat(batch.getStatus()).isEqualTo(BatchStatus.SUCCEEDED);
        assertThat(batch.getSucceededCount()).isEqualTo(1);
        assertThat(batch.getFailedCount()).isZero();
    }

    @Test
    void deadLetteredDocument_canBeReplayedOnceAsNewBatch() throws IOException {
        // Given
        UUID batchId = submitAndPrepare("high", List.of(document("replay.txt", "[[reject]] for now")));
        drainQueues();
        DeadLetterEntry entry = deadLetterEntryRepository.findByBatchUuid(batchId).get(0);
        document("replay.txt", "Fixed content.");

        // When
        Batch replayed = deadLetterService.replay(entry.getId());
        orchestrator.prepare(replayed.getBatchUuid());
        drainQueues();

        // Then
        Batch batch = reload(replayed.getBatchUuid());
        assertThat(batch.getStatus()).isEqualTo(BatchStatus.SUCCEEDED);
        assertThat(batch.getPriority()).isEqualTo(QueueTier.HIGH);
        assertThat(batch.getOwner()).isEqualTo("claims");
        assertThat(batch.getOptions()).containsEntry("language", "en");
        assertThat(deadLetterEntryRepository.findById(entry.getId()).orElseThrow().getReplayBatchUuid())
                .isEqualTo(replayed.getBatchUuid());
        assertThatThrownBy(() -> deadLetterService.replay(entry.getId()))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void replayOfUndecodableEntry_keepsTheRejectedBatch() {
        // Given: an entry dead-lettered because its body could not be decoded
        DeadLetterEntry entry = new DeadLetterEntry();
        entry.setDeadLetterQueue(QueueTier.NORMAL.deadLetterQueueName());
        entry.setSourceQueue(QueueTier.NORMAL.queueName());
        entry.setTier(QueueTier.NORMAL);
        entry.setMessageUuid(UUID.randomUUID());
        entry.setJobUuid(UUID.randomUUID());
        entry.setBatchUuid(UUID.randomUUID());
        entry.setDocumentReference("");
        entry.setPayload("not-json");
        entry.setAttemptCount(1);
        entry.setReason("MALFORMED_MESSAGE");
        entry.setCreatedAt(Instant.now());
        DeadLetterEntry saved = deadLetterEntryRepository.save(entry);

        // When
        Throwable thrown = catchThrowable(() -> deadLetterService.replay(saved.getId()));

        // Then: the replay batch is stored as FAILED and the entry stays replayable
        assertThat(thrown).isInstanceOf(BatchValidationException.class);
        Batch batch = reload(((BatchValidationException) thrown).getBatchId());
        assertThat(batch.getStatus()).isEqualTo(BatchStatus.FAILED);
        assertThat(batch.getErrorMessage()).startsWith("Batch validation failed");
        assertThat(deadLetterEntryRepository.findById(saved.getId()).orElseThrow().getReplayedAt()).isNull();
    }
}
