package com.batchinsight.orchestration;

import com.batchinsight.processing.AnalysisCapability;
import com.batchinsight.processing.AnalysisRequest;
import com.batchinsight.processing.AnalysisVerdict;
import com.batchinsight.processing.JobExecutor;
import com.batchinsight.processing.RetryPolicy;
import com.batchinsight.queue.PriorityQueueSet;
import com.batchinsight.queue.ReceivedMessage;
import com.batchinsight.shared.dto.AggregateResult;
import com.batchinsight.shared.dto.SubmitBatchRequest;
import com.batchinsight.shared.model.Batch;
import com.batchinsight.shared.model.BatchStatus;
import com.batchinsight.shared.model.DeadLetterEntry;
import com.batchinsight.shared.model.QueueTier;
import com.batchinsight.shared.repository.BatchRepository;
import com.batchinsight.shared.repository.DeadLetterEntryRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
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
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

/**
 * A document whose analysis never finishes within the per-job timeout is retried until the
 * tier's receive ceiling and then dead-lettered, failing its batch.
 */
@SpringBootTest
@ActiveProfiles("test")
@Testcontainers(disabledWithoutDocker = true)
class JobTimeoutScenarioTest {

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
        registry.add("app.worker.job-timeout", () -> "200ms");
        registry.add("app.storage.local-dir", STORAGE_DIR::toString);
    }

    @MockBean
    private AnalysisCapability analysisCapability;

    @Autowired
    private BatchOrchestrator orchestrator;

    @Autowired
    private BatchQueryService queryService;

    @Autowired
    private PriorityQueueSet queueSet;

    @Autowired
    private JobExecutor jobExecutor;

    @Autowired
    private BatchRepository batchRepository;

    @Autowired
    private DeadLetterEntryRepository deadLetterEntryRepository;

    @Test
    void jobTimingOutOnEveryAttempt_isDeadLetteredAndBatchFails() throws Exception {
        // Given: the analysis capability hangs past the job timeout
        when(analysisCapability.analyze(any(AnalysisRequest.class))).thenAnswer(invocation -> {
            Thread.sleep(5_000);
            return new AnalysisVerdict("low", 0.9);
        });
        String reference = writeDocument();

        Batch submitted = orchestrator.submit(new SubmitBatchRequest("claims", List.of(reference), "high", null));
        UUID batchId = submitted.getBatchUuid();
        orchestrator.prepare(batchId);

        // When: every delivery is executed until the queue is empty
        int deliveries = 0;
        while (true) {
            List<ReceivedMessage> messages = queueSet.dequeueNext(Duration.ofMillis(300));
            if (messages.isEmpty()) {
                break;
            }
            for (ReceivedMessage message : messages) {
                jobExecutor.execute(message);
                deliveries++;
            }
        }

        // Then
        int maxReceive = queueSet.policy(QueueTier.HIGH).getMaxReceiveCount();
        assertThat(deliveries).isEqualTo(maxReceive);

        List<DeadLetterEntry> entries = deadLetterEntryRepository.findByBatchUuid(batchId);
        assertThat(entries).hasSize(1);
        assertThat(entries.get(0).getAttemptCount()).isEqualTo(maxReceive);
        assertThat(entries.get(0).getReason()).isEqualTo(RetryPolicy.REASON_EXHAUSTED);
        assertThat(entries.get(0).getDocumentReference()).isEqualTo(reference);

        Batch batch = batchRepository.findByBatchUuid(batchId).orElseThrow();
        assertThat(batch.getStatus()).isEqualTo(BatchStatus.FAILED);
        AggregateResult result = queryService.getResult(batchId);
        assertThat(result.getOutcomes()).hasSize(1);
        assertThat(result.getOutcomes().get(0).getErrorKind()).isEqualTo("TIMEOUT");
        assertThat(result.getOutcomes().get(0).getAttempts()).isEqualTo(maxReceive);
    }

    private static Path createStorageDir() {
        try {
            return Files.createTempDirectory("batchinsight-timeout");
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private String writeDocument() throws IOException {
        Files.writeString(STORAGE_DIR.resolve("hanging.txt"), "Analysis of this never returns in time.",
                StandardCharsets.UTF_8);
        return "local://hanging.txt";
    }
}
