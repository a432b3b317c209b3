package com.batchinsight.queue;

import com.batchinsight.shared.model.DeadLetterEntry;
import com.batchinsight.shared.model.FailureKind;
import com.batchinsight.shared.model.QueueTier;
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

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Integration test for the PostgreSQL-backed queue set: delivery, priority order,
 * visibility timeouts and dead-lettering.
 */
@SpringBootTest
@ActiveProfiles("test")
@Testcontainers(disabledWithoutDocker = true)
class DatabasePriorityQueueSetTest {

    private static final Duration SHORT_VISIBILITY = Duration.ofMillis(300);

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
        registry.add("app.queue.tiers.low.visibility-timeout", () -> SHORT_VISIBILITY.toMillis() + "ms");
    }

    @Autowired
    private PriorityQueueSet queueSet;

    @Autowired
    private QueueMessageRepository queueMessageRepository;

    @Autowired
    private DeadLetterEntryRepository deadLetterEntryRepository;

    @BeforeEach
    void cleanQueues() {
        queueMessageRepository.deleteAll();
        deadLetterEntryRepository.deleteAll();
    }

    private QueueMessage message(UUID batchId, String reference) {
        return new QueueMessage(UUID.randomUUID(), batchId, reference, null, Map.of("language", "en"));
    }

    @Test
    void enqueueThenDequeue_deliversMessageOnce() {
        // Given
        UUID batchId = UUID.randomUUID();
        QueueMessage sent = message(batchId, "local://a.txt");
        queueSet.enqueue(sent, QueueTier.HIGH);

        // When
        List<ReceivedMessage> received = queueSet.dequeue(QueueTier.HIGH, 1, Duration.ofSeconds(2));

        // Then
        assertThat(received).hasSize(1);
        ReceivedMessage message = received.get(0);
        assertThat(message.getReceiveCount()).isEqualTo(1);
        assertThat(message.getTier()).isEqualTo(QueueTier.HIGH);
        assertThat(message.getBody().getJobId()).isEqualTo(sent.getJobId());
        assertThat(message.getBody().getBatchId()).isEqualTo(batchId);
        assertThat(message.getBody().getOptions()).containsEntry("language", "en");
        assertThat(queueSet.depth(QueueTier.HIGH)).isZero();

        assertThat(queueSet.acknowledge(message.getReceiptHandle())).isTrue();
        assertThat(queueSet.acknowledge(message.getReceiptHandle())).isFalse();
        assertThat(queueMessageRepository.count()).isZero();
    }

    @Test
    void dequeueNext_prefersHigherTiers() {
        UUID batchId = UUID.randomUUID();
        queueSet.enqueue(message(batchId, "local://low.txt"), QueueTier.LOW);
        queueSet.enqueue(message(batchId, "local://normal.txt"), QueueTier.NORMAL);
        queueSet.enqueue(message(batchId, "local://high.txt"), QueueTier.HIGH);

        List<ReceivedMessage> first = queueSet.dequeueNext(Duration.ofSeconds(1));
        List<ReceivedMessage> second = queueSet.dequeueNext(Duration.ofSeconds(1));
        List<ReceivedMessage> third = queueSet.dequeueNext(Duration.ofSeconds(1));

        assertThat(first).extracting(m -> m.getBody().getDocumentReference()).containsExactly("local://high.txt");
        assertThat(second).extracting(m -> m.getBody().getDocumentReference()).containsExactly("local://normal.txt");
        assertThat(third).extracting(m -> m.getBody().getDocumentReference()).containsExactly("local://low.txt");
        assertThat(queueSet.dequeueNext(Duration.ofMillis(100))).isEmpty();
    }

    @Test
    void highBacklog_drainsAheadOfLowBacklog_withConcurrentConsumers() throws Exception {
        // Given: equal backlogs on the high and low tiers
        int backlogSize = 12;
        UUID batchId = UUID.randomUUID();
        for (int i = 0; i < backlogSize; i++) {
            queueSet.enqueue(message(batchId, "local://low-" + i + ".txt"), QueueTier.LOW);
            queueSet.enqueue(message(batchId, "local://high-" + i + ".txt"), QueueTier.HIGH);
        }
        List<QueueTier> completed = Collections.synchronizedList(new ArrayList<>());

        // When: three consumers drain the set, acknowledging each job after a short piece of work
        ExecutorService consumers = Executors.newFixedThreadPool(3);
        List<Future<?>> running = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            running.add(consumers.submit(() -> {
                List<ReceivedMessage> received = queueSet.dequeueNext(Duration.ofMillis(200));
                while (!received.isEmpty()) {
                    for (ReceivedMessage message : received) {
                        Thread.sleep(5);
                        queueSet.acknowledge(message.getReceiptHandle());
                        completed.add(message.getTier());
                    }
                    received = queueSet.dequeueNext(Duration.ofMillis(200));
                }
                return null;
            }));
        }
        for (Future<?> consumer : running) {
            consumer.get(60, TimeUnit.SECONDS);
        }
        consumers.shutdown();

        // Then: high jobs finished earlier on average
        List<QueueTier> order = new ArrayList<>(completed);
        assertThat(order).hasSize(2 * backlogSize);
        assertThat(averagePosition(order, QueueTier.HIGH)).isLessThan(averagePosition(order, QueueTier.LOW));
        assertThat(order.get(0)).isEqualTo(QueueTier.HIGH);
    }

    private static double averagePosition(List<QueueTier> order, QueueTier tier) {
        double sum = 0;
        int count = 0;
        for (int i = 0; i < order.size(); i++) {
            if (order.get(i) == tier) {
                sum += i;
                count++;
            }
        }
        return sum / count;
    }

    @Test
    void returnUnstarted_makesMessageVisibleWithoutCountingTheDelivery() {
        queueSet.enqueue(message(UUID.randomUUID(), "local://unstarted.txt"), QueueTier.NORMAL);
        ReceivedMessage first = queueSet.dequeue(QueueTier.NORMAL, 1, Duration.ofSeconds(1)).get(0);

        assertThat(queueSet.returnUnstarted(first.getReceiptHandle())).isTrue();
        List<ReceivedMessage> again = queueSet.dequeue(QueueTier.NORMAL, 1, Duration.ofSeconds(1));

        assertThat(again).hasSize(1);
        assertThat(again.get(0).getReceiveCount()).isEqualTo(1);
        assertThat(queueSet.returnUnstarted(first.getReceiptHandle())).isFalse();
    }

    @Test
    void unacknowledgedMessage_isRedeliveredAfterVisibilityTimeout() throws InterruptedException {
        // Given: a received but unacknowledged message
        queueSet.enqueue(message(UUID.randomUUID(), "local://slow.txt"), QueueTier.LOW);
        ReceivedMessage first = queueSet.dequeue(QueueTier.LOW, 1, Duration.ofSeconds(1)).get(0);
        assertThat(queueSet.dequeue(QueueTier.LOW, 1, Duration.ZERO)).isEmpty();

        // When: the visibility timeout expires
        Thread.sleep(SHORT_VISIBILITY.toMillis() + 200);
        List<ReceivedMessage> again = queueSet.dequeue(QueueTier.LOW, 1, Duration.ofSeconds(1));

        // Then: it is delivered again under a new handle and the old handle is stale
        assertThat(again).hasSize(1);
        assertThat(again.get(0).getReceiveCount()).isEqualTo(2);
        assertThat(again.get(0).getReceiptHandle()).isNotEqualTo(first.getReceiptHandle());
        assertThat(queueSet.acknowledge(first.getReceiptHandle())).isFalse();
        assertThat(queueSet.acknowledge(again.get(0).getReceiptHandle())).isTrue();
    }

    @Test
    void messageExceedingMaxReceiveCount_movesToTierDeadLetterQueue() throws InterruptedException {
        // Given
        UUID batchId = UUID.randomUUID();
        QueueMessage sent = message(batchId, "local://stuck.txt");
        queueSet.enqueue(sent, QueueTier.LOW);
        int maxReceive = queueSet.policy(QueueTier.LOW).getMaxReceiveCount();

        // When: every delivery times out
        for (int i = 0; i < maxReceive; i++) {
            assertThat(queueSet.dequeue(QueueTier.LOW, 1, Duration.ofSeconds(1))).hasSize(1);
            Thread.sleep(SHORT_VISIBILITY.toMillis() + 200);
        }
        List<ReceivedMessage> afterCeiling = queueSet.dequeue(QueueTier.LOW, 1, Duration.ofMillis(200));

        // Then
        assertThat(afterCeiling).isEmpty();
        assertThat(queueMessageRepository.count()).isZero();
        List<DeadLetterEntry> entries = deadLetterEntryRepository.findByJobUuid(sent.getJobId());
        assertThat(entries).hasSize(1);
        DeadLetterEntry entry = entries.get(0);
        assertThat(entry.getDeadLetterQueue()).isEqualTo("batch-low-priority-dlq");
        assertThat(entry.getAttemptCount()).isEqualTo(maxReceive);
        assertThat(entry.getReason()).isEqualTo(QueueMessageStore.REASON_MAX_RECEIVES);
        assertThat(entry.getBatchUuid()).isEqualTo(batchId);
        assertThat(entry.getDocumentReference()).isEqualTo("local://stuck.txt");
    }

    @Test
    void releasedMessage_carriesFailureHistoryIntoDeadLetter() {
        // Given
        QueueMessage sent = message(UUID.randomUUID(), "local://flaky.txt");
        queueSet.enqueue(sent, QueueTier.NORMAL);
        ReceivedMessage first = queueSet.dequeue(QueueTier.NORMAL, 1, Duration.ofSeconds(1)).get(0);

        // When
        assertThat(queueSet.release(first.getReceiptHandle(), Duration.ZERO,
                FailureRecord.of(1, FailureKind.TRANSIENT, "upstream 503"))).isTrue();
        ReceivedMessage second = queueSet.dequeue(QueueTier.NORMAL, 1, Duration.ofSeconds(1)).get(0);
        Optional<DeadLetterEntry> entry = queueSet.deadLetter(second.getReceiptHandle(), "TERMINAL_FAILURE",
                FailureRecord.of(2, FailureKind.REJECTED, "policy violation"));

        // Then
        assertThat(second.getReceiveCount()).isEqualTo(2);
        assertThat(entry).isPresent();
        assertThat(entry.get().getDeadLetterQueue()).isEqualTo("batch-normal-priority-dlq");
        assertThat(entry.get().getFailureHistory()).hasSize(2);
        assertThat(entry.get().getLastError()).isEqualTo("policy violation");
        assertThat(queueSet.deadLetter(second.getReceiptHandle(), "TERMINAL_FAILURE", null)).isEmpty();
    }

    @Test
    void purgeBatch_removesOnlyThatBatchesMessages() {
        UUID cancelled = UUID.randomUUID();
        UUID other = UUID.randomUUID();
        queueSet.enqueue(message(cancelled, "local://a.txt"), QueueTier.NORMAL);
        queueSet.enqueue(message(cancelled, "local://b.txt"), QueueTier.NORMAL);
        queueSet.enqueue(message(other, "local://c.txt"), QueueTier.NORMAL);

        assertThat(queueSet.purgeBatch(cancelled)).isEqualTo(2);
        assertThat(queueSet.depth(QueueTier.NORMAL)).isEqualTo(1);
    }

    @Test
    void enqueue_oversizedReference_isRejectedPermanently() {
        QueueMessage oversized = message(UUID.randomUUID(),
                "local://" + "x".repeat(QueueMessageCodec.MAX_DOCUMENT_REFERENCE_LENGTH));

        assertThatThrownBy(() -> queueSet.enqueue(oversized, QueueTier.HIGH))
                .isInstanceOf(PermanentQueueException.class);
        assertThat(queueMessageRepository.count()).isZero();
    }
}
