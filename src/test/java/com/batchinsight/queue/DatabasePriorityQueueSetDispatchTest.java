package com.batchinsight.queue;

import com.batchinsight.observability.BatchMetricsServiceInterface;
import com.batchinsight.shared.event.JobOutcomeEvent;
import com.batchinsight.shared.model.DeadLetterEntry;
import com.batchinsight.shared.model.FailureKind;
import com.batchinsight.shared.model.QueueTier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Queue;
import java.util.UUID;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tier selection and dead-letter handoff of the queue set, against a mocked message store.
 */
@ExtendWith(MockitoExtension.class)
class DatabasePriorityQueueSetDispatchTest {

    @Mock
    private QueueMessageStore store;

    @Mock
    private ApplicationEventPublisher eventPublisher;

    @Mock
    private BatchMetricsServiceInterface metricsService;

    private DatabasePriorityQueueSet queueSet;
    private final Map<QueueTier, Queue<ReceivedMessage>> backlog = new EnumMap<>(QueueTier.class);
    private final List<QueueTier> receivedOrder = Collections.synchronizedList(new ArrayList<>());

    @BeforeEach
    void setUp() {
        QueueProperties properties = new QueueProperties();
        properties.setPollInterval(Duration.ofMillis(5));
        properties.getTiers().setNormal(new QueueProperties.Tier(1, Duration.ZERO));
        properties.getTiers().setLow(new QueueProperties.Tier(1, Duration.ZERO));
        queueSet = new DatabasePriorityQueueSet(store, properties, eventPublisher, metricsService);
        for (QueueTier tier : QueueTier.values()) {
            backlog.put(tier, new ConcurrentLinkedQueue<>());
        }
    }

    private void serveFromBacklog() {
        when(store.receive(any(TierPolicy.class), anyInt())).thenAnswer(invocation -> {
            QueueTier tier = invocation.<TierPolicy>getArgument(0).getTier();
            ReceivedMessage next = backlog.get(tier).poll();
            if (next == null) {
                return ReceiveBatch.empty();
            }
            receivedOrder.add(tier);
            return new ReceiveBatch(List.of(next), List.of());
        });
    }

    private void fill(QueueTier tier, int count) {
        for (int i = 0; i < count; i++) {
            QueueMessage body = new QueueMessage(UUID.randomUUID(), UUID.randomUUID(), "local://" + tier + i, tier, null);
            backlog.get(tier).add(new ReceivedMessage(UUID.randomUUID(), UUID.randomUUID(), tier, 1, body));
        }
    }

    @Test
    void dequeueNext_takesFromHighestNonEmptyTier() {
        serveFromBacklog();
        fill(QueueTier.NORMAL, 1);
        fill(QueueTier.LOW, 1);

        List<ReceivedMessage> first = queueSet.dequeueNext(Duration.ZERO);
        List<ReceivedMessage> second = queueSet.dequeueNext(Duration.ZERO);
        List<ReceivedMessage> third = queueSet.dequeueNext(Duration.ZERO);

        assertThat(first).extracting(ReceivedMessage::getTier).containsExactly(QueueTier.NORMAL);
        assertThat(second).extracting(ReceivedMessage::getTier).containsExactly(QueueTier.LOW);
        assertThat(third).isEmpty();
    }

    @Test
    void highBacklog_drainsBeforeEqualLowBacklog_underConcurrentConsumers() throws Exception {
        // Given: equal backlogs on the high and low tiers
        int backlogSize = 40;
        int consumers = 4;
        serveFromBacklog();
        fill(QueueTier.HIGH, backlogSize);
        fill(QueueTier.LOW, backlogSize);

        // When: several consumers drain the set, each job taking a little time
        ExecutorService pool = Executors.newFixedThreadPool(consumers);
        List<Future<?>> running = new ArrayList<>();
        for (int i = 0; i < consumers; i++) {
            running.add(pool.submit(() -> {
                while (!queueSet.dequeueNext(Duration.ZERO).isEmpty()) {
                    Thread.sleep(2);
                }
                return null;
            }));
        }
        for (Future<?> consumer : running) {
            consumer.get(30, TimeUnit.SECONDS);
        }
        pool.shutdown();

        // Then: high jobs waited less on average and led the drain
        List<QueueTier> order = new ArrayList<>(receivedOrder);
        assertThat(order).hasSize(2 * backlogSize);
        assertThat(averagePosition(order, QueueTier.HIGH)).isLessThan(averagePosition(order, QueueTier.LOW));
        assertThat(order.subList(0, backlogSize - consumers)).containsOnly(QueueTier.HIGH);
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

    private ExpiredMessage expired(UUID handle) {
        return new ExpiredMessage(handle, QueueTier.LOW, UUID.randomUUID(), UUID.randomUUID(), "local://stuck.txt", 3,
                QueueMessageStore.REASON_MAX_RECEIVES,
                FailureRecord.of(3, FailureKind.TIMEOUT, "Visibility timeout expired 3 times"));
    }

    @Test
    void expiredMessage_outcomeIsRecordedBeforeDeadLettering() {
        UUID handle = UUID.randomUUID();
        ExpiredMessage message = expired(handle);
        when(store.receive(any(TierPolicy.class), anyInt())).thenReturn(new ReceiveBatch(List.of(), List.of(message)));
        DeadLetterEntry entry = new DeadLetterEntry();
        entry.setTier(QueueTier.LOW);
        when(store.deadLetter(eq(handle), eq(QueueMessageStore.REASON_MAX_RECEIVES), any(FailureRecord.class)))
                .thenReturn(Optional.of(entry));

        List<ReceivedMessage> received = queueSet.dequeue(QueueTier.LOW, 1, Duration.ZERO);

        assertThat(received).isEmpty();
        InOrder order = inOrder(eventPublisher, store);
        ArgumentCaptor<Object> event = ArgumentCaptor.forClass(Object.class);
        order.verify(eventPublisher).publishEvent(event.capture());
        order.verify(store).deadLetter(eq(handle), eq(QueueMessageStore.REASON_MAX_RECEIVES), any(FailureRecord.class));
        JobOutcomeEvent outcome = (JobOutcomeEvent) event.getValue();
        assertThat(outcome.getFailureKind()).isEqualTo(FailureKind.TIMEOUT);
        assertThat(outcome.getAttempts()).isEqualTo(3);
        assertThat(outcome.getErrorMessage()).contains("batch-low-priority-dlq");
        verify(metricsService).recordDeadLetter(QueueTier.LOW, QueueMessageStore.REASON_MAX_RECEIVES);
    }

    @Test
    void expiredMessage_staysQueuedWhenOutcomeCannotBeRecorded() {
        UUID handle = UUID.randomUUID();
        when(store.receive(any(TierPolicy.class), anyInt()))
                .thenReturn(new ReceiveBatch(List.of(), List.of(expired(handle))));
        doThrow(new IllegalStateException("db down")).when(eventPublisher).publishEvent(any(Object.class));

        List<ReceivedMessage> received = queueSet.dequeue(QueueTier.LOW, 1, Duration.ZERO);

        assertThat(received).isEmpty();
        verify(store, never()).deadLetter(any(), anyString(), any());
        verify(metricsService, never()).recordDeadLetter(any(), anyString());
    }
}
