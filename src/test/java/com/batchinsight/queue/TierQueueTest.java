package com.batchinsight.queue;

import com.batchinsight.shared.model.FailureKind;
import com.batchinsight.shared.model.QueueTier;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TierQueueTest {

    @Mock
    private QueueMessageStore store;

    private final List<ExpiredMessage> expired = new ArrayList<>();

    private TierQueue queue(int batchSize, Duration batchingDelay) {
        TierPolicy policy = new TierPolicy(QueueTier.NORMAL, batchSize, batchingDelay, Duration.ofMinutes(15), 3);
        return new TierQueue(policy, store, Duration.ofMillis(10), expired::addAll);
    }

    private static ReceivedMessage message() {
        QueueMessage body = new QueueMessage(UUID.randomUUID(), UUID.randomUUID(), "local://a", QueueTier.NORMAL, null);
        return new ReceivedMessage(UUID.randomUUID(), UUID.randomUUID(), QueueTier.NORMAL, 1, body);
    }

    @Test
    void emptyQueue_returnsEmptyAfterWaitTimeout() {
        when(store.receive(any(), anyInt())).thenReturn(ReceiveBatch.empty());
        TierQueue queue = queue(5, Duration.ZERO);

        long start = System.nanoTime();
        List<ReceivedMessage> received = queue.receive(5, Duration.ofMillis(100));
        long elapsedMs = (System.nanoTime() - start) / 1_000_000;

        assertThat(received).isEmpty();
        assertThat(elapsedMs).isGreaterThanOrEqualTo(90);
    }

    @Test
    void fullBatch_returnsImmediately() {
        List<ReceivedMessage> five = List.of(message(), message(), message(), message(), message());
        when(store.receive(any(), eq(5))).thenReturn(new ReceiveBatch(five, List.of()));
        TierQueue queue = queue(5, Duration.ofSeconds(30));

        assertThat(queue.receive(5, Duration.ofSeconds(30))).hasSize(5);
    }

    @Test
    void partialBatch_keepsCollectingWithinBatchingWindow() {
        ReceivedMessage first = message();
        ReceivedMessage second = message();
        when(store.receive(any(), anyInt()))
                .thenReturn(new ReceiveBatch(List.of(first), List.of()))
                .thenReturn(ReceiveBatch.empty())
                .thenReturn(new ReceiveBatch(List.of(second), List.of()))
                .thenReturn(ReceiveBatch.empty());
        TierQueue queue = queue(5, Duration.ofMillis(200));

        List<ReceivedMessage> received = queue.receive(5, Duration.ofSeconds(5));

        assertThat(received).containsExactly(first, second);
        verify(store, atLeastOnce()).receive(any(), eq(4));
    }

    @Test
    void expiredMessages_areReportedToListener() {
        ExpiredMessage stuck = new ExpiredMessage(UUID.randomUUID(), QueueTier.NORMAL, UUID.randomUUID(),
                UUID.randomUUID(), "local://a", 3, QueueMessageStore.REASON_MAX_RECEIVES,
                FailureRecord.of(3, FailureKind.TIMEOUT, "Visibility timeout expired 3 times"));
        when(store.receive(any(), anyInt())).thenReturn(new ReceiveBatch(List.of(), List.of(stuck)));

        List<ReceivedMessage> received = queue(1, Duration.ZERO).poll(1);

        assertThat(received).isEmpty();
        assertThat(expired).containsExactly(stuck);
    }
}
