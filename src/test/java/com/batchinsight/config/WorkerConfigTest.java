package com.batchinsight.config;

import com.batchinsight.processing.WorkerPool;
import com.batchinsight.shared.model.QueueTier;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class WorkerConfigTest {

    private final WorkerPool workerPool = mock(WorkerPool.class);

    private WorkerConfig config(boolean enabled, String mode, int concurrency) {
        WorkerConfig config = new WorkerConfig(workerPool);
        ReflectionTestUtils.setField(config, "workerEnabled", enabled);
        ReflectionTestUtils.setField(config, "workerMode", mode);
        ReflectionTestUtils.setField(config, "concurrency", concurrency);
        return config;
    }

    @Test
    void disabledWorker_startsNoLoops() {
        // When: the application is ready with workers disabled
        config(false, "prioritized", 4).onApplicationEvent(null);

        // Then: the pool is never started
        verify(workerPool, never()).runPrioritized(anyInt());
        verify(workerPool, never()).run(any(QueueTier.class), anyInt());
    }

    @Test
    void prioritizedMode_startsSharedLoops() {
        config(true, "prioritized", 3).onApplicationEvent(null);

        verify(workerPool).runPrioritized(3);
        verify(workerPool, never()).run(any(QueueTier.class), anyInt());
    }

    @Test
    void perTierMode_startsLoopsForEveryTier() {
        config(true, "per-tier", 2).onApplicationEvent(null);

        verify(workerPool).run(QueueTier.HIGH, 2);
        verify(workerPool).run(QueueTier.NORMAL, 2);
        verify(workerPool).run(QueueTier.LOW, 2);
        verify(workerPool, never()).runPrioritized(anyInt());
    }
}
