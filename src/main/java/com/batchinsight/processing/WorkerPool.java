package com.batchinsight.processing;

import com.batchinsight.queue.PriorityQueueSet;
import com.batchinsight.queue.ReceivedMessage;
import com.batchinsight.shared.model.QueueTier;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Bounded set of single-threaded consumer loops. Every loop holds a permit of a fair global
 * semaphore while it receives and executes, so in-flight work across all tiers never exceeds
 * app.worker.max-global-concurrency.
 */
@Component
public class WorkerPool {

    private static final Logger logger = LoggerFactory.getLogger(WorkerPool.class);

    private final PriorityQueueSet queueSet;
    private final JobExecutor jobExecutor;
    private final Semaphore globalPermits;
    private final Duration waitTimeout;
    private final Duration shutdownTimeout;
    private final AtomicBoolean running = new AtomicBoolean(true);
    private final AtomicInteger activeLoops = new AtomicInteger();
    private final List<ExecutorService> loopExecutors = new ArrayList<>();

    public WorkerPool(PriorityQueueSet queueSet,
                      JobExecutor jobExecutor,
                      @Value("${app.worker.max-global-concurrency:50}") int maxGlobalConcurrency,
                      @Value("${app.worker.wait-timeout:5s}") Duration waitTimeout,
                      @Value("${app.worker.shutdown-timeout:30s}") Duration shutdownTimeout) {
        this.queueSet = queueSet;
        this.jobExecutor = jobExecutor;
        this.globalPermits = new Semaphore(maxGlobalConcurrency, true);
        this.waitTimeout = waitTimeout;
        this.shutdownTimeout = shutdownTimeout;
    }

    /**
     * Starts {@code concurrency} loops consuming one tier.
     */
    public synchronized void run(QueueTier tier, int concurrency) {
        int batchSize = queueSet.policy(tier).getBatchSize();
        start("worker-" + tier.name().toLowerCase(Locale.ROOT) + "-", concurrency,
                () -> queueSet.dequeue(tier, batchSize, waitTimeout));
    }

    /**
     * Starts {@code concurrency} loops that always take from the highest-priority non-empty tier.
     */
    public synchronized void runPrioritized(int concurrency) {
        start("worker-prioritized-", concurrency, () -> queueSet.dequeueNext(waitTimeout));
    }

    public int getActiveLoops() {
        return activeLoops.get();
    }

    public int getAvailablePermits() {
        return globalPermits.availablePermits();
    }

    private void start(String threadPrefix, int concurrency, Supplier<List<ReceivedMessage>> source) {
        if (concurrency < 1) {
            throw new IllegalArgumentException("concurrency must be at least 1");
        }
        if (!running.get()) {
            throw new IllegalStateException("Worker pool is stopped");
        }
        CustomizableThreadFactory threadFactory = new CustomizableThreadFactory(threadPrefix);
        ExecutorService executor = Executors.newFixedThreadPool(concurrency, threadFactory);
        loopExecutors.add(executor);
        for (int i = 0; i < concurrency; i++) {
            executor.submit(() -> loop(source));
        }
        logger.info("Started {} worker loop(s) with prefix {}", concurrency, threadPrefix);
    }

    private void loop(Supplier<List<ReceivedMessage>> source) {
        activeLoops.incrementAndGet();
        try {
            while (running.get() && !Thread.currentThread().isInterrupted()) {
                try {
                    globalPermits.acquire();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                }
                try {
                    List<ReceivedMessage> messages = source.get();
                    for (ReceivedMessage message : messages) {
                        if (!running.get()) {
                            // Not attempted, so the receive does not count against the job
                            queueSet.returnUnstarted(message.getReceiptHandle());
                            continue;
                        }
                        try {
                            jobExecutor.execute(message);
                        } catch (RuntimeException e) {
                            logger.error("Job {} failed outside the retry path; it is redelivered after the "
                                    + "visibility timeout",
                                    message.getBody().getJobId(), e);
                        }
                    }
                } catch (RuntimeException e) {
                    logger.error("Worker loop iteration failed", e);
                    pause();
                } finally {
                    globalPermits.release();
                }
            }
        } finally {
            activeLoops.decrementAndGet();
        }
    }

    private void pause() {
        try {
            Thread.sleep(waitTimeout.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Stops accepting new messages and waits for running jobs to finish.
     */
    @PreDestroy
    public synchronized void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        logger.info("Stopping worker pool ({} active loop(s))", activeLoops.get());
        for (ExecutorService executor : loopExecutors) {
            executor.shutdown();
        }
        for (ExecutorService executor : loopExecutors) {
            try {
                if (!executor.awaitTermination(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                    logger.warn("Worker loops did not finish within {}; interrupting", shutdownTimeout);
                    executor.shutdownNow();
                }
            } catch (InterruptedException e) {
                executor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        loopExecutors.clear();
    }
}
