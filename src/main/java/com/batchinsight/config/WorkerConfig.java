package com.batchinsight.config;

import com.batchinsight.processing.WorkerPool;
import com.batchinsight.shared.model.QueueTier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.ApplicationListener;
import org.springframework.context.annotation.Configuration;

/**
 * Starts the worker pool once the application is ready.
 * {@code app.worker.mode=prioritized} runs loops that always drain the highest non-empty tier;
 * {@code per-tier} runs {@code app.worker.concurrency} loops against each tier.
 */
@Configuration
public class WorkerConfig implements ApplicationListener<ApplicationReadyEvent> {

    private static final Logger logger = LoggerFactory.getLogger(WorkerConfig.class);

    private final WorkerPool workerPool;

    @Value("${batchinsight.worker.enabled:false}")
    private boolean workerEnabled;

    @Value("${app.worker.mode:prioritized}")
    private String workerMode;

    @Value("${app.worker.concurrency:4}")
    private int concurrency;

    public WorkerConfig(WorkerPool workerPool) {
        this.workerPool = workerPool;
    }

    @Override
    public void onApplicationEvent(ApplicationReadyEvent event) {
        logger.info("Worker enabled = {}", workerEnabled);
        if (!workerEnabled) {
            return;
        }
        if ("per-tier".equalsIgnoreCase(workerMode)) {
            for (QueueTier tier : QueueTier.values()) {
                workerPool.run(tier, concurrency);
            }
        } else {
            workerPool.runPrioritized(concurrency);
        }
        logger.info("Worker pool started: mode={}, concurrency={}, active loops={}", workerMode, concurrency,
                workerPool.getActiveLoops());
    }
}
