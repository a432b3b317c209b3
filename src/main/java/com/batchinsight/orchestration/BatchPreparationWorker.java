package com.batchinsight.orchestration;

import com.batchinsight.shared.repository.BatchRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.UUID;

/**
 * Polls for PENDING batches and prepares them. Several instances may poll concurrently;
 * the SKIP LOCKED claim lets exactly one of them prepare each batch.
 */
@Component
@ConditionalOnProperty(prefix = "batchinsight.scheduling", name = "enabled", havingValue = "true", matchIfMissing = true)
public class BatchPreparationWorker {

    private static final Logger logger = LoggerFactory.getLogger(BatchPreparationWorker.class);

    private final BatchRepository batchRepository;
    private final BatchOrchestrator orchestrator;
    private final int pollBatchSize;

    public BatchPreparationWorker(BatchRepository batchRepository,
                                  BatchOrchestrator orchestrator,
                                  @Value("${app.batch.prepare-poll-size:10}") int pollBatchSize) {
        this.batchRepository = batchRepository;
        this.orchestrator = orchestrator;
        this.pollBatchSize = pollBatchSize;
    }

    @Scheduled(fixedDelayString = "${app.batch.prepare-poll-interval-ms:2000}")
    public void pollPendingBatches() {
        List<UUID> pending;
        try {
            pending = batchRepository.findOldestPendingBatchIds(pollBatchSize);
        } catch (RuntimeException e) {
            logger.error("Error polling for pending batches", e);
            return;
        }
        if (pending.isEmpty()) {
            return;
        }
        logger.debug("Found {} pending batch(es)", pending.size());
        for (UUID batchId : pending) {
            orchestrator.prepare(batchId);
        }
    }
}
