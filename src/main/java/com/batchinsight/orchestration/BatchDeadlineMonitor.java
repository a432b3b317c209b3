package com.batchinsight.orchestration;

import com.batchinsight.shared.model.BatchStatus;
import com.batchinsight.shared.repository.BatchRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.UUID;

/**
 * Scheduled sweeps over running batches:
 * expires batches past their deadline, re-finalizes batches left in AGGREGATING after a crash,
 * and retries completion notifications that were never delivered.
 */
@Component
@ConditionalOnProperty(prefix = "batchinsight.scheduling", name = "enabled", havingValue = "true", matchIfMissing = true)
public class BatchDeadlineMonitor {

    private static final Logger logger = LoggerFactory.getLogger(BatchDeadlineMonitor.class);

    private static final EnumSet<BatchStatus> TERMINAL = EnumSet.of(BatchStatus.SUCCEEDED,
            BatchStatus.PARTIALLY_FAILED, BatchStatus.FAILED, BatchStatus.TIMED_OUT);

    private final BatchRepository batchRepository;
    private final BatchOrchestrator orchestrator;
    private final BatchNotificationService notificationService;
    private final Duration aggregatingGrace;

    public BatchDeadlineMonitor(BatchRepository batchRepository,
                                BatchOrchestrator orchestrator,
                                BatchNotificationService notificationService,
                                @Value("${app.batch.aggregating-grace:1m}") Duration aggregatingGrace) {
        this.batchRepository = batchRepository;
        this.orchestrator = orchestrator;
        this.notificationService = notificationService;
        this.aggregatingGrace = aggregatingGrace;
    }

    @Scheduled(fixedDelayString = "${app.batch.deadline-check-interval-ms:30000}")
    public void sweep() {
        try {
            expireOverdueBatches();
            finalizeStuckBatches();
            retryNotifications();
        } catch (RuntimeException e) {
            logger.error("Error during batch deadline sweep", e);
        }
    }

    void expireOverdueBatches() {
        List<UUID> overdue = batchRepository.findIdsPastDeadline(EnumSet.of(BatchStatus.RUNNING), Instant.now());
        for (UUID batchId : overdue) {
            orchestrator.timeOut(batchId);
        }
    }

    void finalizeStuckBatches() {
        List<UUID> stuck = batchRepository.findIdsByStatusUpdatedBefore(BatchStatus.AGGREGATING,
                Instant.now().minus(aggregatingGrace));
        if (!stuck.isEmpty()) {
            logger.warn("Re-finalizing {} batch(es) left in AGGREGATING", stuck.size());
        }
        for (UUID batchId : stuck) {
            orchestrator.finalizeBatch(batchId);
        }
    }

    void retryNotifications() {
        for (UUID batchId : batchRepository.findIdsAwaitingNotification(TERMINAL)) {
            try {
                notificationService.notifyIfPending(batchId);
            } catch (RuntimeException e) {
                logger.warn("Notification retry for batch {} failed", batchId, e);
            }
        }
    }
}
