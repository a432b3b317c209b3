package com.batchinsight.orchestration;

import com.batchinsight.shared.model.BatchStatus;
import com.batchinsight.shared.repository.BatchRepository;
import com.batchinsight.shared.repository.DeadLetterEntryRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.EnumSet;

/**
 * Scheduled task that deletes terminal batches and dead-letter entries older than the retention window.
 * Jobs and outcomes are removed with their batch by the foreign key cascade.
 */
@Service
@ConditionalOnProperty(prefix = "batchinsight.scheduling", name = "enabled", havingValue = "true", matchIfMissing = true)
public class RetentionCleanupTask {

    private static final Logger logger = LoggerFactory.getLogger(RetentionCleanupTask.class);

    private final BatchRepository batchRepository;
    private final DeadLetterEntryRepository deadLetterEntryRepository;
    private final int retentionDays;

    public RetentionCleanupTask(BatchRepository batchRepository,
                                DeadLetterEntryRepository deadLetterEntryRepository,
                                @Value("${app.retention.days:14}") int retentionDays) {
        this.batchRepository = batchRepository;
        this.deadLetterEntryRepository = deadLetterEntryRepository;
        this.retentionDays = retentionDays;
        logger.info("RetentionCleanupTask initialized: retentionDays={}", retentionDays);
    }

    @Scheduled(fixedDelayString = "3600000") // hourly
    @Transactional
    public void cleanupOldData() {
        Instant cutoff = Instant.now().minus(retentionDays, ChronoUnit.DAYS);
        logger.info("Starting retention cleanup: deleting data older than {} days (cutoff: {})", retentionDays, cutoff);
        try {
            int deletedBatches = batchRepository.deleteCompletedBefore(EnumSet.of(BatchStatus.SUCCEEDED,
                    BatchStatus.PARTIALLY_FAILED, BatchStatus.FAILED, BatchStatus.TIMED_OUT), cutoff);
            logger.info("Deleted {} terminal batch(es)", deletedBatches);

            int deletedDeadLetters = deadLetterEntryRepository.deleteCreatedBefore(cutoff);
            logger.info("Deleted {} dead-letter entr(ies)", deletedDeadLetters);
        } catch (RuntimeException e) {
            logger.error("Error during retention cleanup", e);
        }
    }
}
