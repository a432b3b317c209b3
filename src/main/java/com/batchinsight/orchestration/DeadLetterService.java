package com.batchinsight.orchestration;

import com.batchinsight.queue.QueueMessage;
import com.batchinsight.queue.QueueMessageCodec;
import com.batchinsight.queue.PermanentQueueException;
import com.batchinsight.shared.dto.DeadLetterResponse;
import com.batchinsight.shared.dto.SubmitBatchRequest;
import com.batchinsight.shared.exception.BatchValidationException;
import com.batchinsight.shared.exception.DeadLetterNotFoundException;
import com.batchinsight.shared.model.Batch;
import com.batchinsight.shared.model.DeadLetterEntry;
import com.batchinsight.shared.model.QueueTier;
import com.batchinsight.shared.repository.BatchRepository;
import com.batchinsight.shared.repository.DeadLetterEntryRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Inspection and manual replay of dead-lettered jobs. A replay submits a new single-document
 * batch; the original batch is never reopened.
 */
@Service
public class DeadLetterService {

    private static final Logger logger = LoggerFactory.getLogger(DeadLetterService.class);

    private final DeadLetterEntryRepository deadLetterEntryRepository;
    private final BatchRepository batchRepository;
    private final BatchOrchestrator orchestrator;
    private final QueueMessageCodec codec;

    public DeadLetterService(DeadLetterEntryRepository deadLetterEntryRepository,
                             BatchRepository batchRepository,
                             BatchOrchestrator orchestrator,
                             QueueMessageCodec codec) {
        this.deadLetterEntryRepository = deadLetterEntryRepository;
        this.batchRepository = batchRepository;
        this.orchestrator = orchestrator;
        this.codec = codec;
    }

    @Transactional(readOnly = true)
    public List<DeadLetterResponse> list(QueueTier tier) {
        List<DeadLetterEntry> entries = tier != null
                ? deadLetterEntryRepository.findByTierOrderByCreatedAtDesc(tier)
                : deadLetterEntryRepository.findAllByOrderByCreatedAtDesc();
        return entries.stream().map(DeadLetterResponse::from).toList();
    }

    /**
     * Replays a dead-lettered document as a new batch with the original owner and the entry's tier.
     *
     * @throws DeadLetterNotFoundException if no entry has this id
     * @throws IllegalStateException if the entry was already replayed
     * @throws BatchValidationException if the replayed batch is invalid; the FAILED batch is kept
     */
    @Transactional(noRollbackFor = BatchValidationException.class)
    public Batch replay(Long deadLetterId) {
        DeadLetterEntry entry = deadLetterEntryRepository.findById(deadLetterId)
                .orElseThrow(() -> new DeadLetterNotFoundException(deadLetterId));
        if (entry.getReplayedAt() != null) {
            throw new IllegalStateException("Dead-letter entry " + deadLetterId + " was already replayed as batch "
                    + entry.getReplayBatchUuid());
        }

        String owner = batchRepository.findByBatchUuid(entry.getBatchUuid())
                .map(Batch::getOwner)
                .orElse(null);
        SubmitBatchRequest request = new SubmitBatchRequest(owner, List.of(entry.getDocumentReference()),
                entry.getTier().name().toLowerCase(Locale.ROOT), optionsOf(entry));

        Batch replayed = orchestrator.submit(request);
        entry.setReplayedAt(Instant.now());
        entry.setReplayBatchUuid(replayed.getBatchUuid());
        deadLetterEntryRepository.save(entry);
        logger.info("Replayed dead-letter entry {} (job {}) as batch {}", deadLetterId, entry.getJobUuid(),
                replayed.getBatchUuid());
        return replayed;
    }

    private Map<String, Object> optionsOf(DeadLetterEntry entry) {
        if (entry.getPayload() == null) {
            return null;
        }
        try {
            QueueMessage message = codec.decode(entry.getPayload());
            return message.getOptions();
        } catch (PermanentQueueException e) {
            logger.debug("Dead-letter entry {} has an undecodable payload; replaying without options", entry.getId());
            return null;
        }
    }
}
