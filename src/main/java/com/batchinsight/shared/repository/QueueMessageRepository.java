package com.batchinsight.shared.repository;

import com.batchinsight.shared.model.QueueMessageRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for queue message rows.
 */
@Repository
public interface QueueMessageRepository extends JpaRepository<QueueMessageRecord, Long> {

    /**
     * Locks up to {@code limit} visible messages of a queue using SELECT FOR UPDATE SKIP LOCKED,
     * so concurrent receivers never get the same message.
     */
    @Query(value = "SELECT * FROM queue_messages WHERE queue_name = :queueName AND visible_at <= :now " +
            "ORDER BY visible_at ASC, id ASC LIMIT :limit FOR UPDATE SKIP LOCKED",
            nativeQuery = true)
    List<QueueMessageRecord> lockVisibleMessages(@Param("queueName") String queueName,
                                                 @Param("now") Instant now,
                                                 @Param("limit") int limit);

    Optional<QueueMessageRecord> findByReceiptHandle(UUID receiptHandle);

    @Modifying
    @Query("DELETE FROM QueueMessageRecord m WHERE m.receiptHandle = :receiptHandle")
    int deleteByReceiptHandle(@Param("receiptHandle") UUID receiptHandle);

    @Modifying
    @Query("DELETE FROM QueueMessageRecord m WHERE m.batchUuid = :batchUuid")
    int deleteByBatchUuid(@Param("batchUuid") UUID batchUuid);

    @Query("SELECT COUNT(m) FROM QueueMessageRecord m WHERE m.queueName = :queueName AND m.visibleAt <= :now")
    long countVisible(@Param("queueName") String queueName, @Param("now") Instant now);

    List<QueueMessageRecord> findByBatchUuid(UUID batchUuid);
}
