package com.batchinsight.shared.repository;

import com.batchinsight.shared.model.DeadLetterEntry;
import com.batchinsight.shared.model.QueueTier;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Repository for dead-letter entries.
 */
@Repository
public interface DeadLetterEntryRepository extends JpaRepository<DeadLetterEntry, Long> {

    List<DeadLetterEntry> findByTierOrderByCreatedAtDesc(QueueTier tier);

    List<DeadLetterEntry> findAllByOrderByCreatedAtDesc();

    List<DeadLetterEntry> findByBatchUuid(UUID batchUuid);

    List<DeadLetterEntry> findByJobUuid(UUID jobUuid);

    @Modifying
    @Query("DELETE FROM DeadLetterEntry d WHERE d.createdAt < :cutoff")
    int deleteCreatedBefore(@Param("cutoff") Instant cutoff);
}
