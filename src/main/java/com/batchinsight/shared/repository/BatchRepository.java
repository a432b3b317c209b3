package com.batchinsight.shared.repository;

import com.batchinsight.shared.model.Batch;
import com.batchinsight.shared.model.BatchStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for Batch entities.
 */
@Repository
public interface BatchRepository extends JpaRepository<Batch, Long> {

    Optional<Batch> findByBatchUuid(UUID batchUuid);

    boolean existsByBatchUuid(UUID batchUuid);

    /**
     * Loads a batch holding a row lock for the rest of the transaction.
     * All outcome application and state transitions go through this lock.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT b FROM Batch b WHERE b.batchUuid = :batchUuid")
    Optional<Batch> findByBatchUuidForUpdate(@Param("batchUuid") UUID batchUuid);

    /**
     * Claims a PENDING batch with SELECT FOR UPDATE SKIP LOCKED so that only one
     * instance prepares it. Empty when another instance holds it or it is no longer PENDING.
     */
    @Query(value = "SELECT * FROM batches WHERE batch_uuid = :batchUuid AND status = 'PENDING' FOR UPDATE SKIP LOCKED",
            nativeQuery = true)
    Optional<Batch> claimPendingBatch(@Param("batchUuid") UUID batchUuid);

    /**
     * Oldest PENDING batches, without locking.
     */
    @Query(value = "SELECT batch_uuid FROM batches WHERE status = 'PENDING' ORDER BY created_at ASC LIMIT :limit",
            nativeQuery = true)
    List<UUID> findOldestPendingBatchIds(@Param("limit") int limit);

    @Query("SELECT b.batchUuid FROM Batch b WHERE b.status IN :statuses AND b.deadlineAt < :now")
    List<UUID> findIdsPastDeadline(@Param("statuses") Collection<BatchStatus> statuses,
                                   @Param("now") Instant now);

    @Query("SELECT b.batchUuid FROM Batch b WHERE b.status = :status AND b.updatedAt < :cutoff")
    List<UUID> findIdsByStatusUpdatedBefore(@Param("status") BatchStatus status,
                                            @Param("cutoff") Instant cutoff);

    @Query("SELECT b.batchUuid FROM Batch b WHERE b.status IN :statuses AND b.notifiedAt IS NULL")
    List<UUID> findIdsAwaitingNotification(@Param("statuses") Collection<BatchStatus> statuses);

    @Modifying
    @Query("UPDATE Batch b SET b.notifiedAt = :notifiedAt WHERE b.batchUuid = :batchUuid AND b.notifiedAt IS NULL")
    int markNotified(@Param("batchUuid") UUID batchUuid, @Param("notifiedAt") Instant notifiedAt);

    /**
     * Deletes terminal batches completed before the cutoff. Jobs and outcomes go with them
     * through the ON DELETE CASCADE foreign keys.
     */
    @Modifying
    @Query("DELETE FROM Batch b WHERE b.status IN :statuses AND b.completedAt < :cutoff")
    int deleteCompletedBefore(@Param("statuses") Collection<BatchStatus> statuses,
                              @Param("cutoff") Instant cutoff);
}
