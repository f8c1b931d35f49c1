package com.fintech.invoicevalidation.repository;

import com.fintech.invoicevalidation.entity.QueueItem;
import com.fintech.invoicevalidation.entity.QueueStatus;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for the invoice validation queue.
 */
@Repository
public interface QueueItemRepository extends JpaRepository<QueueItem, Long> {

    /**
     * Locks up to {@code limit} queued items, oldest first, skipping rows already
     * locked by a concurrent claim. Must run inside a transaction so the locks
     * are held until the claim commits.
     */
    @Query(value = "SELECT * FROM invoice_validation_queue " +
            "WHERE status = 'QUEUED' " +
            "ORDER BY enqueued_at, id " +
            "LIMIT :limit " +
            "FOR UPDATE SKIP LOCKED",
            nativeQuery = true)
    List<QueueItem> lockQueuedItems(@Param("limit") int limit);

    @Modifying
    @Query("UPDATE QueueItem q SET q.status = com.fintech.invoicevalidation.entity.QueueStatus.DONE, " +
            "q.lastError = NULL " +
            "WHERE q.id = :id AND q.status = com.fintech.invoicevalidation.entity.QueueStatus.PROCESSING")
    int markDone(@Param("id") Long id);

    @Modifying
    @Query("UPDATE QueueItem q SET q.status = com.fintech.invoicevalidation.entity.QueueStatus.ERROR, " +
            "q.lastError = :lastError " +
            "WHERE q.id = :id AND q.status = com.fintech.invoicevalidation.entity.QueueStatus.PROCESSING")
    int markError(@Param("id") Long id, @Param("lastError") String lastError);

    Page<QueueItem> findByStatus(QueueStatus status, Pageable pageable);

    long countByStatus(QueueStatus status);
}
