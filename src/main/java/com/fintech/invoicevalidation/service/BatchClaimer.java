package com.fintech.invoicevalidation.service;

import com.fintech.invoicevalidation.entity.QueueItem;
import com.fintech.invoicevalidation.repository.QueueItemRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Reserves a slice of the queue for the current batch.
 * <p>
 * The select-for-update, the status change and the attempt increment share one
 * transaction, so a row is either claimed by exactly one caller or left queued.
 * This is the only place where items move from QUEUED to PROCESSING.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BatchClaimer {

    private final QueueItemRepository queueItemRepository;

    /**
     * Claims up to {@code batchSize} queued items, oldest first.
     *
     * @return the claimed items as they are after the transition, empty if the queue is drained
     */
    @Transactional(isolation = Isolation.READ_COMMITTED)
    public List<QueueItem> claimBatch(int batchSize) {
        if (batchSize <= 0) {
            return List.of();
        }

        List<QueueItem> items = queueItemRepository.lockQueuedItems(batchSize);
        if (items.isEmpty()) {
            return List.of();
        }

        items.forEach(QueueItem::claim);
        queueItemRepository.saveAll(items);
        queueItemRepository.flush();

        log.debug("Claimed {} queue items", items.size());
        return items;
    }
}
