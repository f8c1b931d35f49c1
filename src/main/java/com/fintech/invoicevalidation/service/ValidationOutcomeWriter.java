package com.fintech.invoicevalidation.service;

import com.fintech.invoicevalidation.dto.ValidationOutcome;
import com.fintech.invoicevalidation.dto.ValidationResponse;
import com.fintech.invoicevalidation.entity.QueueItem;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;

/**
 * Persists the result of one validation call as a single unit of work:
 * history insert, snapshot upsert and queue status update commit together
 * or not at all.
 */
@Service
@RequiredArgsConstructor
public class ValidationOutcomeWriter {

    private final HistoryRecorder historyRecorder;
    private final SnapshotReconciler snapshotReconciler;
    private final QueueStatusUpdater queueStatusUpdater;

    @Transactional(isolation = Isolation.READ_COMMITTED)
    public ValidationOutcome persist(QueueItem item, LocalDateTime tokenExpiresAt, ValidationResponse response) {
        ValidationOutcome outcome = historyRecorder.recordHistory(item, tokenExpiresAt, response.getPayload());
        snapshotReconciler.reconcile(item, outcome);

        if (response.isOk()) {
            queueStatusUpdater.markDone(item.getId());
        } else {
            queueStatusUpdater.markError(item.getId(), response.getPayload());
        }
        return outcome;
    }
}
