package com.fintech.invoicevalidation.service;

import com.fintech.invoicevalidation.dto.AccessToken;
import com.fintech.invoicevalidation.dto.BatchResult;
import com.fintech.invoicevalidation.dto.ValidationResponse;
import com.fintech.invoicevalidation.entity.QueueItem;
import com.fintech.invoicevalidation.entity.QueueStatus;
import com.fintech.invoicevalidation.exception.BatchAlreadyRunningException;
import com.fintech.invoicevalidation.repository.QueueItemRepository;
import com.fintech.invoicevalidation.service.ValidationDispatcher.DispatchedValidation;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs one claim → validate → reconcile cycle over the invoice validation queue.
 * <p>
 * Key Design Decisions:
 * 1. Token first: an authentication failure aborts the cycle before anything is claimed
 * 2. Concurrency: only the SUNAT calls run in parallel, writes happen on the calling thread
 * 3. Isolation: each item is persisted in its own transaction, a failing item never aborts the batch
 * 4. Final sync: the invoice header is updated once per batch, after every item has settled
 */
@Service
@Slf4j
public class InvoiceValidationService {

    private static final int ERROR_SUMMARY_LENGTH = 300;

    private final TokenProvider tokenProvider;
    private final BatchClaimer batchClaimer;
    private final ValidationDispatcher validationDispatcher;
    private final ValidationOutcomeWriter outcomeWriter;
    private final QueueStatusUpdater queueStatusUpdater;
    private final FinalSyncService finalSyncService;
    private final QueueItemRepository queueItemRepository;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    @Value("${invoice-validation.worker.batch-size:300}")
    private int batchSize;

    // Metrics
    private Counter itemsCounter;
    private Counter successCounter;
    private Counter failureCounter;
    private Counter persistenceErrorCounter;
    private Counter finalSyncRowsCounter;
    private Counter finalSyncErrorCounter;
    private Timer batchTimer;

    // Prevents overlapping cycles (scheduler and manual trigger)
    private final AtomicBoolean isRunning = new AtomicBoolean(false);

    public InvoiceValidationService(TokenProvider tokenProvider,
                                    BatchClaimer batchClaimer,
                                    ValidationDispatcher validationDispatcher,
                                    ValidationOutcomeWriter outcomeWriter,
                                    QueueStatusUpdater queueStatusUpdater,
                                    FinalSyncService finalSyncService,
                                    QueueItemRepository queueItemRepository,
                                    MeterRegistry meterRegistry,
                                    Clock clock) {
        this.tokenProvider = tokenProvider;
        this.batchClaimer = batchClaimer;
        this.validationDispatcher = validationDispatcher;
        this.outcomeWriter = outcomeWriter;
        this.queueStatusUpdater = queueStatusUpdater;
        this.finalSyncService = finalSyncService;
        this.queueItemRepository = queueItemRepository;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
    }

    @PostConstruct
    public void initMetrics() {
        itemsCounter = Counter.builder("invoice.validation.items.total")
                .description("Queue items claimed for validation")
                .register(meterRegistry);

        successCounter = Counter.builder("invoice.validation.items.success")
                .description("Queue items validated and marked DONE")
                .register(meterRegistry);

        failureCounter = Counter.builder("invoice.validation.items.failure")
                .description("Queue items marked ERROR")
                .register(meterRegistry);

        persistenceErrorCounter = Counter.builder("invoice.validation.persistence.errors")
                .description("Items whose outcome could not be persisted")
                .register(meterRegistry);

        finalSyncRowsCounter = Counter.builder("invoice.validation.final.sync.rows")
                .description("Purchase invoice header rows updated from the snapshot")
                .register(meterRegistry);

        finalSyncErrorCounter = Counter.builder("invoice.validation.final.sync.errors")
                .description("Failed final sync runs")
                .register(meterRegistry);

        batchTimer = Timer.builder("invoice.validation.batch.duration")
                .description("Time taken to process one batch")
                .register(meterRegistry);
    }

    /**
     * Processes one batch of queued invoices.
     *
     * @return statistics of the batch; {@link BatchResult#isEmpty()} when the queue was drained
     * @throws com.fintech.invoicevalidation.exception.AuthenticationException if no token could be obtained
     * @throws BatchAlreadyRunningException if another batch is in progress
     */
    public BatchResult processBatch() {
        if (!isRunning.compareAndSet(false, true)) {
            log.warn("Invoice validation batch already in progress, skipping this run");
            throw new BatchAlreadyRunningException();
        }

        try {
            return batchTimer.record(this::runBatch);
        } finally {
            isRunning.set(false);
        }
    }

    private BatchResult runBatch() {
        BatchResult result = BatchResult.builder()
                .startedAt(now())
                .build();

        AccessToken token = tokenProvider.getToken();

        List<QueueItem> items = batchClaimer.claimBatch(batchSize);
        result.setTotalClaimed(items.size());
        if (items.isEmpty()) {
            result.setCompletedAt(now());
            return result;
        }

        itemsCounter.increment(items.size());
        log.debug("Dispatching {} invoices to SUNAT", items.size());

        validationDispatcher.dispatch(token, items, dispatched -> settle(dispatched, token, result));

        syncFinal(result);
        result.setCompletedAt(now());

        log.info("Batch completed. Claimed: {}, Validated: {}, Failed: {}, Header rows synced: {}",
                result.getTotalClaimed(),
                result.getValidated(),
                result.getFailed(),
                result.getFinalRowsSynced());

        return result;
    }

    /**
     * Persists one validation result. Failures are isolated to the item.
     */
    private void settle(DispatchedValidation dispatched, AccessToken token, BatchResult result) {
        QueueItem item = dispatched.item();
        ValidationResponse response = dispatched.response();

        try {
            outcomeWriter.persist(item, token.getExpiresAt(), response);

            if (response.isOk()) {
                result.incrementValidated();
                successCounter.increment();
            } else {
                result.addError(item.getId(), item.getInvoiceId(), summarize(response), now());
                failureCounter.increment();
            }
        } catch (RuntimeException e) {
            handlePersistenceError(item, e, result);
        }
    }

    /**
     * The item's transaction has been rolled back at this point. The item is marked
     * ERROR in a new transaction so it does not stay in PROCESSING.
     */
    private void handlePersistenceError(QueueItem item, RuntimeException e, BatchResult result) {
        log.error("Failed to persist validation outcome of invoice {} (queue item {})",
                item.getInvoiceId(), item.getId(), e);

        persistenceErrorCounter.increment();
        failureCounter.increment();
        result.addError(item.getId(), item.getInvoiceId(), "Persistence error: " + e.getMessage(), now());

        try {
            queueStatusUpdater.markError(item.getId(), e);
        } catch (RuntimeException markError) {
            log.error("Failed to mark queue item {} as ERROR", item.getId(), markError);
        }
    }

    private void syncFinal(BatchResult result) {
        try {
            int affected = finalSyncService.syncFinal();
            result.setFinalRowsSynced(affected);
            finalSyncRowsCounter.increment(affected);
        } catch (RuntimeException e) {
            // next batch retries, the sync is idempotent
            log.error("Failed updating purchase invoice header from snapshot", e);
            result.setFinalSyncFailed(true);
            finalSyncErrorCounter.increment();
        }
    }

    private String summarize(ValidationResponse response) {
        String text = String.valueOf(response.getPayload());
        return text.length() <= ERROR_SUMMARY_LENGTH ? text : text.substring(0, ERROR_SUMMARY_LENGTH);
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }

    /**
     * Get current queue statistics.
     * Useful for monitoring dashboards.
     */
    public QueueStats getStats() {
        return QueueStats.builder()
                .queuedCount(queueItemRepository.countByStatus(QueueStatus.QUEUED))
                .processingCount(queueItemRepository.countByStatus(QueueStatus.PROCESSING))
                .doneCount(queueItemRepository.countByStatus(QueueStatus.DONE))
                .errorCount(queueItemRepository.countByStatus(QueueStatus.ERROR))
                .isBatchRunning(isRunning.get())
                .build();
    }

    @lombok.Data
    @lombok.Builder
    public static class QueueStats {
        private long queuedCount;
        private long processingCount;
        private long doneCount;
        private long errorCount;
        private boolean isBatchRunning;
    }
}
