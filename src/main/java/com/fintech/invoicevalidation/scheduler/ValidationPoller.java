package com.fintech.invoicevalidation.scheduler;

import com.fintech.invoicevalidation.dto.BatchResult;
import com.fintech.invoicevalidation.exception.AuthenticationException;
import com.fintech.invoicevalidation.exception.InvoiceValidationException;
import com.fintech.invoicevalidation.service.InvoiceValidationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Poll loop of the worker.
 * <p>
 * Each run processes batches back to back until a claim comes back empty, then
 * returns. The fixed delay between runs is the idle back-off, so a busy queue is
 * drained without pauses and an empty one is polled every few seconds.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ValidationPoller {

    private final InvoiceValidationService invoiceValidationService;

    @Value("${invoice-validation.worker.enabled:true}")
    private boolean pollerEnabled;

    @Value("${invoice-validation.worker.max-batches-per-run:1000}")
    private int maxBatchesPerRun;

    @Scheduled(fixedDelayString = "${invoice-validation.worker.idle-backoff-ms:5000}")
    public void drainQueue() {
        if (!pollerEnabled) {
            log.debug("Poller is disabled, skipping run");
            return;
        }

        try {
            int batches = 0;
            while (batches < maxBatchesPerRun) {
                BatchResult result = invoiceValidationService.processBatch();
                if (result.isEmpty()) {
                    log.debug("Invoice validation queue is empty");
                    return;
                }
                batches++;
                logResult(result);
            }
            log.warn("Reached {} batches in one run, yielding until the next poll", maxBatchesPerRun);

        } catch (AuthenticationException e) {
            log.warn("SUNAT authentication failed, retrying next poll: {}", e.getMessage());
        } catch (InvoiceValidationException e) {
            log.warn("Invoice validation run skipped: {}", e.getMessage());
        } catch (Exception e) {
            log.error("Invoice validation run failed with unexpected error", e);
        }
    }

    private void logResult(BatchResult result) {
        log.info("Batch: total={} ok={} err={} in {}ms",
                result.getTotalClaimed(),
                result.getValidated(),
                result.getFailed(),
                result.getDurationMs());

        if (result.isFinalSyncFailed()) {
            log.warn("Purchase invoice header was not updated in this batch, it will be retried");
        }
    }
}
