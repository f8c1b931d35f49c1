package com.fintech.invoicevalidation.entity;

/**
 * Lifecycle status of an invoice waiting in the validation queue.
 * <p>
 * Allowed transitions: QUEUED -> PROCESSING -> (DONE | ERROR).
 */
public enum QueueStatus {
    /**
     * Enqueued by the producer, not yet picked up by a batch.
     */
    QUEUED,

    /**
     * Claimed by the current batch and awaiting its validation result.
     */
    PROCESSING,

    /**
     * Validated successfully by SUNAT.
     */
    DONE,

    /**
     * Validation or persistence failed. Never re-queued automatically.
     */
    ERROR
}
