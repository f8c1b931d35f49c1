package com.fintech.invoicevalidation.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Captures the results of one claim-validate-reconcile cycle.
 * Used for logging, the admin API and tests.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BatchResult {

    private LocalDateTime startedAt;
    private LocalDateTime completedAt;

    @Builder.Default
    private int totalClaimed = 0;

    @Builder.Default
    private int validated = 0;

    @Builder.Default
    private int failed = 0;

    @Builder.Default
    private int finalRowsSynced = 0;

    @Builder.Default
    private boolean finalSyncFailed = false;

    @Builder.Default
    private List<ItemError> errorDetails = new ArrayList<>();

    /**
     * Per-item failure details.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ItemError {
        private Long queueId;
        private Long invoiceId;
        private String errorMessage;
        private LocalDateTime occurredAt;
    }

    public void incrementValidated() {
        this.validated++;
    }

    public void incrementFailed() {
        this.failed++;
    }

    public void addError(Long queueId, Long invoiceId, String errorMessage, LocalDateTime occurredAt) {
        this.failed++;
        if (this.errorDetails == null) {
            this.errorDetails = new ArrayList<>();
        }
        this.errorDetails.add(ItemError.builder()
                .queueId(queueId)
                .invoiceId(invoiceId)
                .errorMessage(errorMessage)
                .occurredAt(occurredAt)
                .build());
    }

    public boolean isEmpty() {
        return totalClaimed == 0;
    }

    public long getDurationMs() {
        if (startedAt == null || completedAt == null) {
            return 0;
        }
        return java.time.Duration.between(startedAt, completedAt).toMillis();
    }
}
