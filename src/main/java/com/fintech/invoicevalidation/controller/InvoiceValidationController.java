package com.fintech.invoicevalidation.controller;

import com.fintech.invoicevalidation.dto.BatchResult;
import com.fintech.invoicevalidation.entity.QueueItem;
import com.fintech.invoicevalidation.entity.QueueStatus;
import com.fintech.invoicevalidation.entity.StateSnapshot;
import com.fintech.invoicevalidation.entity.ValidationRecord;
import com.fintech.invoicevalidation.repository.QueueItemRepository;
import com.fintech.invoicevalidation.repository.StateSnapshotRepository;
import com.fintech.invoicevalidation.repository.ValidationRecordRepository;
import com.fintech.invoicevalidation.service.FinalSyncService;
import com.fintech.invoicevalidation.service.InvoiceValidationService;
import com.fintech.invoicevalidation.service.InvoiceValidationService.QueueStats;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * Admin API of the invoice validation worker.
 * <p>
 * Provides endpoints for:
 * - Triggering a batch or the header sync manually
 * - Viewing queue statistics and items waiting for manual review
 * - Looking up the snapshot and validation history of an invoice
 */
@RestController
@RequestMapping("/api/v1/invoice-validation")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Invoice Validation", description = "SUNAT invoice validation operations API")
public class InvoiceValidationController {

    private final InvoiceValidationService invoiceValidationService;
    private final FinalSyncService finalSyncService;
    private final QueueItemRepository queueItemRepository;
    private final StateSnapshotRepository stateSnapshotRepository;
    private final ValidationRecordRepository validationRecordRepository;

    @Operation(
            summary = "Run one batch",
            description = "Claims a batch of queued invoices, validates them against SUNAT and updates history, snapshot and invoice header."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Batch completed",
                    content = @Content(schema = @Schema(implementation = BatchResult.class))),
            @ApiResponse(responseCode = "409", description = "A batch is already in progress")
    })
    @PostMapping("/run")
    public ResponseEntity<BatchResult> runBatch() {
        log.info("Manual invoice validation batch triggered via API");
        return ResponseEntity.ok(invoiceValidationService.processBatch());
    }

    @Operation(
            summary = "Sync invoice header",
            description = "Mirrors the current snapshot into the SUNAT columns of the purchase invoice header. Safe to repeat."
    )
    @ApiResponse(responseCode = "200", description = "Number of header rows updated")
    @PostMapping("/final-sync")
    public ResponseEntity<Map<String, Integer>> runFinalSync() {
        log.info("Manual invoice header sync triggered via API");
        return ResponseEntity.ok(Map.of("affected", finalSyncService.syncFinal()));
    }

    @Operation(
            summary = "Get queue statistics",
            description = "Returns the number of queue items per status and whether a batch is running."
    )
    @ApiResponse(responseCode = "200", description = "Statistics retrieved successfully",
            content = @Content(schema = @Schema(implementation = QueueStats.class)))
    @GetMapping("/stats")
    public ResponseEntity<QueueStats> getStats() {
        return ResponseEntity.ok(invoiceValidationService.getStats());
    }

    @Operation(
            summary = "Get failed queue items",
            description = "Returns queue items in ERROR. They are not retried automatically and need manual review."
    )
    @ApiResponse(responseCode = "200", description = "Failed items retrieved successfully")
    @GetMapping("/queue/errors")
    public ResponseEntity<Page<QueueItem>> getFailedItems(
            @Parameter(description = "Page number (0-indexed)") @RequestParam(defaultValue = "0") int page,
            @Parameter(description = "Page size") @RequestParam(defaultValue = "20") int size) {

        Page<QueueItem> items = queueItemRepository.findByStatus(
                QueueStatus.ERROR,
                PageRequest.of(page, size, Sort.by("enqueuedAt"))
        );
        return ResponseEntity.ok(items);
    }

    @Operation(
            summary = "Get current status of an invoice",
            description = "Returns the snapshot row holding the latest SUNAT status of the invoice."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Snapshot found",
                    content = @Content(schema = @Schema(implementation = StateSnapshot.class))),
            @ApiResponse(responseCode = "404", description = "Invoice never validated")
    })
    @GetMapping("/snapshots/{invoiceId}")
    public ResponseEntity<StateSnapshot> getSnapshot(
            @Parameter(description = "Invoice ID") @PathVariable Long invoiceId) {
        return stateSnapshotRepository.findById(invoiceId)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @Operation(
            summary = "Get validation history of an invoice",
            description = "Returns every validation attempt of the invoice, newest first."
    )
    @ApiResponse(responseCode = "200", description = "History retrieved successfully")
    @GetMapping("/history/{invoiceId}")
    public ResponseEntity<List<ValidationRecord>> getHistory(
            @Parameter(description = "Invoice ID") @PathVariable Long invoiceId) {
        return ResponseEntity.ok(validationRecordRepository.findByInvoiceIdOrderByQueriedAtDescIdDesc(invoiceId));
    }

    @Operation(
            summary = "Health check",
            description = "Returns the health status of the worker together with queue counts."
    )
    @ApiResponse(responseCode = "200", description = "Service is healthy")
    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> healthCheck() {
        QueueStats stats = invoiceValidationService.getStats();

        Map<String, Object> health = Map.of(
                "status", "UP",
                "queue", Map.of(
                        "isBatchRunning", stats.isBatchRunning(),
                        "queued", stats.getQueuedCount(),
                        "processing", stats.getProcessingCount(),
                        "done", stats.getDoneCount(),
                        "error", stats.getErrorCount()
                )
        );

        return ResponseEntity.ok(health);
    }
}
