package com.fintech.invoicevalidation.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * One purchase invoice awaiting (or undergoing) validation against SUNAT.
 * <p>
 * Rows are inserted by an external producer. This service only claims them
 * and moves them to a terminal status.
 */
@Entity
@Table(name = "invoice_validation_queue", indexes = {
        @Index(name = "idx_queue_status_enqueued_at", columnList = "status, enqueued_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueueItem {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "invoice_id", nullable = false)
    private Long invoiceId;

    @Column(name = "issuer_ruc", nullable = false, length = 20)
    private String issuerRuc;

    @Column(name = "receiver_ruc", length = 20)
    private String receiverRuc;

    @Column(name = "document_type", nullable = false, length = 2)
    private String documentType;

    @Column(nullable = false, length = 10)
    private String series;

    @Column(name = "doc_number", nullable = false, length = 20)
    private String docNumber;

    @Column(name = "issue_date")
    private LocalDate issueDate;

    @Column(name = "total_amount", precision = 18, scale = 2)
    private BigDecimal totalAmount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private QueueStatus status = QueueStatus.QUEUED;

    @Column(nullable = false)
    @Builder.Default
    private Integer attempts = 0;

    @Column(name = "last_error", length = 4000)
    private String lastError;

    @Column(name = "enqueued_at", nullable = false)
    private LocalDateTime enqueuedAt;

    /**
     * Marks this item as claimed by the current batch.
     */
    public void claim() {
        this.status = QueueStatus.PROCESSING;
        this.attempts = (this.attempts == null ? 0 : this.attempts) + 1;
    }
}
