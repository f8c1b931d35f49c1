package com.fintech.invoicevalidation.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Latest known SUNAT status of an invoice. Exactly one row per invoice id.
 */
@Entity
@Table(name = "invoice_status_snapshot", indexes = {
        @Index(name = "idx_snapshot_document", columnList = "issuer_ruc, document_type, series, doc_number")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StateSnapshot {

    @Id
    @Column(name = "invoice_id")
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

    @Column(name = "total_amount", precision = 18, scale = 2)
    private BigDecimal totalAmount;

    @Column(name = "current_status", length = 40)
    private String currentStatus;

    @Column(name = "status_description", length = 200)
    private String statusDescription;

    @Column(name = "response_code", length = 40)
    private String responseCode;

    @Column(length = 500)
    private String message;

    /**
     * Set on insert only.
     */
    @Column(name = "first_queried_at", updatable = false)
    private LocalDateTime firstQueriedAt;

    @Column(name = "last_queried_at")
    private LocalDateTime lastQueriedAt;

    @Column(name = "last_changed_at")
    private LocalDateTime lastChangedAt;

    @Column(name = "status_changed", nullable = false)
    private boolean statusChanged;
}
