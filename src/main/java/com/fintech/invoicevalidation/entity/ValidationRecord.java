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
 * Audit entry for a single validation attempt.
 * <p>
 * Document identity fields are copied from the queue item at the time of the
 * attempt. Rows are insert-only.
 */
@Entity
@Table(name = "invoice_validation_history", indexes = {
        @Index(name = "idx_history_invoice_queried_at", columnList = "invoice_id, queried_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ValidationRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "invoice_id", nullable = false, updatable = false)
    private Long invoiceId;

    @Column(name = "issuer_ruc", nullable = false, updatable = false, length = 20)
    private String issuerRuc;

    @Column(name = "receiver_ruc", updatable = false, length = 20)
    private String receiverRuc;

    @Column(name = "document_type", nullable = false, updatable = false, length = 2)
    private String documentType;

    @Column(nullable = false, updatable = false, length = 10)
    private String series;

    @Column(name = "doc_number", nullable = false, updatable = false, length = 20)
    private String docNumber;

    @Column(name = "issue_date", updatable = false)
    private LocalDate issueDate;

    @Column(name = "total_amount", updatable = false, precision = 18, scale = 2)
    private BigDecimal totalAmount;

    @Column(name = "sunat_status", updatable = false, length = 40)
    private String sunatStatus;

    @Column(name = "response_code", updatable = false, length = 40)
    private String responseCode;

    @Column(updatable = false, length = 500)
    private String message;

    @Column(name = "queried_at", nullable = false, updatable = false)
    private LocalDateTime queriedAt;

    @Column(name = "token_expires_at", updatable = false)
    private LocalDateTime tokenExpiresAt;

    @Column(name = "raw_json", updatable = false, length = 100_000)
    private String rawJson;
}
