package com.fintech.invoicevalidation.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.DynamicUpdate;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * Purchase invoice header owned by the accounting subsystem.
 * <p>
 * Only the invoice id and the SUNAT mirror columns are mapped. This service
 * never inserts or deletes header rows, it only overwrites the mirror columns.
 */
@Entity
@Table(name = "purchase_invoice_header")
@DynamicUpdate
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FinalRecord {

    @Id
    @Column(name = "invoice_id")
    private Long invoiceId;

    @Column(name = "sunat_last_status", length = 40)
    private String sunatLastStatus;

    @Column(name = "sunat_status_description", length = 200)
    private String sunatStatusDescription;

    @Column(name = "sunat_response_code", length = 40)
    private String sunatResponseCode;

    @Column(name = "sunat_message", length = 500)
    private String sunatMessage;

    @Column(name = "sunat_status_changed")
    private Boolean sunatStatusChanged;

    @Column(name = "sunat_first_queried_at")
    private LocalDateTime sunatFirstQueriedAt;

    @Column(name = "sunat_last_queried_at")
    private LocalDateTime sunatLastQueriedAt;

    @Column(name = "sunat_changed_at")
    private LocalDateTime sunatChangedAt;

    /**
     * Copies the snapshot state into the mirror columns.
     * <p>
     * The first query timestamp is kept when already present, and the change
     * timestamp only moves when the snapshot reports a status change.
     *
     * @return true if any column was modified
     */
    public boolean mirror(StateSnapshot snapshot) {
        LocalDateTime firstQueried = sunatFirstQueriedAt != null
                ? sunatFirstQueriedAt
                : snapshot.getFirstQueriedAt();
        LocalDateTime changedAt = snapshot.isStatusChanged()
                ? snapshot.getLastChangedAt()
                : sunatChangedAt;

        boolean modified = !Objects.equals(sunatLastStatus, snapshot.getCurrentStatus())
                || !Objects.equals(sunatStatusDescription, snapshot.getStatusDescription())
                || !Objects.equals(sunatResponseCode, snapshot.getResponseCode())
                || !Objects.equals(sunatMessage, snapshot.getMessage())
                || !Objects.equals(sunatStatusChanged, snapshot.isStatusChanged())
                || !Objects.equals(sunatFirstQueriedAt, firstQueried)
                || !Objects.equals(sunatLastQueriedAt, snapshot.getLastQueriedAt())
                || !Objects.equals(sunatChangedAt, changedAt);

        if (modified) {
            sunatLastStatus = snapshot.getCurrentStatus();
            sunatStatusDescription = snapshot.getStatusDescription();
            sunatResponseCode = snapshot.getResponseCode();
            sunatMessage = snapshot.getMessage();
            sunatStatusChanged = snapshot.isStatusChanged();
            sunatFirstQueriedAt = firstQueried;
            sunatLastQueriedAt = snapshot.getLastQueriedAt();
            sunatChangedAt = changedAt;
        }
        return modified;
    }
}
