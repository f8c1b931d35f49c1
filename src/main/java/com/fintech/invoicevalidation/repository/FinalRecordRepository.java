package com.fintech.invoicevalidation.repository;

import com.fintech.invoicevalidation.entity.FinalRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Access to the SUNAT mirror columns of the purchase invoice header.
 */
@Repository
public interface FinalRecordRepository extends JpaRepository<FinalRecord, Long> {

    /**
     * Header rows whose mirror columns differ from their snapshot, paired with
     * that snapshot. Each element is {@code [FinalRecord, StateSnapshot]}.
     * <p>
     * Comparisons are null-safe. The first query timestamp only counts while the
     * header value is still empty, and the change timestamp only when the
     * snapshot reports a status change.
     */
    @Query("SELECT d, s FROM FinalRecord d JOIN StateSnapshot s ON s.invoiceId = d.invoiceId " +
            "WHERE COALESCE(d.sunatLastStatus, '') <> COALESCE(s.currentStatus, '') " +
            "OR COALESCE(d.sunatStatusDescription, '') <> COALESCE(s.statusDescription, '') " +
            "OR COALESCE(d.sunatResponseCode, '') <> COALESCE(s.responseCode, '') " +
            "OR COALESCE(d.sunatMessage, '') <> COALESCE(s.message, '') " +
            "OR d.sunatStatusChanged IS NULL " +
            "OR d.sunatStatusChanged <> s.statusChanged " +
            "OR (d.sunatFirstQueriedAt IS NULL AND s.firstQueriedAt IS NOT NULL) " +
            "OR (d.sunatLastQueriedAt IS NULL AND s.lastQueriedAt IS NOT NULL) " +
            "OR (d.sunatLastQueriedAt IS NOT NULL AND s.lastQueriedAt IS NULL) " +
            "OR d.sunatLastQueriedAt <> s.lastQueriedAt " +
            "OR (s.statusChanged = true AND (d.sunatChangedAt IS NULL OR d.sunatChangedAt <> s.lastChangedAt))")
    List<Object[]> findOutOfSync();
}
