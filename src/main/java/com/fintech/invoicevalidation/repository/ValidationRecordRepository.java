package com.fintech.invoicevalidation.repository;

import com.fintech.invoicevalidation.entity.ValidationRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Append-only validation history. Only {@code save} is used for writes.
 */
@Repository
public interface ValidationRecordRepository extends JpaRepository<ValidationRecord, Long> {

    List<ValidationRecord> findByInvoiceIdOrderByQueriedAtDescIdDesc(Long invoiceId);

    long countByInvoiceId(Long invoiceId);
}
