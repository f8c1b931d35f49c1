package com.fintech.invoicevalidation.repository;

import com.fintech.invoicevalidation.entity.StateSnapshot;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface StateSnapshotRepository extends JpaRepository<StateSnapshot, Long> {
}
