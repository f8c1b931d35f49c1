package com.fintech.invoicevalidation.service;

import com.fintech.invoicevalidation.dto.ValidationOutcome;
import com.fintech.invoicevalidation.entity.QueueItem;
import com.fintech.invoicevalidation.entity.StateSnapshot;
import com.fintech.invoicevalidation.repository.StateSnapshotRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Objects;
import java.util.Optional;

/**
 * Keeps one current-state row per invoice and detects real status transitions.
 * <p>
 * The new status is compared against the values stored by the previous
 * reconciliation, so transitions are detected across batches.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SnapshotReconciler {

    private final StateSnapshotRepository stateSnapshotRepository;
    private final Clock clock;

    @Transactional
    public void reconcile(QueueItem item, ValidationOutcome outcome) {
        LocalDateTime now = LocalDateTime.now(clock).truncatedTo(ChronoUnit.MICROS);
        Optional<StateSnapshot> existing = stateSnapshotRepository.findById(item.getInvoiceId());

        if (existing.isEmpty()) {
            stateSnapshotRepository.save(StateSnapshot.builder()
                    .invoiceId(item.getInvoiceId())
                    .issuerRuc(item.getIssuerRuc())
                    .receiverRuc(item.getReceiverRuc())
                    .documentType(item.getDocumentType())
                    .series(item.getSeries())
                    .docNumber(item.getDocNumber())
                    .totalAmount(item.getTotalAmount())
                    .currentStatus(outcome.getStatusText())
                    .statusDescription(outcome.getStatusDescription())
                    .responseCode(outcome.getStatusCode())
                    .message(outcome.getMessage())
                    .firstQueriedAt(now)
                    .lastQueriedAt(now)
                    .lastChangedAt(now)
                    .statusChanged(outcome.getStatusText() != null)
                    .build());
            log.debug("Created snapshot for invoice {} with status {}", item.getInvoiceId(), outcome.getStatusText());
            return;
        }

        StateSnapshot snapshot = existing.get();
        if (hasChanged(snapshot, outcome)) {
            log.info("Invoice {} changed SUNAT status from {} to {}",
                    item.getInvoiceId(), snapshot.getCurrentStatus(), outcome.getStatusText());
            snapshot.setCurrentStatus(outcome.getStatusText());
            snapshot.setStatusDescription(outcome.getStatusDescription());
            snapshot.setLastChangedAt(now);
            snapshot.setStatusChanged(true);
        } else {
            snapshot.setStatusChanged(false);
        }
        snapshot.setResponseCode(outcome.getStatusCode());
        snapshot.setMessage(outcome.getMessage());
        snapshot.setLastQueriedAt(now);

        stateSnapshotRepository.save(snapshot);
    }

    /**
     * Exact comparison of (status, description), null treated as empty.
     */
    static boolean hasChanged(StateSnapshot previous, ValidationOutcome outcome) {
        return !Objects.equals(nullToEmpty(previous.getCurrentStatus()), nullToEmpty(outcome.getStatusText()))
                || !Objects.equals(nullToEmpty(previous.getStatusDescription()), nullToEmpty(outcome.getStatusDescription()));
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
