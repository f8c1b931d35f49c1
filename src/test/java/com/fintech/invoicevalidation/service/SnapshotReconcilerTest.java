package com.fintech.invoicevalidation.service;

import com.fintech.invoicevalidation.dto.MappedStatus;
import com.fintech.invoicevalidation.dto.SunatStatus;
import com.fintech.invoicevalidation.dto.ValidationOutcome;
import com.fintech.invoicevalidation.entity.QueueItem;
import com.fintech.invoicevalidation.entity.StateSnapshot;
import com.fintech.invoicevalidation.repository.StateSnapshotRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SnapshotReconcilerTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2024, 3, 1, 12, 0);
    private static final LocalDateTime EARLIER = LocalDateTime.of(2024, 2, 1, 9, 30);

    @Mock
    private StateSnapshotRepository stateSnapshotRepository;

    private SnapshotReconciler snapshotReconciler;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2024-03-01T12:00:00Z"), ZoneOffset.UTC);
        snapshotReconciler = new SnapshotReconciler(stateSnapshotRepository, clock);
    }

    private QueueItem item() {
        return QueueItem.builder()
                .id(7L)
                .invoiceId(100L)
                .issuerRuc("20123456789")
                .documentType("01")
                .series("F001")
                .docNumber("123")
                .totalAmount(new BigDecimal("150.50"))
                .build();
    }

    private ValidationOutcome outcome(SunatStatus status, String message) {
        return ValidationOutcome.of(MappedStatus.of(status), message);
    }

    private StateSnapshot existing(SunatStatus status) {
        return StateSnapshot.builder()
                .invoiceId(100L)
                .issuerRuc("20123456789")
                .documentType("01")
                .series("F001")
                .docNumber("123")
                .currentStatus(status.getLabel())
                .statusDescription(status.getDescription())
                .responseCode(status.getCode())
                .firstQueriedAt(EARLIER)
                .lastQueriedAt(EARLIER)
                .lastChangedAt(EARLIER)
                .statusChanged(true)
                .build();
    }

    private StateSnapshot captureSaved() {
        ArgumentCaptor<StateSnapshot> captor = ArgumentCaptor.forClass(StateSnapshot.class);
        verify(stateSnapshotRepository).save(captor.capture());
        return captor.getValue();
    }

    @Nested
    @DisplayName("First validation of an invoice")
    class InsertTests {

        @Test
        @DisplayName("Creates the snapshot flagged as changed")
        void createsSnapshot() {
            when(stateSnapshotRepository.findById(100L)).thenReturn(Optional.empty());

            snapshotReconciler.reconcile(item(), outcome(SunatStatus.ACEPTADO, "ok"));

            StateSnapshot saved = captureSaved();
            assertThat(saved.getInvoiceId()).isEqualTo(100L);
            assertThat(saved.getSeries()).isEqualTo("F001");
            assertThat(saved.getCurrentStatus()).isEqualTo("ACEPTADO");
            assertThat(saved.getStatusDescription()).isEqualTo("ACEPTADO (1)");
            assertThat(saved.getResponseCode()).isEqualTo("1");
            assertThat(saved.getMessage()).isEqualTo("ok");
            assertThat(saved.isStatusChanged()).isTrue();
            assertThat(saved.getFirstQueriedAt()).isEqualTo(NOW);
            assertThat(saved.getLastQueriedAt()).isEqualTo(NOW);
            assertThat(saved.getLastChangedAt()).isEqualTo(NOW);
        }

        @Test
        @DisplayName("Creates the snapshot unflagged when no status was obtained")
        void createsSnapshotWithoutStatus() {
            when(stateSnapshotRepository.findById(100L)).thenReturn(Optional.empty());

            snapshotReconciler.reconcile(item(), ValidationOutcome.of(MappedStatus.EMPTY, null));

            StateSnapshot saved = captureSaved();
            assertThat(saved.getCurrentStatus()).isNull();
            assertThat(saved.isStatusChanged()).isFalse();
        }
    }

    @Nested
    @DisplayName("Subsequent validations")
    class UpdateTests {

        @Test
        @DisplayName("Same status only refreshes the query timestamp and clears the flag")
        void unchangedStatus() {
            when(stateSnapshotRepository.findById(100L)).thenReturn(Optional.of(existing(SunatStatus.ACEPTADO)));

            snapshotReconciler.reconcile(item(), outcome(SunatStatus.ACEPTADO, "again"));

            StateSnapshot saved = captureSaved();
            assertThat(saved.isStatusChanged()).isFalse();
            assertThat(saved.getCurrentStatus()).isEqualTo("ACEPTADO");
            assertThat(saved.getMessage()).isEqualTo("again");
            assertThat(saved.getFirstQueriedAt()).isEqualTo(EARLIER);
            assertThat(saved.getLastChangedAt()).isEqualTo(EARLIER);
            assertThat(saved.getLastQueriedAt()).isEqualTo(NOW);
        }

        @Test
        @DisplayName("Different status is recorded as a transition")
        void changedStatus() {
            when(stateSnapshotRepository.findById(100L)).thenReturn(Optional.of(existing(SunatStatus.ACEPTADO)));

            snapshotReconciler.reconcile(item(), outcome(SunatStatus.ANULADO, null));

            StateSnapshot saved = captureSaved();
            assertThat(saved.isStatusChanged()).isTrue();
            assertThat(saved.getCurrentStatus()).isEqualTo("ANULADO");
            assertThat(saved.getStatusDescription()).isEqualTo("ANULADO (2)");
            assertThat(saved.getResponseCode()).isEqualTo("2");
            assertThat(saved.getLastChangedAt()).isEqualTo(NOW);
            assertThat(saved.getFirstQueriedAt()).isEqualTo(EARLIER);
        }

        @Test
        @DisplayName("Losing the status counts as a transition")
        void statusLost() {
            when(stateSnapshotRepository.findById(100L)).thenReturn(Optional.of(existing(SunatStatus.AUTORIZADO)));

            snapshotReconciler.reconcile(item(), ValidationOutcome.of(MappedStatus.EMPTY, null));

            StateSnapshot saved = captureSaved();
            assertThat(saved.isStatusChanged()).isTrue();
            assertThat(saved.getCurrentStatus()).isNull();
            assertThat(saved.getResponseCode()).isNull();
        }
    }

    @Test
    @DisplayName("Null and empty status compare equal")
    void nullEqualsEmpty() {
        StateSnapshot previous = StateSnapshot.builder().currentStatus("").statusDescription(null).build();
        ValidationOutcome outcome = new ValidationOutcome(null, "", null, null);

        assertThat(SnapshotReconciler.hasChanged(previous, outcome)).isFalse();
    }
}
