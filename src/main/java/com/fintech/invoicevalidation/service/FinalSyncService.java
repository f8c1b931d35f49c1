package com.fintech.invoicevalidation.service;

import com.fintech.invoicevalidation.entity.FinalRecord;
import com.fintech.invoicevalidation.entity.StateSnapshot;
import com.fintech.invoicevalidation.repository.FinalRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;

/**
 * Mirrors the snapshot into the SUNAT columns of the purchase invoice header.
 * <p>
 * Only header rows that differ from their snapshot are touched, so running it
 * again over an unchanged snapshot modifies nothing. Header rows without a
 * snapshot are left alone and no header rows are ever created.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FinalSyncService {

    private final FinalRecordRepository finalRecordRepository;

    /**
     * @return number of header rows modified
     */
    @Transactional(isolation = Isolation.READ_COMMITTED)
    public int syncFinal() {
        List<Object[]> candidates = finalRecordRepository.findOutOfSync();
        log.debug("Header rows out of sync with snapshot: {}", candidates.size());

        List<FinalRecord> modified = new ArrayList<>();
        for (Object[] row : candidates) {
            FinalRecord header = (FinalRecord) row[0];
            StateSnapshot snapshot = (StateSnapshot) row[1];
            if (header.mirror(snapshot)) {
                modified.add(header);
            }
        }

        if (!modified.isEmpty()) {
            finalRecordRepository.saveAll(modified);
            finalRecordRepository.flush();
            log.info("SUNAT columns updated in {} purchase invoice header rows", modified.size());
        }
        return modified.size();
    }
}
