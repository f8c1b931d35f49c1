package com.fintech.invoicevalidation.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fintech.invoicevalidation.dto.MappedStatus;
import com.fintech.invoicevalidation.dto.ValidationOutcome;
import com.fintech.invoicevalidation.entity.QueueItem;
import com.fintech.invoicevalidation.entity.ValidationRecord;
import com.fintech.invoicevalidation.exception.InvoiceValidationException;
import com.fintech.invoicevalidation.repository.ValidationRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;

/**
 * Appends one {@link ValidationRecord} per processed item, whatever the outcome
 * of the validation call.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class HistoryRecorder {

    private static final int MESSAGE_MAX_LENGTH = 500;

    private final ValidationRecordRepository validationRecordRepository;
    private final StatusMapper statusMapper;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    /**
     * Records the attempt and returns the mapped status with the payload message.
     *
     * @param tokenExpiresAt expiry of the token used for the call
     * @param payload        success body or failure payload
     */
    @Transactional
    public ValidationOutcome recordHistory(QueueItem item, LocalDateTime tokenExpiresAt, JsonNode payload) {
        MappedStatus status = statusMapper.mapStatus(payload);
        String message = extractMessage(payload);

        ValidationRecord record = ValidationRecord.builder()
                .invoiceId(item.getInvoiceId())
                .issuerRuc(item.getIssuerRuc())
                .receiverRuc(item.getReceiverRuc())
                .documentType(item.getDocumentType())
                .series(item.getSeries())
                .docNumber(item.getDocNumber())
                .issueDate(item.getIssueDate())
                .totalAmount(item.getTotalAmount())
                .sunatStatus(status.getStatusText())
                .responseCode(status.getStatusCode())
                .message(message)
                .queriedAt(LocalDateTime.now(clock).truncatedTo(ChronoUnit.MICROS))
                .tokenExpiresAt(tokenExpiresAt)
                .rawJson(toJson(payload))
                .build();
        validationRecordRepository.save(record);

        log.debug("Recorded validation of invoice {}: status={} code={}",
                item.getInvoiceId(), status.getStatusText(), status.getStatusCode());

        return ValidationOutcome.of(status, message);
    }

    /**
     * First non-empty of {@code message}, {@code mensaje} and {@code observacion}.
     */
    static String extractMessage(JsonNode payload) {
        if (payload == null || !payload.isObject()) {
            return null;
        }
        for (String field : new String[]{"message", "mensaje", "observacion"}) {
            JsonNode value = payload.get(field);
            if (value != null && !value.isNull()) {
                String text = value.isValueNode() ? value.asText() : value.toString();
                if (!text.isEmpty()) {
                    return text.length() <= MESSAGE_MAX_LENGTH ? text : text.substring(0, MESSAGE_MAX_LENGTH);
                }
            }
        }
        return null;
    }

    private String toJson(JsonNode payload) {
        if (payload == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new InvoiceValidationException("Could not serialize validation payload", e);
        }
    }
}
