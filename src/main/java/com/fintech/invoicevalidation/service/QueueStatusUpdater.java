package com.fintech.invoicevalidation.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fintech.invoicevalidation.repository.QueueItemRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Sole writer of the terminal queue statuses.
 * <p>
 * Both transitions only apply to items in PROCESSING; an update that finds the
 * item in any other status is logged and ignored.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class QueueStatusUpdater {

    static final int ERROR_MAX_LENGTH = 3900;

    private final QueueItemRepository queueItemRepository;
    private final ObjectMapper objectMapper;

    @Transactional
    public void markDone(Long queueId) {
        int updated = queueItemRepository.markDone(queueId);
        if (updated == 0) {
            log.warn("Queue item {} was not in PROCESSING, DONE not applied", queueId);
        }
    }

    /**
     * Marks the item as failed with a validation failure payload.
     */
    @Transactional
    public void markError(Long queueId, JsonNode errorPayload) {
        applyError(queueId, toText(errorPayload));
    }

    /**
     * Marks the item as failed with the exception that interrupted its processing.
     */
    @Transactional
    public void markError(Long queueId, Throwable error) {
        applyError(queueId, error.getClass().getSimpleName() + ": " + error.getMessage());
    }

    private void applyError(Long queueId, String errorText) {
        int updated = queueItemRepository.markError(queueId, truncate(errorText));
        if (updated == 0) {
            log.warn("Queue item {} was not in PROCESSING, ERROR not applied", queueId);
        }
    }

    private String toText(JsonNode payload) {
        if (payload == null) {
            return "unknown";
        }
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            return payload.toString();
        }
    }

    static String truncate(String text) {
        if (text == null) {
            return null;
        }
        return text.length() <= ERROR_MAX_LENGTH ? text : text.substring(0, ERROR_MAX_LENGTH);
    }
}
