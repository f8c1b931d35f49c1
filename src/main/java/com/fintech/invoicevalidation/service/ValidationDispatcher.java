package com.fintech.invoicevalidation.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fintech.invoicevalidation.dto.AccessToken;
import com.fintech.invoicevalidation.dto.ValidationResponse;
import com.fintech.invoicevalidation.entity.QueueItem;
import com.fintech.invoicevalidation.exception.InvoiceValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.Future;
import java.util.function.Consumer;

/**
 * Fans the validation calls of a batch out to the worker pool.
 * <p>
 * Results are handed back on the calling thread in completion order, so the
 * consumer can write to the database without any further synchronization.
 */
@Service
@Slf4j
public class ValidationDispatcher {

    private final ValidationClient validationClient;
    private final Executor executor;
    private final ObjectMapper objectMapper;

    public ValidationDispatcher(ValidationClient validationClient,
                                @Qualifier("validationExecutor") Executor executor,
                                ObjectMapper objectMapper) {
        this.validationClient = validationClient;
        this.executor = executor;
        this.objectMapper = objectMapper;
    }

    /**
     * A claimed item together with its validation result.
     */
    public record DispatchedValidation(QueueItem item, ValidationResponse response) {
    }

    /**
     * Validates every item concurrently and blocks until all of them are handed
     * to {@code onCompleted}.
     */
    public void dispatch(AccessToken token, List<QueueItem> items, Consumer<DispatchedValidation> onCompleted) {
        CompletionService<DispatchedValidation> completionService = new ExecutorCompletionService<>(executor);
        for (QueueItem item : items) {
            completionService.submit(() -> new DispatchedValidation(item, validateSafely(token, item)));
        }

        for (int i = 0; i < items.size(); i++) {
            Future<DispatchedValidation> completed;
            try {
                completed = completionService.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new InvoiceValidationException(
                        "Interrupted while waiting for validation results, " + (items.size() - i) + " pending", e);
            }
            onCompleted.accept(getResult(completed));
        }
    }

    private ValidationResponse validateSafely(AccessToken token, QueueItem item) {
        try {
            return validationClient.validate(token, item);
        } catch (RuntimeException e) {
            log.warn("Validation call for invoice {} failed unexpectedly: {}", item.getInvoiceId(), e.getMessage());
            ObjectNode failure = objectMapper.createObjectNode();
            failure.put("error", e.getClass().getSimpleName() + ": " + e.getMessage());
            return ValidationResponse.failure(failure);
        }
    }

    private DispatchedValidation getResult(Future<DispatchedValidation> completed) {
        try {
            return completed.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InvoiceValidationException("Interrupted while reading a validation result", e);
        } catch (ExecutionException e) {
            // validateSafely already converts failures, so this only covers pool errors
            throw new InvoiceValidationException("Validation task failed", e.getCause());
        }
    }
}
