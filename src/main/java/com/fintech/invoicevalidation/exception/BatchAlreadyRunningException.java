package com.fintech.invoicevalidation.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * Thrown when a batch cycle is requested while another one is still running.
 */
@ResponseStatus(HttpStatus.CONFLICT)
public class BatchAlreadyRunningException extends InvoiceValidationException {

    public BatchAlreadyRunningException() {
        super("Invoice validation batch already in progress");
    }
}
