package com.fintech.invoicevalidation.exception;

/**
 * Base exception for invoice validation errors.
 */
public class InvoiceValidationException extends RuntimeException {

    public InvoiceValidationException(String message) {
        super(message);
    }

    public InvoiceValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
