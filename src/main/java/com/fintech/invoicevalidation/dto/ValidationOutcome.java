package com.fintech.invoicevalidation.dto;

import lombok.Value;

/**
 * Mapped status plus the message extracted from a validation payload.
 * Passed from the history recorder to the snapshot reconciler.
 */
@Value
public class ValidationOutcome {

    String statusText;
    String statusDescription;
    String statusCode;
    String message;

    public static ValidationOutcome of(MappedStatus status, String message) {
        return new ValidationOutcome(
                status.getStatusText(),
                status.getStatusDescription(),
                status.getStatusCode(),
                message);
    }
}
