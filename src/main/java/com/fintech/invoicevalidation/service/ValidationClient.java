package com.fintech.invoicevalidation.service;

import com.fintech.invoicevalidation.dto.AccessToken;
import com.fintech.invoicevalidation.dto.ValidationResponse;
import com.fintech.invoicevalidation.entity.QueueItem;

/**
 * Client of the SUNAT invoice validation API.
 * <p>
 * Implementations never throw for HTTP or transport failures: every outcome is
 * returned as a {@link ValidationResponse} so it can be recorded in the history.
 */
public interface ValidationClient {

    /**
     * Validates one queued invoice.
     *
     * @param token bearer token to authenticate the call
     * @param item  the claimed queue item
     * @return success with the decoded body, or failure with the error payload
     */
    ValidationResponse validate(AccessToken token, QueueItem item);
}
