package com.fintech.invoicevalidation.dto;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Value;

/**
 * Result of one validation call.
 * <p>
 * On success the payload is the decoded response body. On failure it holds
 * either the HTTP status with the decoded (or raw) body, or the transport error.
 */
@Value
public class ValidationResponse {

    boolean ok;
    JsonNode payload;

    public static ValidationResponse success(JsonNode payload) {
        return new ValidationResponse(true, payload);
    }

    public static ValidationResponse failure(JsonNode payload) {
        return new ValidationResponse(false, payload);
    }
}
