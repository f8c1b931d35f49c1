package com.fintech.invoicevalidation.dto;

import lombok.ToString;
import lombok.Value;

import java.time.Duration;
import java.time.LocalDateTime;

/**
 * Bearer token issued by the SUNAT security API, with its UTC expiry.
 */
@Value
public class AccessToken {

    @ToString.Exclude
    String value;

    LocalDateTime expiresAt;

    /**
     * True when the token stays valid for longer than {@code margin} after {@code now}.
     */
    public boolean isValidAt(LocalDateTime now, Duration margin) {
        return value != null
                && expiresAt != null
                && expiresAt.isAfter(now.plus(margin));
    }
}
