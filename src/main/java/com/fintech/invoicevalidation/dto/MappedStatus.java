package com.fintech.invoicevalidation.dto;

import lombok.Value;

/**
 * Canonical status derived from a SUNAT payload. All fields are null when the
 * payload carries no status code.
 */
@Value
public class MappedStatus {

    public static final MappedStatus EMPTY = new MappedStatus(null, null, null);

    String statusText;
    String statusDescription;
    String statusCode;

    public static MappedStatus of(SunatStatus status) {
        return new MappedStatus(status.getLabel(), status.getDescription(), status.getCode());
    }

    /**
     * Synthetic status for codes outside the catalog, so they are never dropped.
     */
    public static MappedStatus unmapped(String code) {
        return new MappedStatus("CODE_" + code, "NO_MAPEADO (" + code + ")", code);
    }
}
