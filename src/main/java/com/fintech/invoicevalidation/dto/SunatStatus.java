package com.fintech.invoicevalidation.dto;

import java.util.Arrays;
import java.util.Optional;

/**
 * Catalog of {@code estadoCp} values returned by the SUNAT validation API.
 */
public enum SunatStatus {

    NO_EXISTE("0", "NO EXISTE"),
    ACEPTADO("1", "ACEPTADO"),
    ANULADO("2", "ANULADO"),
    AUTORIZADO("3", "AUTORIZADO"),
    NO_AUTORIZADO("4", "NO AUTORIZADO");

    private final String code;
    private final String label;

    SunatStatus(String code, String label) {
        this.code = code;
        this.label = label;
    }

    public String getCode() {
        return code;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Label followed by the code, e.g. {@code "ACEPTADO (1)"}.
     */
    public String getDescription() {
        return label + " (" + code + ")";
    }

    public static Optional<SunatStatus> fromCode(String code) {
        return Arrays.stream(values())
                .filter(status -> status.code.equals(code))
                .findFirst();
    }
}
