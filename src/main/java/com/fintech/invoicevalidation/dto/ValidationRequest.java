package com.fintech.invoicevalidation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fintech.invoicevalidation.entity.QueueItem;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;

/**
 * Request body of the SUNAT "validar comprobante" endpoint.
 */
@Value
@Builder
public class ValidationRequest {

    private static final DateTimeFormatter ISSUE_DATE_FORMAT = DateTimeFormatter.ofPattern("dd/MM/yyyy");

    /**
     * RUC of the invoice issuer.
     */
    @JsonProperty("numRuc")
    String issuerRuc;

    /**
     * Document type code, e.g. "01" for an invoice.
     */
    @JsonProperty("codComp")
    String documentType;

    @JsonProperty("numeroSerie")
    String series;

    @JsonProperty("numero")
    String number;

    /**
     * Issue date as dd/MM/yyyy.
     */
    @JsonProperty("fechaEmision")
    String issueDate;

    /**
     * Total amount with exactly two decimals.
     */
    @JsonProperty("monto")
    String amount;

    public static ValidationRequest from(QueueItem item) {
        return ValidationRequest.builder()
                .issuerRuc(item.getIssuerRuc())
                .documentType(item.getDocumentType())
                .series(item.getSeries())
                .number(item.getDocNumber())
                .issueDate(formatIssueDate(item.getIssueDate()))
                .amount(formatAmount(item.getTotalAmount()))
                .build();
    }

    static String formatIssueDate(LocalDate date) {
        return date == null ? null : date.format(ISSUE_DATE_FORMAT);
    }

    static String formatAmount(BigDecimal amount) {
        if (amount == null) {
            return "0.00";
        }
        return amount.setScale(2, RoundingMode.HALF_UP).toPlainString();
    }
}
