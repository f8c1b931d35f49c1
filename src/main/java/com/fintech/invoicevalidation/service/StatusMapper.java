package com.fintech.invoicevalidation.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fintech.invoicevalidation.dto.MappedStatus;
import com.fintech.invoicevalidation.dto.SunatStatus;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Translates a SUNAT payload into the canonical status.
 * <p>
 * Reads {@code data.estadoCp}. Known codes map to the {@link SunatStatus} catalog,
 * other codes to a synthetic {@code CODE_<n>} status, and a missing code to
 * {@link MappedStatus#EMPTY}. Never throws.
 */
@Component
public class StatusMapper {

    public MappedStatus mapStatus(JsonNode payload) {
        String code = statusCode(payload);
        if (code == null) {
            return MappedStatus.EMPTY;
        }
        return SunatStatus.fromCode(code)
                .map(MappedStatus::of)
                .orElseGet(() -> MappedStatus.unmapped(code));
    }

    /**
     * Normalized {@code data.estadoCp}: integer-like values lose their decimals and
     * padding ({@code 3}, {@code "3"}, {@code 3.0} all give {@code "3"}), other text is
     * trimmed, and blank or absent values give null. Infinity and NaN keep their text form.
     */
    static String statusCode(JsonNode payload) {
        if (payload == null || !payload.isObject()) {
            return null;
        }
        JsonNode data = payload.get("data");
        if (data == null || !data.isObject()) {
            return null;
        }
        JsonNode estado = data.get("estadoCp");
        if (estado == null || estado.isNull() || estado.isMissingNode()) {
            return null;
        }
        if (estado.isBoolean()) {
            return estado.asBoolean() ? "1" : "0";
        }
        if (estado.isNumber()) {
            if (estado.isFloatingPointNumber() && !Double.isFinite(estado.doubleValue())) {
                return estado.asText();
            }
            return estado.decimalValue().toBigInteger().toString();
        }
        if (estado.isValueNode()) {
            String text = estado.asText().trim();
            if (text.isEmpty()) {
                return null;
            }
            try {
                return new BigDecimal(text).toBigIntegerExact().toString();
            } catch (NumberFormatException | ArithmeticException e) {
                return text;
            }
        }
        String text = estado.toString().trim();
        return text.isEmpty() ? null : text;
    }
}
