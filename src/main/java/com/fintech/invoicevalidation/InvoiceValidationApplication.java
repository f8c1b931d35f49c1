package com.fintech.invoicevalidation;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Invoice Validation Service
 * <p>
 * Drains the invoice validation queue, checks every invoice against the SUNAT
 * "validar comprobante" API and keeps the validation history, the current status
 * snapshot and the purchase invoice header in sync.
 * <p>
 * Key Features:
 * - Exclusive batch claiming of queued invoices
 * - Concurrent validation calls with retry on transport failures
 * - Cached OAuth token with endpoint/credential/scope fallback
 * - Change detection and idempotent propagation to the invoice header
 */
@SpringBootApplication
@EnableScheduling
@ConfigurationPropertiesScan
public class InvoiceValidationApplication {

    public static void main(String[] args) {
        SpringApplication.run(InvoiceValidationApplication.class, args);
    }
}
