package com.fintech.invoicevalidation.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SunatPropertiesTest {

    @Test
    @DisplayName("Missing settings fall back to defaults")
    void appliesDefaults() {
        SunatProperties properties = new SunatProperties(
                "20999999999", "client", "secret", "https://api.sunat.test/validar",
                null, null, null, 0, null, null);

        assertThat(properties.tokenEndpoints()).isEmpty();
        assertThat(properties.scopes()).isEmpty();
        assertThat(properties.retryMax()).isEqualTo(1);
        assertThat(properties.httpTimeout()).isEqualTo(Duration.ofSeconds(25));
        assertThat(properties.retryBackoff()).isEqualTo(Duration.ofSeconds(2));
        assertThat(properties.tokenRefreshMargin()).isEqualTo(Duration.ofSeconds(60));
    }

    @Test
    @DisplayName("Configured settings are kept")
    void keepsConfiguredValues() {
        SunatProperties properties = new SunatProperties(
                "20999999999", "client", "secret", "https://api.sunat.test/validar",
                List.of("https://token.test/v1/clientessol/{clientId}/oauth2/token/"), List.of("scope"),
                Duration.ofSeconds(5), 3, Duration.ofMillis(10), Duration.ofSeconds(30));

        assertThat(properties.tokenEndpoints()).hasSize(1);
        assertThat(properties.retryMax()).isEqualTo(3);
        assertThat(properties.httpTimeout()).isEqualTo(Duration.ofSeconds(5));
        assertThat(properties.retryBackoff()).isEqualTo(Duration.ofMillis(10));
        assertThat(properties.tokenRefreshMargin()).isEqualTo(Duration.ofSeconds(30));
    }
}
