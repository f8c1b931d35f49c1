package com.fintech.invoicevalidation.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.List;

/**
 * Connection settings for the SUNAT security and validation APIs.
 *
 * @param taxpayerRuc        RUC of the receiving taxpayer, expanded into {@code {ruc}} of the validation URL
 * @param clientId           OAuth client id, expanded into {@code {clientId}} of the token endpoints
 * @param clientSecret       OAuth client secret
 * @param validationUrl      URL template of the "validar comprobante" endpoint
 * @param tokenEndpoints     token endpoint templates, tried in order
 * @param scopes             scopes tried for each endpoint; a request without scope is always tried last
 * @param httpTimeout        connect and read timeout of every HTTP call
 * @param retryMax           attempts per validation call on transport failures
 * @param retryBackoff       back-off step; the n-th retry waits n times this value
 * @param tokenRefreshMargin minimum remaining validity for a cached token to be reused
 */
@ConfigurationProperties(prefix = "invoice-validation.sunat")
public record SunatProperties(
        String taxpayerRuc,
        String clientId,
        String clientSecret,
        String validationUrl,
        List<String> tokenEndpoints,
        List<String> scopes,
        Duration httpTimeout,
        int retryMax,
        Duration retryBackoff,
        Duration tokenRefreshMargin) {

    public SunatProperties {
        tokenEndpoints = tokenEndpoints == null ? List.of() : List.copyOf(tokenEndpoints);
        scopes = scopes == null ? List.of() : List.copyOf(scopes);
        retryMax = Math.max(1, retryMax);
        httpTimeout = httpTimeout == null ? Duration.ofSeconds(25) : httpTimeout;
        retryBackoff = retryBackoff == null ? Duration.ofSeconds(2) : retryBackoff;
        tokenRefreshMargin = tokenRefreshMargin == null ? Duration.ofSeconds(60) : tokenRefreshMargin;
    }
}
