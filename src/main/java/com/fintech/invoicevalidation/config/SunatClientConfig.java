package com.fintech.invoicevalidation.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.time.Clock;

/**
 * HTTP client and clock shared by the SUNAT token cache and validation client.
 */
@Configuration
public class SunatClientConfig {

    @Bean
    public RestClient sunatRestClient(RestClient.Builder builder, SunatProperties properties) {
        int timeoutMs = (int) properties.httpTimeout().toMillis();
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(timeoutMs);
        requestFactory.setReadTimeout(timeoutMs);

        return builder
                .requestFactory(requestFactory)
                .build();
    }

    /**
     * All timestamps written by this service are UTC.
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
