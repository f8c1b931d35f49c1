package com.fintech.invoicevalidation.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fintech.invoicevalidation.config.SunatProperties;
import com.fintech.invoicevalidation.dto.AccessToken;
import com.fintech.invoicevalidation.dto.ValidationRequest;
import com.fintech.invoicevalidation.dto.ValidationResponse;
import com.fintech.invoicevalidation.entity.QueueItem;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.retry.RetryContext;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.backoff.ThreadWaitSleeper;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;
import org.springframework.util.StreamUtils;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;

import java.nio.charset.StandardCharsets;

/**
 * Calls the SUNAT "validar comprobante" endpoint.
 * <p>
 * Transport failures (timeouts, refused connections) are retried with a linear
 * back-off. Non-200 responses are returned as failures straight away.
 */
@Service
@Slf4j
public class SunatValidationClient implements ValidationClient {

    private static final int RAW_BODY_LIMIT = 1000;

    private final RestClient restClient;
    private final SunatProperties properties;
    private final ObjectMapper objectMapper;
    private final RetryTemplate retryTemplate;

    @Autowired
    public SunatValidationClient(RestClient sunatRestClient,
                                 SunatProperties properties,
                                 ObjectMapper objectMapper) {
        this(sunatRestClient, properties, objectMapper, new ThreadWaitSleeper());
    }

    SunatValidationClient(RestClient sunatRestClient,
                          SunatProperties properties,
                          ObjectMapper objectMapper,
                          Sleeper sleeper) {
        this.restClient = sunatRestClient;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.retryTemplate = RetryTemplate.builder()
                .maxAttempts(properties.retryMax())
                .retryOn(ResourceAccessException.class)
                .customBackoff(new LinearBackOffPolicy(properties.retryBackoff(), sleeper))
                .build();
    }

    @Override
    public ValidationResponse validate(AccessToken token, QueueItem item) {
        ValidationRequest request = ValidationRequest.from(item);

        log.debug("Validating invoice {} ({}-{}) with SUNAT",
                item.getInvoiceId(), item.getSeries(), item.getDocNumber());

        return retryTemplate.execute(
                context -> post(token, request),
                this::failureAfterRetries);
    }

    private ValidationResponse post(AccessToken token, ValidationRequest request) {
        return restClient.post()
                .uri(properties.validationUrl(), properties.taxpayerRuc())
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_JSON)
                .headers(headers -> headers.setBearerAuth(token.getValue()))
                .body(request)
                .exchange((httpRequest, response) -> toValidationResponse(
                        response.getStatusCode().value(),
                        StreamUtils.copyToString(response.getBody(), StandardCharsets.UTF_8)));
    }

    private ValidationResponse toValidationResponse(int status, String body) {
        JsonNode json = readJson(body);

        if (status == 200 && json != null) {
            return ValidationResponse.success(json);
        }

        ObjectNode failure = objectMapper.createObjectNode();
        failure.put("http", status);
        if (json instanceof ObjectNode) {
            json.fields().forEachRemaining(field -> {
                if (!"http".equals(field.getKey())) {
                    failure.set(field.getKey(), field.getValue());
                }
            });
        } else if (json != null) {
            failure.set("body", json);
        } else {
            failure.put("raw", body.length() <= RAW_BODY_LIMIT ? body : body.substring(0, RAW_BODY_LIMIT));
        }

        log.debug("SUNAT validation answered HTTP {}", status);
        return ValidationResponse.failure(failure);
    }

    private ValidationResponse failureAfterRetries(RetryContext context) {
        Throwable last = context.getLastThrowable();
        String error = last == null ? "unknown" : String.valueOf(last.getMessage());

        log.warn("SUNAT validation failed after {} attempt(s): {}", context.getRetryCount(), error);

        ObjectNode failure = objectMapper.createObjectNode();
        failure.put("error", error);
        return ValidationResponse.failure(failure);
    }

    /**
     * Returns null when the body is empty or not JSON.
     */
    private JsonNode readJson(String body) {
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            return null;
        }
    }
}
