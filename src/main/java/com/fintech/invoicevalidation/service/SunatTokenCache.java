package com.fintech.invoicevalidation.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fintech.invoicevalidation.config.SunatProperties;
import com.fintech.invoicevalidation.dto.AccessToken;
import com.fintech.invoicevalidation.exception.AuthenticationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.util.StreamUtils;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.util.UriComponentsBuilder;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Caches the SUNAT access token and renews it through the client credentials grant.
 * <p>
 * SUNAT clients are registered under different security endpoints and accept
 * credentials either as HTTP Basic or as form fields, so renewal walks every
 * endpoint, credential mode and scope until one request succeeds.
 * <p>
 * Concurrent callers share one renewal: the cache is checked again after the
 * lock is taken.
 */
@Service
@Slf4j
public class SunatTokenCache implements TokenProvider {

    private static final int ERROR_BODY_LIMIT = 800;

    private final RestClient restClient;
    private final SunatProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    private volatile AccessToken cached;

    /**
     * How the client credentials are sent to the token endpoint.
     */
    enum CredentialMode {
        /** HTTP Basic authorization header. */
        HEADER,
        /** {@code client_id} and {@code client_secret} form fields. */
        BODY
    }

    public SunatTokenCache(RestClient sunatRestClient,
                           SunatProperties properties,
                           ObjectMapper objectMapper,
                           Clock clock) {
        this.restClient = sunatRestClient;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public AccessToken getToken() {
        AccessToken current = cached;
        if (isUsable(current)) {
            return current;
        }

        lock.lock();
        try {
            current = cached;
            if (isUsable(current)) {
                return current;
            }
            cached = acquire();
            return cached;
        } finally {
            lock.unlock();
        }
    }

    private boolean isUsable(AccessToken token) {
        return token != null && token.isValidAt(now(), properties.tokenRefreshMargin());
    }

    private AccessToken acquire() {
        String clientId = StringUtils.trimWhitespace(properties.clientId());
        String clientSecret = StringUtils.trimWhitespace(properties.clientSecret());
        if (!StringUtils.hasText(clientId) || !StringUtils.hasText(clientSecret)) {
            throw AuthenticationException.missingCredentials();
        }

        List<String> scopes = new ArrayList<>(properties.scopes());
        scopes.add(null);

        String lastError = null;
        for (String endpoint : properties.tokenEndpoints()) {
            String label = endpointLabel(endpoint);
            for (CredentialMode mode : CredentialMode.values()) {
                for (String scope : scopes) {
                    String attempt = String.format("[%s | auth=%s | scope=%s]",
                            label, mode, scope == null ? "none" : scope);
                    try {
                        TokenReply reply = requestToken(endpoint, mode, scope, clientId, clientSecret);
                        if (reply.status() == 200) {
                            AccessToken token = parseToken(reply.body());
                            if (token != null) {
                                log.info("SUNAT token renewed {}, expires at {}", attempt, token.getExpiresAt());
                                return token;
                            }
                            lastError = attempt + " -> HTTP 200 without access_token";
                        } else {
                            lastError = attempt + " -> HTTP " + reply.status() + " - " + truncate(reply.body());
                        }
                        log.warn("SUNAT token request failed {} -> HTTP {}", attempt, reply.status());
                    } catch (RestClientException e) {
                        lastError = attempt + " -> " + e.getClass().getSimpleName() + ": " + e.getMessage();
                        log.warn("SUNAT token request failed {} -> {}", attempt, e.getClass().getSimpleName());
                    }
                }
            }
        }
        throw new AuthenticationException("Could not obtain a SUNAT access token", lastError);
    }

    private TokenReply requestToken(String endpoint, CredentialMode mode, String scope,
                                    String clientId, String clientSecret) {
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("grant_type", "client_credentials");
        if (scope != null) {
            form.add("scope", scope);
        }
        if (mode == CredentialMode.BODY) {
            form.add("client_id", clientId);
            form.add("client_secret", clientSecret);
        }

        return restClient.post()
                .uri(endpoint, clientId)
                .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                .accept(MediaType.APPLICATION_JSON)
                .headers(headers -> {
                    if (mode == CredentialMode.HEADER) {
                        headers.setBasicAuth(clientId, clientSecret, StandardCharsets.UTF_8);
                    }
                })
                .body(form)
                .exchange((request, response) -> new TokenReply(
                        response.getStatusCode().value(),
                        StreamUtils.copyToString(response.getBody(), StandardCharsets.UTF_8)));
    }

    private AccessToken parseToken(String body) {
        JsonNode json;
        try {
            json = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            return null;
        }
        if (json == null || !StringUtils.hasText(json.path("access_token").asText(null))) {
            return null;
        }
        long expiresIn = json.path("expires_in").asLong(0);
        return new AccessToken(json.get("access_token").asText(), now().plusSeconds(expiresIn));
    }

    /**
     * Non-sensitive name of an endpoint: the path segment after {@code /v1/}.
     */
    static String endpointLabel(String endpoint) {
        List<String> segments = UriComponentsBuilder.fromUriString(endpoint).build().getPathSegments();
        int v1 = segments.indexOf("v1");
        if (v1 >= 0 && v1 + 1 < segments.size()) {
            return segments.get(v1 + 1);
        }
        return UriComponentsBuilder.fromUriString(endpoint).build().getHost();
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock).truncatedTo(ChronoUnit.MICROS);
    }

    private static String truncate(String body) {
        if (body == null) {
            return "";
        }
        return body.length() <= ERROR_BODY_LIMIT ? body : body.substring(0, ERROR_BODY_LIMIT);
    }

    private record TokenReply(int status, String body) {
    }
}
