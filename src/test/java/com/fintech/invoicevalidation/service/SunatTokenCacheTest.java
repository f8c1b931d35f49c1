package com.fintech.invoicevalidation.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fintech.invoicevalidation.config.SunatProperties;
import com.fintech.invoicevalidation.dto.AccessToken;
import com.fintech.invoicevalidation.exception.AuthenticationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.ExpectedCount;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClient;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Base64;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.*;
import static org.springframework.test.web.client.response.MockRestResponseCreators.*;

/**
 * Tests for the SUNAT token cache: endpoint/credential/scope fallback and caching.
 */
class SunatTokenCacheTest {

    private static final String SOL_ENDPOINT = "https://seguridad.sunat.test/v1/clientessol/{clientId}/oauth2/token/";
    private static final String EXTRANET_ENDPOINT = "https://seguridad.sunat.test/v1/clientesextranet/{clientId}/oauth2/token/";
    private static final String SOL_URL = "https://seguridad.sunat.test/v1/clientessol/test-client/oauth2/token/";
    private static final String EXTRANET_URL = "https://seguridad.sunat.test/v1/clientesextranet/test-client/oauth2/token/";
    private static final String SCOPE = "https://api.sunat.test/v1/contribuyente/contribuyentes";

    private static final Instant NOW = Instant.parse("2024-01-15T10:00:00Z");
    private static final String BASIC = "Basic " + Base64.getEncoder()
            .encodeToString("test-client:test-secret".getBytes(StandardCharsets.UTF_8));

    private MockRestServiceServer server;

    private SunatTokenCache cache(String clientId, String clientSecret) {
        SunatProperties properties = new SunatProperties(
                "20999999999", clientId, clientSecret, "https://api.sunat.test/validar",
                List.of(SOL_ENDPOINT, EXTRANET_ENDPOINT), List.of(SCOPE),
                Duration.ofSeconds(5), 3, Duration.ofSeconds(2), Duration.ofSeconds(60));

        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        return new SunatTokenCache(builder.build(), properties, new ObjectMapper(),
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private SunatTokenCache cache() {
        return cache("test-client", "test-secret");
    }

    private static MultiValueMap<String, String> form(Map<String, String> values) {
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        values.forEach(form::add);
        return form;
    }

    @Nested
    @DisplayName("Token acquisition")
    class AcquisitionTests {

        @Test
        @DisplayName("First combination uses basic auth and the first scope")
        void firstCombination() {
            SunatTokenCache cache = cache();
            server.expect(requestTo(SOL_URL))
                    .andExpect(method(HttpMethod.POST))
                    .andExpect(header(HttpHeaders.AUTHORIZATION, BASIC))
                    .andExpect(content().formData(form(Map.of(
                            "grant_type", "client_credentials",
                            "scope", SCOPE))))
                    .andRespond(withSuccess("{\"access_token\":\"abc\",\"expires_in\":3600}",
                            MediaType.APPLICATION_JSON));

            AccessToken token = cache.getToken();

            server.verify();
            assertThat(token.getValue()).isEqualTo("abc");
            assertThat(token.getExpiresAt()).isEqualTo(LocalDateTime.of(2024, 1, 15, 11, 0));
        }

        @Test
        @DisplayName("Falls back through scopes, credential modes and endpoints in order")
        void fallsBackInOrder() {
            SunatTokenCache cache = cache();

            // clientessol: header+scope, header, body+scope, body
            server.expect(requestTo(SOL_URL))
                    .andExpect(header(HttpHeaders.AUTHORIZATION, BASIC))
                    .andExpect(content().formDataContains(Map.of("scope", SCOPE)))
                    .andRespond(withStatus(HttpStatus.UNAUTHORIZED).body("{\"error\":\"invalid_client\"}"));
            server.expect(requestTo(SOL_URL))
                    .andExpect(header(HttpHeaders.AUTHORIZATION, BASIC))
                    .andExpect(content().formData(form(Map.of("grant_type", "client_credentials"))))
                    .andRespond(withStatus(HttpStatus.UNAUTHORIZED));
            server.expect(requestTo(SOL_URL))
                    .andExpect(headerDoesNotExist(HttpHeaders.AUTHORIZATION))
                    .andExpect(content().formData(form(Map.of(
                            "grant_type", "client_credentials",
                            "scope", SCOPE,
                            "client_id", "test-client",
                            "client_secret", "test-secret"))))
                    .andRespond(withStatus(HttpStatus.BAD_REQUEST));
            server.expect(requestTo(SOL_URL))
                    .andExpect(headerDoesNotExist(HttpHeaders.AUTHORIZATION))
                    .andExpect(content().formData(form(Map.of(
                            "grant_type", "client_credentials",
                            "client_id", "test-client",
                            "client_secret", "test-secret"))))
                    .andRespond(withStatus(HttpStatus.BAD_REQUEST));

            // clientesextranet: first combination succeeds
            server.expect(requestTo(EXTRANET_URL))
                    .andExpect(header(HttpHeaders.AUTHORIZATION, BASIC))
                    .andRespond(withSuccess("{\"access_token\":\"xyz\",\"expires_in\":600}",
                            MediaType.APPLICATION_JSON));

            AccessToken token = cache.getToken();

            server.verify();
            assertThat(token.getValue()).isEqualTo("xyz");
        }

        @Test
        @DisplayName("A 200 without access_token moves on to the next combination")
        void okWithoutTokenContinues() {
            SunatTokenCache cache = cache();
            server.expect(requestTo(SOL_URL))
                    .andRespond(withSuccess("{\"token_type\":\"bearer\"}", MediaType.APPLICATION_JSON));
            server.expect(requestTo(SOL_URL))
                    .andRespond(withSuccess("{\"access_token\":\"second\",\"expires_in\":3600}",
                            MediaType.APPLICATION_JSON));

            assertThat(cache.getToken().getValue()).isEqualTo("second");
            server.verify();
        }

        @Test
        @DisplayName("Exhausting every combination raises AuthenticationException with the last error")
        void exhaustedCombinations() {
            SunatTokenCache cache = cache();
            server.expect(ExpectedCount.times(4), requestTo(SOL_URL))
                    .andRespond(withStatus(HttpStatus.UNAUTHORIZED).body("denied-sol"));
            server.expect(ExpectedCount.times(4), requestTo(EXTRANET_URL))
                    .andRespond(withStatus(HttpStatus.UNAUTHORIZED).body("denied-extranet"));

            assertThatThrownBy(cache::getToken)
                    .isInstanceOf(AuthenticationException.class)
                    .satisfies(e -> {
                        String lastError = ((AuthenticationException) e).getLastError();
                        assertThat(lastError).contains("clientesextranet");
                        assertThat(lastError).contains("auth=BODY");
                        assertThat(lastError).contains("scope=none");
                        assertThat(lastError).contains("HTTP 401");
                        assertThat(lastError).contains("denied-extranet");
                        assertThat(lastError).doesNotContain("test-secret");
                    });
            server.verify();
        }

        @Test
        @DisplayName("Missing credentials fail without any HTTP call")
        void missingCredentials() {
            SunatTokenCache cache = cache("  ", "test-secret");

            assertThatThrownBy(cache::getToken)
                    .isInstanceOf(AuthenticationException.class)
                    .hasMessageContaining("not configured");
            server.verify();
        }
    }

    @Nested
    @DisplayName("Caching")
    class CachingTests {

        @Test
        @DisplayName("A valid token is reused without new requests")
        void reusesValidToken() {
            SunatTokenCache cache = cache();
            server.expect(ExpectedCount.once(), requestTo(SOL_URL))
                    .andRespond(withSuccess("{\"access_token\":\"abc\",\"expires_in\":3600}",
                            MediaType.APPLICATION_JSON));

            AccessToken first = cache.getToken();
            AccessToken second = cache.getToken();

            server.verify();
            assertThat(second).isSameAs(first);
        }

        @Test
        @DisplayName("A token inside the refresh margin is renewed")
        void renewsTokenNearExpiry() {
            SunatTokenCache cache = cache();
            server.expect(requestTo(SOL_URL))
                    .andRespond(withSuccess("{\"access_token\":\"short\",\"expires_in\":30}",
                            MediaType.APPLICATION_JSON));
            server.expect(requestTo(SOL_URL))
                    .andRespond(withSuccess("{\"access_token\":\"long\",\"expires_in\":3600}",
                            MediaType.APPLICATION_JSON));

            assertThat(cache.getToken().getValue()).isEqualTo("short");
            assertThat(cache.getToken().getValue()).isEqualTo("long");
            server.verify();
        }
    }

    @Test
    @DisplayName("Endpoint label is the path segment after v1")
    void endpointLabel() {
        assertThat(SunatTokenCache.endpointLabel(SOL_ENDPOINT)).isEqualTo("clientessol");
        assertThat(SunatTokenCache.endpointLabel(EXTRANET_ENDPOINT)).isEqualTo("clientesextranet");
        assertThat(SunatTokenCache.endpointLabel("https://auth.example.com/token")).isEqualTo("auth.example.com");
    }

    @Test
    @DisplayName("Token value is not part of its string form")
    void tokenToStringHidesValue() {
        AccessToken token = new AccessToken("very-secret-token", LocalDateTime.of(2024, 1, 15, 11, 0));

        assertThat(token.toString()).doesNotContain("very-secret-token");
    }
}
