package com.zatca.fatoora.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.zatca.fatoora.config.FatooraConfig;
import com.zatca.fatoora.exception.NetworkException;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for HttpClient
 */
class HttpClientTest {

    private MockWebServer server;
    private HttpClient client;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        client = new HttpClient(configFor(server, 2));
    }

    @AfterEach
    void tearDown() throws IOException {
        client.close();
        server.shutdown();
    }

    static FatooraConfig configFor(MockWebServer server, int retryAttempts) {
        String baseUrl = server.url("/").toString().replaceAll("/$", "");
        return FatooraConfig.builder()
            .baseUrl(baseUrl)
            .retryAttempts(retryAttempts)
            .retryDelay(1)
            .build();
    }

    @Nested
    @DisplayName("Headers")
    class HeaderTests {

        @Test
        @DisplayName("should send Accept-Version V2 and JSON headers on every call")
        void shouldSendDefaultHeaders() throws Exception {
            server.enqueue(new MockResponse().setResponseCode(200).setBody("{\"ok\":true}"));

            client.post(server.url("/invoices").toString(), Map.of("a", 1), Map.of());

            RecordedRequest request = server.takeRequest();
            assertEquals("V2", request.getHeader("Accept-Version"));
            assertEquals("application/json", request.getHeader("Accept"));
            assertTrue(request.getHeader("Content-Type").startsWith("application/json"));
            assertNotNull(request.getHeader("X-Request-ID"));
        }

        @Test
        @DisplayName("should forward per-request headers")
        void shouldForwardRequestHeaders() throws Exception {
            server.enqueue(new MockResponse().setResponseCode(200).setBody("{}"));

            client.post(server.url("/compliance").toString(), Map.of("csr", "abc"), Map.of("OTP", "123456"));

            assertEquals("123456", server.takeRequest().getHeader("OTP"));
        }

        @Test
        @DisplayName("should send PATCH requests")
        void shouldSendPatch() throws Exception {
            server.enqueue(new MockResponse().setResponseCode(200).setBody("{}"));

            client.patch(server.url("/production/csids").toString(), Map.of("csr", "abc"), Map.of(), JsonNode.class);

            assertEquals("PATCH", server.takeRequest().getMethod());
        }
    }

    @Nested
    @DisplayName("Retry")
    class RetryTests {

        @Test
        @DisplayName("should retry a 503 and resend the identical body")
        void shouldRetryServiceUnavailable() throws Exception {
            server.enqueue(new MockResponse().setResponseCode(503));
            server.enqueue(new MockResponse().setResponseCode(200).setBody("{\"status\":\"REPORTED\"}"));

            HttpClient.HttpResponse<JsonNode> response =
                client.post(server.url("/invoices/reporting/single").toString(), Map.of("uuid", "u-1"), Map.of());

            assertTrue(response.isSuccessful());
            assertEquals("REPORTED", response.getData().get("status").asText());
            assertEquals(2, server.getRequestCount());

            String first = server.takeRequest().getBody().readUtf8();
            String second = server.takeRequest().getBody().readUtf8();
            assertEquals(first, second);
        }

        @Test
        @DisplayName("should return a 400 without retrying")
        void shouldNotRetryBadRequest() {
            server.enqueue(new MockResponse().setResponseCode(400)
                .setBody("{\"validationResults\":{\"errorMessages\":[{\"code\":\"X1\",\"message\":\"bad\"}]}}"));

            HttpClient.HttpResponse<JsonNode> response =
                client.post(server.url("/invoices/clearance/single").toString(), Map.of(), Map.of());

            assertFalse(response.isSuccessful());
            assertEquals(400, response.getStatus());
            assertEquals("X1", response.getData().at("/validationResults/errorMessages/0/code").asText());
            assertEquals(1, server.getRequestCount());
        }

        @Test
        @DisplayName("should return the last 5xx once retries are exhausted")
        void shouldReturnLastServerError() {
            for (int i = 0; i < 3; i++) {
                server.enqueue(new MockResponse().setResponseCode(500).setBody("not json"));
            }

            HttpClient.HttpResponse<JsonNode> response =
                client.post(server.url("/invoices").toString(), Map.of(), Map.of());

            assertEquals(500, response.getStatus());
            assertNull(response.getData());
            assertEquals("not json", response.getRawBody());
            assertEquals(3, server.getRequestCount());
        }
    }

    @Nested
    @DisplayName("Transport failures")
    class TransportFailureTests {

        @Test
        @DisplayName("should throw NetworkException when no response is received")
        void shouldThrowNetworkException() throws IOException {
            String url = server.url("/invoices").toString();
            server.shutdown();

            NetworkException e = assertThrows(NetworkException.class, () -> client.post(url, Map.of(), Map.of()));
            assertNotNull(e.getNetworkCode());
            assertTrue(e.getNetworkCode().startsWith("NET"));
        }

        @Test
        @DisplayName("should stop calling the server once the circuit opens")
        void shouldRefuseCallsWhenCircuitOpen() {
            server.enqueue(new MockResponse().setResponseCode(503));
            CircuitBreaker breaker = new CircuitBreaker(1, Duration.ofMinutes(1), 1, Clock.systemUTC());
            try (HttpClient guarded = new HttpClient(configFor(server, 0), RetryPolicy.noRetry(), breaker)) {
                String url = server.url("/invoices").toString();

                assertEquals(503, guarded.post(url, Map.of(), Map.of()).getStatus());
                NetworkException e = assertThrows(NetworkException.class, () -> guarded.post(url, Map.of(), Map.of()));

                assertEquals("NET05", e.getNetworkCode());
                assertEquals(1, server.getRequestCount());
            }
        }
    }

    @Nested
    @DisplayName("Audit log")
    class AuditLogTests {

        @Test
        @DisplayName("should redact credentials in audit entries")
        void shouldRedactCredentials() {
            server.enqueue(new MockResponse().setResponseCode(200).setBody("{}"));
            List<HttpAuditEntry> entries = new ArrayList<>();
            client.setAuditLogCallback(entries::add);

            client.post(server.url("/compliance").toString(), Map.of("csr", "secret-csr", "note", "x"),
                Map.of("Authorization", "Basic abc", "OTP", "123456"));

            assertEquals(1, entries.size());
            HttpAuditEntry entry = entries.get(0);
            assertEquals("[REDACTED]", entry.getHeaders().get("Authorization"));
            assertEquals("[REDACTED]", entry.getHeaders().get("OTP"));
            @SuppressWarnings("unchecked")
            Map<String, Object> body = (Map<String, Object>) entry.getBody();
            assertEquals("[REDACTED]", body.get("csr"));
            assertEquals("x", body.get("note"));
            assertTrue(entry.isSuccess());
        }
    }
}
