package com.zatca.fatoora.csid;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.zatca.fatoora.client.ApiError;
import com.zatca.fatoora.client.HttpClient;
import com.zatca.fatoora.config.FatooraConfig;
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
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for CertificateLifecycleClient
 */
class CertificateLifecycleClientTest {

    private static final Instant NOW = Instant.parse("2024-06-01T00:00:00Z");
    private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private MockWebServer server;
    private HttpClient httpClient;
    private CertificateLifecycleClient client;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        FatooraConfig config = FatooraConfig.builder()
            .baseUrl(server.url("/").toString().replaceAll("/$", ""))
            .retryAttempts(0)
            .retryDelay(1)
            .build();
        httpClient = new HttpClient(config);
        client = new CertificateLifecycleClient(config, httpClient, CLOCK);
    }

    @AfterEach
    void tearDown() throws IOException {
        httpClient.close();
        server.shutdown();
    }

    private static CsidCredential production(Instant expiresAt) {
        return new CsidCredential(CsidStage.PRODUCTION, "1234567890", "TUlJQ...", "s3cr3t", expiresAt);
    }

    private static JsonNode body(RecordedRequest request) throws IOException {
        return MAPPER.readTree(request.getBody().readUtf8());
    }

    @Nested
    @DisplayName("Compliance CSID")
    class ComplianceCsidTests {

        @Test
        @DisplayName("should post the CSR with the OTP header")
        void shouldPostCsrWithOtp() throws Exception {
            server.enqueue(new MockResponse().setResponseCode(200).setBody("""
                {
                  "requestID": 1234567890123,
                  "dispositionMessage": "ISSUED",
                  "binarySecurityToken": "VFVsSlEwUjZRME5C",
                  "secret": "Dehvg1fc7kzWN4q5Gx7WbSgDAmZB1IQWzbBPO3HMdA4="
                }
                """));

            CsidResult result = client.requestComplianceCsid("Q1NSLWJhc2U2NA==", "123345");

            assertTrue(result.isSuccess());
            assertEquals("ISSUED", result.getDispositionMessage());
            CsidCredential credential = result.getCredential();
            assertEquals(CsidStage.COMPLIANCE, credential.getStage());
            assertEquals("1234567890123", credential.getRequestId());
            assertEquals("VFVsSlEwUjZRME5C", credential.getCsid());
            assertNull(credential.getExpiresAt());

            RecordedRequest request = server.takeRequest();
            assertEquals("POST", request.getMethod());
            assertEquals("/compliance", request.getPath());
            assertEquals("123345", request.getHeader("OTP"));
            assertEquals("Q1NSLWJhc2U2NA==", body(request).get("csr").asText());
        }

        @Test
        @DisplayName("should map a rejected CSR to error entries")
        void shouldMapRejection() {
            server.enqueue(new MockResponse().setResponseCode(400).setBody("""
                {"code":"Invalid-OTP","message":"The provided OTP is invalid"}
                """));

            CsidResult result = client.requestComplianceCsid("Q1NS", "000000");

            assertFalse(result.isSuccess());
            assertNull(result.getCredential());
            assertEquals(1, result.getErrors().size());
            assertEquals("Invalid-OTP", result.getErrors().get(0).getCode());
        }

        @Test
        @DisplayName("should fail when the response has no token")
        void shouldFailWithoutToken() {
            server.enqueue(new MockResponse().setResponseCode(200).setBody("{\"secret\":\"abc\"}"));

            CsidResult result = client.requestComplianceCsid("Q1NS", "123345");

            assertFalse(result.isSuccess());
            assertEquals("INVALID_RESPONSE", result.getErrors().get(0).getCode());
        }

        @Test
        @DisplayName("should map a transport failure to a NETWORK entry")
        void shouldMapTransportFailure() throws IOException {
            server.shutdown();

            CsidResult result = client.requestComplianceCsid("Q1NS", "123345");

            assertFalse(result.isSuccess());
            ApiError error = result.getErrors().get(0);
            assertEquals(ApiError.Type.NETWORK, error.getType());
            assertEquals(ApiError.FETCH_ERROR, error.getCode());
            assertTrue(error.getCategory().startsWith("NET"));
        }
    }

    @Nested
    @DisplayName("Production CSID")
    class ProductionCsidTests {

        @Test
        @DisplayName("should authenticate with the compliance credential")
        void shouldUseBasicAuth() throws Exception {
            server.enqueue(new MockResponse().setResponseCode(200).setBody("""
                {"requestID":"99","binarySecurityToken":"UFJPRA==","secret":"prod","tokenExpiry":"2025-06-01T00:00:00Z"}
                """));
            CsidCredential compliance = new CsidCredential(CsidStage.COMPLIANCE, "1234567890123",
                "VFVsSlEwUjZRME5C", "Dehvg1fc", null);

            CsidResult result = client.requestProductionCsid(compliance, "1234567890123");

            assertTrue(result.isSuccess());
            assertEquals(CsidStage.PRODUCTION, result.getCredential().getStage());
            assertEquals(Instant.parse("2025-06-01T00:00:00Z"), result.getCredential().getExpiresAt());

            RecordedRequest request = server.takeRequest();
            assertEquals("/production/csids", request.getPath());
            assertEquals(compliance.basicAuthHeader(), request.getHeader("Authorization"));
            assertEquals("1234567890123", body(request).get("complianceRequestId").asText());
        }

        @Test
        @DisplayName("should refuse an expired compliance credential without calling the server")
        void shouldRefuseExpiredCredential() {
            CsidCredential expired = new CsidCredential(CsidStage.COMPLIANCE, "1", "abc", "def",
                NOW.minus(1, ChronoUnit.DAYS));

            CsidResult result = client.requestProductionCsid(expired, "1");

            assertFalse(result.isSuccess());
            assertEquals(ApiError.Type.VALIDATION, result.getErrors().get(0).getType());
            assertEquals(ApiError.CSID_EXPIRED, result.getErrors().get(0).getCode());
            assertEquals(0, server.getRequestCount());
        }
    }

    @Nested
    @DisplayName("Renewal")
    class RenewalTests {

        @Test
        @DisplayName("should PATCH with OTP and Basic auth and keep the current secret")
        void shouldRenewWithPatch() throws Exception {
            server.enqueue(new MockResponse().setResponseCode(200).setBody("""
                {"binarySecurityToken":"UkVORVdFRA==","expiresAt":"2025-06-01T00:00:00+03:00"}
                """));
            CsidCredential current = production(NOW.plus(10, ChronoUnit.DAYS));

            CsidResult result = client.renewProductionCsid(current, "Q1NS", "654321");

            assertTrue(result.isSuccess());
            assertTrue(result.isRenewed());
            CsidCredential renewed = result.getCredential();
            assertEquals("UkVORVdFRA==", renewed.getCsid());
            assertEquals("s3cr3t", renewed.getSecret());
            assertEquals("1234567890", renewed.getRequestId());
            assertEquals(Instant.parse("2025-05-31T21:00:00Z"), renewed.getExpiresAt());

            RecordedRequest request = server.takeRequest(1, TimeUnit.SECONDS);
            assertEquals("PATCH", request.getMethod());
            assertEquals("/production/csids", request.getPath());
            assertEquals("654321", request.getHeader("OTP"));
            assertEquals(current.basicAuthHeader(), request.getHeader("Authorization"));
            assertEquals("Q1NS", body(request).get("csr").asText());
        }

        @Test
        @DisplayName("should skip renewal outside the renewal window")
        void shouldSkipWhenNotExpiring() {
            CsidCredential current = production(NOW.plus(60, ChronoUnit.DAYS));

            CsidResult result = client.renewIfExpiring(current, "Q1NS", "654321");

            assertTrue(result.isSuccess());
            assertFalse(result.isRenewed());
            assertSame(current, result.getCredential());
            assertEquals(0, server.getRequestCount());
        }

        @Test
        @DisplayName("should renew inside the renewal window")
        void shouldRenewWhenExpiring() {
            server.enqueue(new MockResponse().setResponseCode(200).setBody("""
                {"binarySecurityToken":"UkVORVdFRA==","secret":"new-secret"}
                """));
            CsidCredential current = production(NOW.plus(5, ChronoUnit.DAYS));

            CsidResult result = client.renewIfExpiring(current, "Q1NS", "654321");

            assertTrue(result.isRenewed());
            assertEquals("new-secret", result.getCredential().getSecret());
            assertEquals(1, server.getRequestCount());
        }

        @Test
        @DisplayName("should not renew an already expired credential")
        void shouldNotRenewExpired() {
            CsidCredential current = production(NOW);

            CsidResult result = client.renewIfExpiring(current, "Q1NS", "654321");

            assertFalse(result.isSuccess());
            assertEquals(ApiError.CSID_EXPIRED, result.getErrors().get(0).getCode());
            assertEquals(0, server.getRequestCount());
        }
    }

    @Nested
    @DisplayName("CsidCredential")
    class CredentialTests {

        @Test
        @DisplayName("should build a Basic authorization header")
        void shouldBuildBasicAuthHeader() {
            assertEquals("Basic dXNlcjpwYXNz", CsidCredential.basicAuthHeader("user", "pass"));
        }

        @Test
        @DisplayName("should never expire without an expiry instant")
        void shouldNotExpireWithoutExpiry() {
            CsidCredential credential = production(null);

            assertFalse(credential.isExpired(CLOCK));
            assertFalse(credential.expiresWithin(365, CLOCK));
        }

        @Test
        @DisplayName("should not leak the secret through toString")
        void shouldRedactSecret() {
            assertFalse(production(null).toString().contains("s3cr3t"));
        }
    }
}
