package com.zatca.fatoora.submission;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.zatca.fatoora.client.ApiError;
import com.zatca.fatoora.client.HttpClient;
import com.zatca.fatoora.config.FatooraConfig;
import com.zatca.fatoora.csid.CsidCredential;
import com.zatca.fatoora.csid.CsidStage;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Base64;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for SubmissionClient
 */
class SubmissionClientTest {

    private static final Instant NOW = Instant.parse("2024-01-15T10:30:00Z");
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final String XML = "<Invoice><cbc:ID>SME00010</cbc:ID></Invoice>";

    private MockWebServer server;
    private HttpClient httpClient;
    private SubmissionClient client;
    private CsidCredential credential;
    private InvoiceSubmissionRequest request;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        FatooraConfig config = FatooraConfig.builder()
            .baseUrl(server.url("/").toString().replaceAll("/$", ""))
            .retryAttempts(1)
            .retryDelay(1)
            .build();
        httpClient = new HttpClient(config);
        client = new SubmissionClient(config, httpClient, Clock.fixed(NOW, ZoneOffset.UTC));
        credential = new CsidCredential(CsidStage.PRODUCTION, "1", "UFJPRA==", "prod-secret",
            NOW.plusSeconds(3600));
        request = InvoiceSubmissionRequest.of(XML, "abcHash=", "8e6000cf-1a98-4174-b3e7-b5d5954bc10d");
    }

    @AfterEach
    void tearDown() throws IOException {
        httpClient.close();
        server.shutdown();
    }

    private static String base64(String value) {
        return Base64.getEncoder().encodeToString(value.getBytes(StandardCharsets.UTF_8));
    }

    @Nested
    @DisplayName("Request")
    class RequestTests {

        @Test
        @DisplayName("should send hash, uuid and base64 invoice with Basic auth")
        void shouldSendRequestBody() throws Exception {
            server.enqueue(new MockResponse().setResponseCode(200).setBody("{\"reportingStatus\":\"REPORTED\"}"));

            client.submitForReporting(request, credential);

            RecordedRequest recorded = server.takeRequest();
            assertEquals("/invoices/reporting/single", recorded.getPath());
            assertEquals(credential.basicAuthHeader(), recorded.getHeader("Authorization"));
            assertNull(recorded.getHeader("Clearance-Status"));

            JsonNode body = MAPPER.readTree(recorded.getBody().readUtf8());
            assertEquals("abcHash=", body.get("invoiceHash").asText());
            assertEquals("8e6000cf-1a98-4174-b3e7-b5d5954bc10d", body.get("uuid").asText());
            assertEquals(base64(XML), body.get("invoice").asText());
        }

        @Test
        @DisplayName("should flag clearance requests with Clearance-Status 1")
        void shouldSendClearanceHeader() throws Exception {
            server.enqueue(new MockResponse().setResponseCode(200).setBody("{\"clearanceStatus\":\"CLEARED\"}"));

            client.submitForClearance(request, credential);

            RecordedRequest recorded = server.takeRequest();
            assertEquals("/invoices/clearance/single", recorded.getPath());
            assertEquals("1", recorded.getHeader("Clearance-Status"));
        }

        @Test
        @DisplayName("should post compliance invoices to the compliance endpoint")
        void shouldUseComplianceEndpoint() throws Exception {
            server.enqueue(new MockResponse().setResponseCode(200).setBody("{}"));

            client.submitComplianceInvoice(request, credential);

            assertEquals("/compliance/invoices", server.takeRequest().getPath());
        }

        @Test
        @DisplayName("should refuse an expired credential without calling the server")
        void shouldRefuseExpiredCredential() {
            CsidCredential expired = new CsidCredential(CsidStage.PRODUCTION, "1", "a", "b", NOW);

            SubmissionResult result = client.submitForClearance(request, expired);

            assertFalse(result.isSuccess());
            assertEquals(ApiError.CSID_EXPIRED, result.getErrors().get(0).getCode());
            assertEquals(0, server.getRequestCount());
        }
    }

    @Nested
    @DisplayName("Response mapping")
    class ResponseMappingTests {

        @Test
        @DisplayName("should map a 400 rejection to an ERROR result")
        void shouldMapBadRequest() {
            server.enqueue(new MockResponse().setResponseCode(400).setBody("""
                {"validationResults":{"errorMessages":[{"code":"X1","message":"bad"}]}}
                """));

            SubmissionResult result = client.submitForClearance(request, credential);

            assertFalse(result.isSuccess());
            assertEquals(ValidationStatus.ERROR, result.getStatus());
            assertEquals(1, result.getErrors().size());
            assertEquals("X1", result.getErrors().get(0).getCode());
            assertEquals("bad", result.getErrors().get(0).getMessage());
            assertEquals("abcHash=", result.getInvoiceHash());
            assertFalse(result.isClearable());
            assertEquals(1, server.getRequestCount());
        }

        @Test
        @DisplayName("should treat error messages on a 2xx response as a failure")
        void shouldFailOnErrorsWithSuccessStatus() {
            server.enqueue(new MockResponse().setResponseCode(202).setBody("""
                {"validationResults":{"status":"WARNING","errorMessages":[{"type":"ERROR","code":"BR-KSA-08","category":"KSA","message":"seller id"}]}}
                """));

            SubmissionResult result = client.submitForClearance(request, credential);

            assertFalse(result.isSuccess());
            assertEquals(ValidationStatus.ERROR, result.getStatus());
            assertEquals("KSA", result.getErrors().get(0).getCategory());
        }

        @Test
        @DisplayName("should default to PASS when validationResults is absent")
        void shouldDefaultToPass() {
            server.enqueue(new MockResponse().setResponseCode(200).setBody("{\"reportingStatus\":\"REPORTED\"}"));

            SubmissionResult result = client.submitForReporting(request, credential);

            assertTrue(result.isSuccess());
            assertEquals(ValidationStatus.PASS, result.getStatus());
            assertEquals("REPORTED", result.getReportingStatus());
            assertEquals("abcHash=", result.getInvoiceHash());
            assertTrue(result.isClearable());
            assertFalse(result.requiresReview());
        }

        @Test
        @DisplayName("should decode the cleared invoice and keep the regulator QR code")
        void shouldDecodeClearedInvoice() {
            String cleared = "<Invoice>cleared</Invoice>";
            server.enqueue(new MockResponse().setResponseCode(200).setBody("{"
                + "\"clearanceStatus\":\"CLEARED\","
                + "\"invoiceHash\":\"serverHash=\","
                + "\"clearedInvoice\":\"" + base64(cleared) + "\","
                + "\"qrCode\":\"AQVTZWxsZXI=\","
                + "\"validationResults\":{\"status\":\"PASS\"}}"));

            SubmissionResult result = client.submitForClearance(request, credential);

            assertTrue(result.isSuccess());
            assertEquals("CLEARED", result.getClearanceStatus());
            assertEquals("serverHash=", result.getInvoiceHash());
            assertEquals(cleared, result.getSignedInvoice());
            assertEquals("AQVTZWxsZXI=", result.getQrCode());
        }

        @Test
        @DisplayName("should ignore an invoice body and QR code returned for a reported invoice")
        void shouldIgnoreReturnedInvoiceOnReporting() {
            server.enqueue(new MockResponse().setResponseCode(200).setBody("{"
                + "\"reportingStatus\":\"REPORTED\","
                + "\"signedInvoice\":\"" + base64("<Invoice>other</Invoice>") + "\","
                + "\"qrCode\":\"AQVTZWxsZXI=\"}"));

            SubmissionResult result = client.submitForReporting(request, credential);

            assertTrue(result.isSuccess());
            assertEquals("REPORTED", result.getReportingStatus());
            assertNull(result.getSignedInvoice());
            assertNull(result.getQrCode());
        }

        @Test
        @DisplayName("should flag warnings for review while staying clearable")
        void shouldFlagWarnings() {
            server.enqueue(new MockResponse().setResponseCode(202).setBody("""
                {"validationResults":{"status":"WARNING",
                  "infoMessages":[{"code":"XSD_ZATCA_VALID","message":"Complied with UBL 2.1"}],
                  "warningMessages":[{"code":"BR-KSA-98","message":"simplified late"}]}}
                """));

            SubmissionResult result = client.submitForReporting(request, credential);

            assertTrue(result.isSuccess());
            assertEquals(ValidationStatus.WARNING, result.getStatus());
            assertEquals(1, result.getInfo().size());
            assertEquals(ApiError.Type.WARNING, result.getWarnings().get(0).getType());
            assertTrue(result.requiresReview());
            assertTrue(result.isClearable());
        }

        @Test
        @DisplayName("should map a transport failure to a NETWORK entry")
        void shouldMapTransportFailure() throws IOException {
            server.shutdown();

            SubmissionResult result = client.submitForReporting(request, credential);

            assertFalse(result.isSuccess());
            assertEquals(ApiError.Type.NETWORK, result.getErrors().get(0).getType());
            assertEquals(ApiError.FETCH_ERROR, result.getErrors().get(0).getCode());
        }
    }

    @Nested
    @DisplayName("ValidationStatus")
    class ValidationStatusTests {

        @Test
        @DisplayName("should parse statuses leniently")
        void shouldParseStatuses() {
            assertEquals(ValidationStatus.PASS, ValidationStatus.fromValue(null));
            assertEquals(ValidationStatus.PASS, ValidationStatus.fromValue(""));
            assertEquals(ValidationStatus.WARNING, ValidationStatus.fromValue("warning"));
            assertEquals(ValidationStatus.ERROR, ValidationStatus.fromValue("NOT_A_STATUS"));
        }
    }
}
