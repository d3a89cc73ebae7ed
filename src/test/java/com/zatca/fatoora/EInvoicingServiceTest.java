package com.zatca.fatoora;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.zatca.fatoora.chain.ChainSequencer;
import com.zatca.fatoora.chain.ChainVerifier;
import com.zatca.fatoora.client.ApiError;
import com.zatca.fatoora.client.HttpClient;
import com.zatca.fatoora.config.FatooraConfig;
import com.zatca.fatoora.crypto.CertificateManager;
import com.zatca.fatoora.crypto.InvoiceHashService;
import com.zatca.fatoora.crypto.KeyPairPem;
import com.zatca.fatoora.crypto.SignatureService;
import com.zatca.fatoora.crypto.TestCertificates;
import com.zatca.fatoora.csid.CsidCredential;
import com.zatca.fatoora.csid.CsidStage;
import com.zatca.fatoora.exception.TlvEncodingException;
import com.zatca.fatoora.model.Party;
import com.zatca.fatoora.model.TestInvoices;
import com.zatca.fatoora.submission.ValidationStatus;
import com.zatca.fatoora.tlv.QrTag;
import com.zatca.fatoora.tlv.TlvCodec;
import com.zatca.fatoora.tlv.TlvRecord;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
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
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests for EInvoicingService against a mock regulator
 */
class EInvoicingServiceTest {

    private static final String ORG = "org-1";
    private static final Instant NOW = Instant.parse("2024-01-15T10:30:00Z");
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static KeyPairPem keyPair;
    private static SigningIdentity identity;

    private MockWebServer server;
    private EInvoicingService service;
    private CsidCredential credential;

    @BeforeAll
    static void createIdentity() {
        CertificateManager certificateManager = new CertificateManager(FatooraConfig.builder().build());
        keyPair = certificateManager.generateKeyPair();
        identity = SigningIdentity.fromCertificate(keyPair, TestCertificates.selfSignedPem(keyPair));
    }

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        FatooraConfig config = FatooraConfig.builder()
            .baseUrl(server.url("/").toString().replaceAll("/$", ""))
            .retryAttempts(0)
            .retryDelay(1)
            .build();
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        service = new EInvoicingService(config, new HttpClient(config), new ChainSequencer(), clock);
        credential = new CsidCredential(CsidStage.PRODUCTION, "1", "UFJPRA==", "prod-secret",
            NOW.plusSeconds(86_400));
    }

    @AfterEach
    void tearDown() throws IOException {
        service.close();
        server.shutdown();
    }

    @Nested
    @DisplayName("Simplified invoices")
    class SimplifiedInvoiceTests {

        @Test
        @DisplayName("should sequence, sign and report a simplified invoice")
        void shouldReportSimplifiedInvoice() throws Exception {
            server.enqueue(new MockResponse().setResponseCode(200).setBody("""
                {"reportingStatus":"REPORTED","validationResults":{"status":"PASS"}}
                """));

            IssuedInvoice issued = service.issue(ORG, TestInvoices.simplified().build(), identity, credential);

            assertTrue(issued.isSequenced());
            assertTrue(issued.isClearable());
            assertEquals(1, issued.getChainEntry().getIcv());
            assertEquals(InvoiceHashService.INITIAL_HASH, issued.getChainEntry().getPreviousHash());
            assertEquals("REPORTED", issued.getSubmission().getReportingStatus());

            SignatureService verifier = SignatureService.builder().publicKey(keyPair.getPublicKeyPem()).build();
            assertTrue(verifier.verifyInvoiceHash(issued.getChainEntry().getInvoiceHash(), issued.getSignature()));

            RecordedRequest request = server.takeRequest();
            assertEquals("/invoices/reporting/single", request.getPath());
            JsonNode body = MAPPER.readTree(request.getBody().readUtf8());
            assertEquals(issued.getChainEntry().getInvoiceHash(), body.get("invoiceHash").asText());
            String xml = new String(Base64.getDecoder().decode(body.get("invoice").asText()), StandardCharsets.UTF_8);
            assertEquals(issued.getChainEntry().getXml(), xml);
            assertEquals(xml, issued.getInvoiceXml());
        }

        @Test
        @DisplayName("should build a Phase 2 QR code from the invoice")
        void shouldBuildPhase2QrCode() {
            server.enqueue(new MockResponse().setResponseCode(200).setBody("{}"));

            IssuedInvoice issued = service.issue(ORG, TestInvoices.simplified().build(), identity, credential);

            assertEquals(issued.getLocalQrCode(), issued.getQrCode());
            List<TlvRecord> records = TlvCodec.decodeSequence(issued.getQrCode());
            assertEquals(9, records.size());
            assertEquals("Maximum Speed Tech Supply LTD", records.get(0).getValueAsString());
            assertEquals(TestInvoices.SELLER_VAT, records.get(1).getValueAsString());
            assertEquals("2024-01-15T10:30:00", records.get(2).getValueAsString());
            assertEquals("23.00", records.get(3).getValueAsString());
            assertEquals("3.00", records.get(4).getValueAsString());
            assertEquals(QrTag.PUBLIC_KEY.getTag(), records.get(7).getTag());
            assertEquals(keyPair.getPublicKeyBase64(), records.get(7).getValueAsString());
            assertArrayEquals(Base64.getDecoder().decode(issued.getChainEntry().getInvoiceHash()),
                records.get(5).getValue());
            assertArrayEquals(Base64.getDecoder().decode(identity.getCertificateSignature()),
                records.get(8).getValue());
        }

        @Test
        @DisplayName("should keep the local invoice and QR code when the report response carries its own")
        void shouldIgnoreReturnedInvoiceWhenReporting() {
            String other = Base64.getEncoder().encodeToString("<Invoice>other</Invoice>".getBytes(StandardCharsets.UTF_8));
            server.enqueue(new MockResponse().setResponseCode(200).setBody("{"
                + "\"reportingStatus\":\"REPORTED\","
                + "\"signedInvoice\":\"" + other + "\","
                + "\"clearedInvoice\":\"" + other + "\","
                + "\"qrCode\":\"AQVTZWxsZXI=\"}"));

            IssuedInvoice issued = service.issue(ORG, TestInvoices.simplified().build(), identity, credential);

            assertTrue(issued.isClearable());
            assertNull(issued.getSubmission().getSignedInvoice());
            assertNull(issued.getSubmission().getQrCode());
            assertEquals(issued.getChainEntry().getXml(), issued.getInvoiceXml());
            assertEquals(issued.getLocalQrCode(), issued.getQrCode());
        }

        @Test
        @DisplayName("should chain consecutive invoices")
        void shouldChainConsecutiveInvoices() {
            server.enqueue(new MockResponse().setResponseCode(200).setBody("{}"));
            server.enqueue(new MockResponse().setResponseCode(200).setBody("{}"));

            IssuedInvoice first = service.issue(ORG, TestInvoices.simplified().build(), identity, credential);
            IssuedInvoice second = service.issue(ORG, TestInvoices.simplified()
                .id("SME00011")
                .uuid("16e78469-64af-406d-9cfd-895e724198f0")
                .build(), identity, credential);

            assertEquals(2, second.getChainEntry().getIcv());
            assertEquals(first.getChainEntry().getInvoiceHash(), second.getChainEntry().getPreviousHash());
            assertTrue(ChainVerifier.verify(List.of(first.getChainEntry(), second.getChainEntry())).isValid());
        }
    }

    @Nested
    @DisplayName("Standard invoices")
    class StandardInvoiceTests {

        @Test
        @DisplayName("should clear a standard invoice and prefer the regulator's output")
        void shouldClearStandardInvoice() throws Exception {
            String cleared = "<Invoice>cleared</Invoice>";
            server.enqueue(new MockResponse().setResponseCode(200).setBody("{"
                + "\"clearanceStatus\":\"CLEARED\","
                + "\"clearedInvoice\":\"" + Base64.getEncoder().encodeToString(cleared.getBytes(StandardCharsets.UTF_8)) + "\","
                + "\"qrCode\":\"AQVTZWxsZXI=\"}"));

            IssuedInvoice issued = service.issue(ORG, TestInvoices.standard().build(), identity, credential);

            assertTrue(issued.isClearable());
            assertEquals("CLEARED", issued.getSubmission().getClearanceStatus());
            assertEquals(cleared, issued.getInvoiceXml());
            assertEquals("AQVTZWxsZXI=", issued.getQrCode());
            assertNotEquals(issued.getQrCode(), issued.getLocalQrCode());

            RecordedRequest request = server.takeRequest();
            assertEquals("/invoices/clearance/single", request.getPath());
            assertEquals("1", request.getHeader("Clearance-Status"));
        }

        @Test
        @DisplayName("should keep the chain slot when clearance is rejected")
        void shouldKeepSlotOnRejection() {
            server.enqueue(new MockResponse().setResponseCode(400).setBody("""
                {"validationResults":{"errorMessages":[{"code":"X1","message":"bad"}]}}
                """));

            IssuedInvoice issued = service.issue(ORG, TestInvoices.standard().build(), identity, credential);

            assertTrue(issued.isSequenced());
            assertFalse(issued.isClearable());
            assertEquals(ValidationStatus.ERROR, issued.getSubmission().getStatus());
            assertEquals("X1", issued.getSubmission().getErrors().get(0).getCode());
            assertEquals(1, service.getSequencer().currentState(ORG).getLastIcv());
        }
    }

    @Nested
    @DisplayName("Rejections before sequencing")
    class RejectionTests {

        @Test
        @DisplayName("should return validation errors without consuming a chain slot")
        void shouldRejectInvalidInvoice() {
            Party seller = Party.builder().name("").vatNumber("123").build();

            IssuedInvoice issued = service.issue(ORG, TestInvoices.simplified().seller(seller).build(),
                identity, credential);

            assertFalse(issued.isSequenced());
            assertFalse(issued.isClearable());
            assertNull(issued.getInvoiceXml());
            List<ApiError> errors = issued.getSubmission().getErrors();
            assertFalse(errors.isEmpty());
            assertTrue(errors.stream().allMatch(e -> e.getType() == ApiError.Type.VALIDATION));
            assertTrue(errors.stream().anyMatch(e -> "SEL-001".equals(e.getCode())));
            assertEquals(0, service.getSequencer().currentState(ORG).getLastIcv());
            assertEquals(0, server.getRequestCount());
        }

        @Test
        @DisplayName("should reject a seller name too long for the QR code before sequencing")
        void shouldRejectOversizedSellerName() {
            Party seller = Party.builder().name("شركة".repeat(40)).vatNumber(TestInvoices.SELLER_VAT).build();

            IssuedInvoice issued = service.issue(ORG, TestInvoices.simplified().seller(seller).build(),
                identity, credential);

            assertFalse(issued.isSequenced());
            assertTrue(issued.getSubmission().getErrors().stream().anyMatch(e -> "SEL-003".equals(e.getCode())));
            assertEquals(0, service.getSequencer().currentState(ORG).getLastIcv());
            assertEquals(0, server.getRequestCount());
        }

        @Test
        @DisplayName("should refuse an expired credential without consuming a chain slot")
        void shouldRejectExpiredCredential() {
            CsidCredential expired = new CsidCredential(CsidStage.PRODUCTION, "1", "a", "b", NOW);

            IssuedInvoice issued = service.issue(ORG, TestInvoices.simplified().build(), identity, expired);

            assertFalse(issued.isSequenced());
            assertEquals(ApiError.CSID_EXPIRED, issued.getSubmission().getErrors().get(0).getCode());
            assertEquals(0, service.getSequencer().currentState(ORG).getLastIcv());
            assertEquals(0, server.getRequestCount());
        }

        @Test
        @DisplayName("should not consume a chain slot when the signing key is malformed")
        void shouldRejectMalformedKey() {
            SigningIdentity broken = new SigningIdentity(
                new KeyPairPem("not a key", keyPair.getPublicKeyPem()), identity.getCertificateSignature());

            assertThrows(RuntimeException.class,
                () -> service.issue(ORG, TestInvoices.simplified().build(), broken, credential));
            assertEquals(0, service.getSequencer().currentState(ORG).getLastIcv());
        }
    }

    @Nested
    @DisplayName("Failures after sequencing")
    class SequencedFailureTests {

        @Test
        @DisplayName("should return the chain entry when the QR code cannot be encoded")
        void shouldReturnEntryWhenQrEncodingFails() {
            String oversizedSignature = Base64.getEncoder().encodeToString(new byte[300]);
            SigningIdentity oversized = new SigningIdentity(keyPair, oversizedSignature);

            IssuedInvoice issued = service.issue(ORG, TestInvoices.simplified().build(), oversized, credential);

            assertTrue(issued.isSequenced());
            assertFalse(issued.isClearable());
            assertEquals(1, issued.getChainEntry().getIcv());
            assertNotNull(issued.getSignature());
            assertNull(issued.getQrCode());
            assertEquals(TlvEncodingException.VALUE_TOO_LONG, issued.getSubmission().getErrors().get(0).getCode());
            assertEquals(1, service.getSequencer().currentState(ORG).getLastIcv());
            assertEquals(0, server.getRequestCount());
        }
    }
}
