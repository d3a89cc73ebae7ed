package com.zatca.fatoora.csid;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.zatca.fatoora.client.ApiError;
import com.zatca.fatoora.client.ApiErrors;
import com.zatca.fatoora.client.HttpClient;
import com.zatca.fatoora.config.FatooraConfig;
import com.zatca.fatoora.exception.FatooraException;
import com.zatca.fatoora.exception.NetworkException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.HashMap;
import java.util.Map;

/**
 * Client for the CSID onboarding endpoints.
 *
 * <p>Onboarding is a two-step state machine: a compliance CSID is issued
 * against a CSR and OTP, and a production CSID is issued against the
 * compliance request id once the compliance-phase test invoices have been
 * accepted. Sequencing the steps is the caller's job.
 *
 * <p>No operation throws for protocol or transport failures; they come
 * back as error entries in {@link CsidResult}.
 */
public class CertificateLifecycleClient {

    private static final Logger logger = LoggerFactory.getLogger(CertificateLifecycleClient.class);

    static final String OTP_HEADER = "OTP";
    static final String AUTHORIZATION_HEADER = "Authorization";

    private final FatooraConfig config;
    private final HttpClient httpClient;
    private final Clock clock;

    public CertificateLifecycleClient(FatooraConfig config, HttpClient httpClient) {
        this(config, httpClient, Clock.systemUTC());
    }

    public CertificateLifecycleClient(FatooraConfig config, HttpClient httpClient, Clock clock) {
        this.config = config;
        this.httpClient = httpClient;
        this.clock = clock;
    }

    /**
     * Request a compliance CSID.
     *
     * @param csr base64 CSR as produced by {@code CertificateManager.generateCsr}
     * @param otp one-time code from the taxpayer portal
     */
    public CsidResult requestComplianceCsid(String csr, String otp) {
        Map<String, String> headers = new HashMap<>();
        headers.put(OTP_HEADER, otp);

        logger.info("Requesting compliance CSID");
        return call("POST", config.getComplianceApiUrl(), new ComplianceCsidRequest(csr), headers,
            CsidStage.COMPLIANCE, null);
    }

    /**
     * Request a production CSID with the compliance credential.
     */
    public CsidResult requestProductionCsid(CsidCredential complianceCredential, String complianceRequestId) {
        if (complianceCredential.isExpired(clock)) {
            return expired(complianceCredential);
        }
        return requestProductionCsid(complianceCredential.getCsid(), complianceCredential.getSecret(),
            complianceRequestId);
    }

    public CsidResult requestProductionCsid(String csid, String secret, String complianceRequestId) {
        Map<String, String> headers = new HashMap<>();
        headers.put(AUTHORIZATION_HEADER, CsidCredential.basicAuthHeader(csid, secret));

        logger.info("Requesting production CSID for compliance request {}", complianceRequestId);
        return call("POST", config.getProductionCsidApiUrl(), new ProductionCsidRequest(complianceRequestId),
            headers, CsidStage.PRODUCTION, null);
    }

    /**
     * Renew a production CSID. Fields missing from the renewal response
     * (request id, secret) are carried over from the current credential.
     */
    public CsidResult renewProductionCsid(CsidCredential current, String csr, String otp) {
        if (current.isExpired(clock)) {
            return expired(current);
        }

        Map<String, String> headers = new HashMap<>();
        headers.put(OTP_HEADER, otp);
        headers.put(AUTHORIZATION_HEADER, current.basicAuthHeader());

        logger.info("Renewing production CSID {}", current.getRequestId());
        return call("PATCH", config.getProductionCsidApiUrl(), new ComplianceCsidRequest(csr), headers,
            CsidStage.PRODUCTION, current);
    }

    /**
     * Renew only if the credential expires within the configured renewal
     * window; otherwise the current credential is returned untouched.
     */
    public CsidResult renewIfExpiring(CsidCredential current, String csr, String otp) {
        int window = config.getCsidRenewalWindowDays();
        if (!current.expiresWithin(window, clock)) {
            logger.debug("CSID {} not within {} day renewal window, skipping", current.getRequestId(), window);
            return CsidResult.unchanged(current);
        }
        return renewProductionCsid(current, csr, otp);
    }

    private CsidResult call(String method, String url, Object body, Map<String, String> headers,
                            CsidStage stage, CsidCredential previous) {
        HttpClient.HttpResponse<JsonNode> response;
        try {
            response = httpClient.execute(method, url, body, headers, JsonNode.class);
        } catch (NetworkException e) {
            logger.warn("CSID request to {} failed: {}", url, e.getMessage());
            return CsidResult.failure(ApiError.network(e.getNetworkCode(), e.getMessage()));
        } catch (FatooraException e) {
            logger.warn("CSID request to {} failed: {}", url, e.getMessage());
            return CsidResult.failure(new ApiError(ApiError.Type.API, e.getCode(), null, e.getMessage()));
        }

        if (!response.isSuccessful()) {
            logger.warn("CSID request to {} rejected with HTTP {}", url, response.getStatus());
            return CsidResult.failure(ApiErrors.fromResponse(response.getData(), response.getStatus()));
        }

        CsidResponse csidResponse;
        try {
            csidResponse = httpClient.getObjectMapper().treeToValue(response.getData(), CsidResponse.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            return CsidResult.failure(new ApiError(ApiError.Type.API, "INVALID_RESPONSE", null,
                "Malformed CSID response: " + e.getMessage()));
        }
        if (csidResponse == null || isBlank(csidResponse.getBinarySecurityToken())) {
            return CsidResult.failure(new ApiError(ApiError.Type.API, "INVALID_RESPONSE", null,
                "CSID response carries no binarySecurityToken"));
        }

        String requestId = csidResponse.getRequestId();
        String secret = csidResponse.getSecret();
        if (previous != null) {
            requestId = isBlank(requestId) ? previous.getRequestId() : requestId;
            secret = isBlank(secret) ? previous.getSecret() : secret;
        }
        if (isBlank(secret)) {
            return CsidResult.failure(new ApiError(ApiError.Type.API, "INVALID_RESPONSE", null,
                "CSID response carries no secret"));
        }

        CsidCredential credential = new CsidCredential(stage, requestId,
            csidResponse.getBinarySecurityToken(), secret, parseExpiry(csidResponse.getTokenExpiry()));
        logger.info("{} CSID issued, request id {}", stage, requestId);
        return CsidResult.success(credential, csidResponse.getDispositionMessage());
    }

    private CsidResult expired(CsidCredential credential) {
        logger.warn("Rejecting call with expired {} CSID {}", credential.getStage(), credential.getRequestId());
        return CsidResult.failure(ApiError.validation(ApiError.CSID_EXPIRED, null,
            "CSID expired at " + credential.getExpiresAt()));
    }

    static Instant parseExpiry(String tokenExpiry) {
        if (isBlank(tokenExpiry)) {
            return null;
        }
        try {
            return Instant.parse(tokenExpiry);
        } catch (DateTimeParseException e) {
            try {
                return OffsetDateTime.parse(tokenExpiry).toInstant();
            } catch (DateTimeParseException nested) {
                logger.warn("Unparseable tokenExpiry '{}', treating credential as non-expiring", tokenExpiry);
                return null;
            }
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }
}
