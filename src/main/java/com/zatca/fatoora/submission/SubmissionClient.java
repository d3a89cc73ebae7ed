package com.zatca.fatoora.submission;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.zatca.fatoora.client.ApiError;
import com.zatca.fatoora.client.ApiErrors;
import com.zatca.fatoora.client.HttpClient;
import com.zatca.fatoora.config.FatooraConfig;
import com.zatca.fatoora.csid.CsidCredential;
import com.zatca.fatoora.exception.FatooraException;
import com.zatca.fatoora.exception.NetworkException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Base64;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Submits signed invoices for clearance, reporting or compliance checks.
 *
 * <p>All three modes POST the same {@link InvoiceSubmissionRequest} with
 * Basic credentials and share one response mapping. The request body is
 * taken as given, so a retried call resends the original hash and UUID.
 */
public class SubmissionClient {

    private static final Logger logger = LoggerFactory.getLogger(SubmissionClient.class);

    static final String CLEARANCE_STATUS_HEADER = "Clearance-Status";

    private final FatooraConfig config;
    private final HttpClient httpClient;
    private final Clock clock;

    public SubmissionClient(FatooraConfig config, HttpClient httpClient) {
        this(config, httpClient, Clock.systemUTC());
    }

    public SubmissionClient(FatooraConfig config, HttpClient httpClient, Clock clock) {
        this.config = config;
        this.httpClient = httpClient;
        this.clock = clock;
    }

    /**
     * Synchronous clearance for standard (B2B) invoices. The regulator may
     * return a cleared invoice body and its own QR code.
     */
    public SubmissionResult submitForClearance(InvoiceSubmissionRequest request, CsidCredential credential) {
        Map<String, String> headers = new HashMap<>();
        headers.put(CLEARANCE_STATUS_HEADER, "1");
        return submit(config.getClearanceApiUrl(), request, credential, headers, true);
    }

    /**
     * Reporting for simplified (B2C) invoices; acknowledgment only. Any
     * invoice body or QR code in the response is ignored: the locally signed
     * invoice stays authoritative.
     */
    public SubmissionResult submitForReporting(InvoiceSubmissionRequest request, CsidCredential credential) {
        return submit(config.getReportingApiUrl(), request, credential, new HashMap<>(), false);
    }

    /**
     * Compliance-phase test submission, authenticated with the compliance CSID.
     */
    public SubmissionResult submitComplianceInvoice(InvoiceSubmissionRequest request, CsidCredential credential) {
        return submit(config.getComplianceInvoicesApiUrl(), request, credential, new HashMap<>(), true);
    }

    private SubmissionResult submit(String url, InvoiceSubmissionRequest request,
                                    CsidCredential credential, Map<String, String> headers,
                                    boolean acceptsReturnedInvoice) {
        if (credential.isExpired(clock)) {
            logger.warn("Rejecting submission of {} with expired {} CSID", request.getUuid(), credential.getStage());
            return SubmissionResult.failure(ApiError.validation(ApiError.CSID_EXPIRED, null,
                "CSID expired at " + credential.getExpiresAt()));
        }
        headers.put("Authorization", credential.basicAuthHeader());

        HttpClient.HttpResponse<JsonNode> response;
        try {
            response = httpClient.post(url, request, headers);
        } catch (NetworkException e) {
            logger.warn("Submission of {} to {} failed: {}", request.getUuid(), url, e.getMessage());
            return SubmissionResult.failure(ApiError.network(e.getNetworkCode(), e.getMessage()));
        } catch (FatooraException e) {
            logger.warn("Submission of {} to {} failed: {}", request.getUuid(), url, e.getMessage());
            return SubmissionResult.failure(new ApiError(ApiError.Type.API, e.getCode(), null, e.getMessage()));
        }

        if (!response.isSuccessful()) {
            logger.warn("Submission of {} rejected with HTTP {}", request.getUuid(), response.getStatus());
            return SubmissionResult.builder()
                .success(false)
                .status(ValidationStatus.ERROR)
                .invoiceHash(request.getInvoiceHash())
                .errors(ApiErrors.fromResponse(response.getData(), response.getStatus()))
                .build();
        }

        return mapSuccess(request, response.getData(), acceptsReturnedInvoice);
    }

    private SubmissionResult mapSuccess(InvoiceSubmissionRequest request, JsonNode body, boolean acceptsReturnedInvoice) {
        SubmissionResponse parsed;
        try {
            parsed = body != null
                ? httpClient.getObjectMapper().treeToValue(body, SubmissionResponse.class)
                : new SubmissionResponse();
        } catch (JsonProcessingException e) {
            return SubmissionResult.failure(new ApiError(ApiError.Type.API, "INVALID_RESPONSE", null,
                "Malformed submission response: " + e.getOriginalMessage()));
        }

        ValidationResults validation = parsed.getValidationResults();
        List<ApiError> info = new ArrayList<>();
        List<ApiError> warnings = new ArrayList<>();
        List<ApiError> errors = new ArrayList<>();
        ValidationStatus status = ValidationStatus.PASS;
        if (validation != null) {
            collect(validation.getInfoMessages(), ApiError.Type.INFO, info);
            collect(validation.getWarningMessages(), ApiError.Type.WARNING, warnings);
            collect(validation.getErrorMessages(), ApiError.Type.ERROR, errors);
            status = ValidationStatus.fromValue(validation.getStatus());
        }

        // 2xx with error messages is still a rejection
        boolean success = errors.isEmpty();
        if (!success) {
            status = ValidationStatus.ERROR;
            logger.warn("Submission of {} returned {} error message(s)", request.getUuid(), errors.size());
        } else {
            logger.info("Submission of {} accepted with status {}", request.getUuid(), status);
        }

        String invoiceHash = parsed.getInvoiceHash() != null ? parsed.getInvoiceHash() : request.getInvoiceHash();
        String returnedInvoice = null;
        String returnedQrCode = null;
        if (acceptsReturnedInvoice) {
            returnedInvoice = parsed.getClearedInvoice() != null
                ? parsed.getClearedInvoice()
                : parsed.getSignedInvoice();
            returnedQrCode = parsed.getQrCode();
        }

        return SubmissionResult.builder()
            .success(success)
            .status(status)
            .invoiceHash(invoiceHash)
            .clearanceStatus(parsed.getClearanceStatus())
            .reportingStatus(parsed.getReportingStatus())
            .qrCode(returnedQrCode)
            .signedInvoice(decodeInvoice(returnedInvoice))
            .info(info)
            .warnings(warnings)
            .errors(errors)
            .build();
    }

    private static void collect(List<ValidationResults.Message> messages, ApiError.Type type, List<ApiError> target) {
        for (ValidationResults.Message message : messages) {
            target.add(new ApiError(type, message.getCode(), message.getCategory(), message.getMessage()));
        }
    }

    private static String decodeInvoice(String encoded) {
        if (encoded == null || encoded.isEmpty()) {
            return null;
        }
        try {
            return new String(Base64.getDecoder().decode(encoded.trim()), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            logger.debug("Returned invoice is not base64, keeping it as is: {}", e.getMessage());
            return encoded;
        }
    }
}
