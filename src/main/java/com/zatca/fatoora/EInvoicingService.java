package com.zatca.fatoora;

import com.zatca.fatoora.chain.ChainEntry;
import com.zatca.fatoora.chain.ChainSequencer;
import com.zatca.fatoora.client.ApiError;
import com.zatca.fatoora.client.HttpClient;
import com.zatca.fatoora.config.FatooraConfig;
import com.zatca.fatoora.crypto.QrCodeAssembler;
import com.zatca.fatoora.crypto.SignatureService;
import com.zatca.fatoora.csid.CertificateLifecycleClient;
import com.zatca.fatoora.csid.CsidCredential;
import com.zatca.fatoora.exception.FatooraException;
import com.zatca.fatoora.model.InvoiceDocument;
import com.zatca.fatoora.model.InvoiceTotals;
import com.zatca.fatoora.submission.InvoiceSubmissionRequest;
import com.zatca.fatoora.submission.SubmissionClient;
import com.zatca.fatoora.submission.SubmissionResult;
import com.zatca.fatoora.validation.InvoiceValidationResult;
import com.zatca.fatoora.validation.InvoiceValidator;
import com.zatca.fatoora.validation.ValidationMessage;
import com.zatca.fatoora.xml.InvoiceXmlBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

/**
 * Issues invoices end to end: validate, sequence, sign, build the QR code
 * and submit. Standard invoices are cleared, simplified ones reported.
 *
 * <p>Example usage:
 * <pre>{@code
 * try (EInvoicingService service = new EInvoicingService(config)) {
 *     IssuedInvoice issued = service.issue("org-1", invoice, identity, productionCredential);
 *     if (issued.isClearable()) {
 *         store(issued.getChainEntry(), issued.getInvoiceXml(), issued.getQrCode());
 *     }
 * }
 * }</pre>
 */
public class EInvoicingService implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(EInvoicingService.class);

    private static final DateTimeFormatter QR_TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss");

    private final HttpClient httpClient;
    private final InvoiceValidator validator;
    private final InvoiceXmlBuilder xmlBuilder;
    private final ChainSequencer sequencer;
    private final SubmissionClient submissionClient;
    private final CertificateLifecycleClient lifecycleClient;
    private final Clock clock;

    public EInvoicingService(FatooraConfig config) {
        this(config, new HttpClient(config), new ChainSequencer(), Clock.systemUTC());
    }

    public EInvoicingService(FatooraConfig config, HttpClient httpClient, ChainSequencer sequencer, Clock clock) {
        this.httpClient = httpClient;
        this.validator = new InvoiceValidator();
        this.xmlBuilder = new InvoiceXmlBuilder();
        this.sequencer = sequencer;
        this.submissionClient = new SubmissionClient(config, httpClient, clock);
        this.lifecycleClient = new CertificateLifecycleClient(config, httpClient, clock);
        this.clock = clock;
    }

    /**
     * Issue one invoice for an organization.
     *
     * <p>Rejections before sequencing (invalid invoice, expired credential)
     * leave the chain untouched. Once sequenced, the returned value always
     * carries the chain entry; a signing or QR failure comes back as a failed
     * submission instead of an exception.
     *
     * @throws com.zatca.fatoora.exception.FatooraException if the signing key is malformed
     * @throws com.zatca.fatoora.exception.ChainIntegrityException if the chain moved concurrently
     */
    public IssuedInvoice issue(String organizationId, InvoiceDocument invoice,
                               SigningIdentity identity, CsidCredential credential) {
        InvoiceValidationResult validation = validator.validate(invoice);
        if (!validation.isValid()) {
            logger.warn("Invoice {} failed validation: {}", invoice.getId(), validation.getErrors());
            return IssuedInvoice.rejected(SubmissionResult.builder()
                .success(false)
                .errors(toApiErrors(validation.getErrors()))
                .warnings(toApiErrors(validation.getWarnings()))
                .build());
        }

        if (credential.isExpired(clock)) {
            logger.warn("Invoice {} not issued: {} CSID expired", invoice.getId(), credential.getStage());
            return IssuedInvoice.rejected(SubmissionResult.failure(ApiError.validation(ApiError.CSID_EXPIRED, null,
                "CSID expired at " + credential.getExpiresAt())));
        }

        // Load the key before taking a chain slot
        SignatureService signer = SignatureService.forPrivateKey(identity.getKeyPair().getPrivateKeyPem());

        ChainEntry entry = sequencer.append(organizationId,
            position -> xmlBuilder.build(invoice.withChainPosition(position)));
        logger.info("Invoice {} sequenced as ICV {} for organization {}",
            invoice.getId(), entry.getIcv(), organizationId);

        // The slot is taken: from here on failures are reported with the entry, never thrown
        String signature = null;
        String qrCode;
        try {
            signature = signer.signInvoiceHash(entry.getInvoiceHash());
            qrCode = buildQrCode(invoice, entry.getInvoiceHash(), signature, identity);
        } catch (FatooraException e) {
            logger.error("Invoice {} (ICV {}) sequenced but not signed: {}",
                invoice.getId(), entry.getIcv(), e.getMessage(), e);
            return new IssuedInvoice(entry, signature, null,
                SubmissionResult.failure(ApiError.validation(e.getCode(), null, e.getMessage())));
        }

        InvoiceSubmissionRequest request =
            InvoiceSubmissionRequest.of(entry.getXml(), entry.getInvoiceHash(), invoice.getUuid());
        SubmissionResult submission = invoice.isSimplified()
            ? submissionClient.submitForReporting(request, credential)
            : submissionClient.submitForClearance(request, credential);

        if (!submission.isClearable()) {
            logger.warn("Invoice {} (ICV {}) not accepted: {}", invoice.getId(), entry.getIcv(), submission.getErrors());
        } else if (submission.requiresReview()) {
            logger.warn("Invoice {} (ICV {}) accepted with warnings: {}",
                invoice.getId(), entry.getIcv(), submission.getWarnings());
        }

        return new IssuedInvoice(entry, signature, qrCode, submission);
    }

    String buildQrCode(InvoiceDocument invoice, String invoiceHash, String signature, SigningIdentity identity) {
        InvoiceTotals totals = invoice.getTotals();
        return QrCodeAssembler.assemblePhase2(
            invoice.getSeller().getName(),
            invoice.getSeller().getVatNumber(),
            invoice.getIssueDateTime().format(QR_TIMESTAMP),
            InvoiceXmlBuilder.formatAmount(totals.getTaxInclusiveAmount()),
            InvoiceXmlBuilder.formatAmount(totals.getTaxAmount()),
            invoiceHash,
            signature,
            identity.getKeyPair().getPublicKeyBase64(),
            identity.getCertificateSignature()
        );
    }

    private static List<ApiError> toApiErrors(List<ValidationMessage> messages) {
        List<ApiError> errors = new ArrayList<>(messages.size());
        for (ValidationMessage message : messages) {
            errors.add(ApiError.validation(message.getCode(), message.getCategory(), message.getMessage()));
        }
        return errors;
    }

    public CertificateLifecycleClient getLifecycleClient() {
        return lifecycleClient;
    }

    public SubmissionClient getSubmissionClient() {
        return submissionClient;
    }

    public ChainSequencer getSequencer() {
        return sequencer;
    }

    @Override
    public void close() {
        httpClient.close();
    }
}
