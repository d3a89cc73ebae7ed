package com.zatca.fatoora;

import com.zatca.fatoora.chain.ChainEntry;
import com.zatca.fatoora.submission.SubmissionResult;

/**
 * Result of {@link EInvoicingService#issue}.
 *
 * <p>{@code chainEntry} is null when the invoice was rejected before it was
 * sequenced (local validation, expired credential). Once it is set the
 * invoice holds its ICV for good: a failed submission must be corrected or
 * recorded as void, never silently dropped.
 */
public final class IssuedInvoice {

    private final ChainEntry chainEntry;
    private final String signature;
    private final String localQrCode;
    private final SubmissionResult submission;

    IssuedInvoice(ChainEntry chainEntry, String signature, String localQrCode, SubmissionResult submission) {
        this.chainEntry = chainEntry;
        this.signature = signature;
        this.localQrCode = localQrCode;
        this.submission = submission;
    }

    static IssuedInvoice rejected(SubmissionResult submission) {
        return new IssuedInvoice(null, null, null, submission);
    }

    public boolean isSequenced() {
        return chainEntry != null;
    }

    public ChainEntry getChainEntry() { return chainEntry; }
    public String getSignature() { return signature; }
    public SubmissionResult getSubmission() { return submission; }

    /** QR payload built locally from the signed hash */
    public String getLocalQrCode() { return localQrCode; }

    /**
     * The regulator's QR code when one was returned, the local one otherwise.
     */
    public String getQrCode() {
        return submission.getQrCode() != null ? submission.getQrCode() : localQrCode;
    }

    /**
     * The cleared invoice when the regulator returned one, the submitted XML otherwise.
     */
    public String getInvoiceXml() {
        if (submission.getSignedInvoice() != null) {
            return submission.getSignedInvoice();
        }
        return chainEntry != null ? chainEntry.getXml() : null;
    }

    public boolean isClearable() {
        return submission.isClearable();
    }

    @Override
    public String toString() {
        return "IssuedInvoice{chainEntry=" + chainEntry + ", submission=" + submission + '}';
    }
}
