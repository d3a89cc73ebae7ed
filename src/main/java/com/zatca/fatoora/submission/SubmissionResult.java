package com.zatca.fatoora.submission;

import com.zatca.fatoora.client.ApiError;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of an invoice submission.
 *
 * <p>Transport failures, HTTP failures and regulator rejections all come
 * back as {@code success=false, status=ERROR} and differ only by the
 * {@link ApiError.Type} of their error entries.
 */
public final class SubmissionResult {

    private final boolean success;
    private final ValidationStatus status;
    private final String invoiceHash;
    private final String clearanceStatus;
    private final String reportingStatus;
    private final String qrCode;
    private final String signedInvoice;
    private final List<ApiError> info;
    private final List<ApiError> warnings;
    private final List<ApiError> errors;

    private SubmissionResult(Builder builder) {
        this.success = builder.success;
        this.status = builder.status;
        this.invoiceHash = builder.invoiceHash;
        this.clearanceStatus = builder.clearanceStatus;
        this.reportingStatus = builder.reportingStatus;
        this.qrCode = builder.qrCode;
        this.signedInvoice = builder.signedInvoice;
        this.info = Collections.unmodifiableList(new ArrayList<>(builder.info));
        this.warnings = Collections.unmodifiableList(new ArrayList<>(builder.warnings));
        this.errors = Collections.unmodifiableList(new ArrayList<>(builder.errors));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static SubmissionResult failure(List<ApiError> errors) {
        return builder().success(false).status(ValidationStatus.ERROR).errors(errors).build();
    }

    public static SubmissionResult failure(ApiError error) {
        return failure(List.of(error));
    }

    public boolean isSuccess() { return success; }
    public ValidationStatus getStatus() { return status; }
    public String getInvoiceHash() { return invoiceHash; }
    public String getClearanceStatus() { return clearanceStatus; }
    public String getReportingStatus() { return reportingStatus; }

    /** QR code returned by the regulator, if any */
    public String getQrCode() { return qrCode; }

    /** Cleared invoice XML returned by the regulator, if any */
    public String getSignedInvoice() { return signedInvoice; }

    public List<ApiError> getInfo() { return info; }
    public List<ApiError> getWarnings() { return warnings; }
    public List<ApiError> getErrors() { return errors; }

    /**
     * Whether the invoice may be marked as legally cleared or reported.
     */
    public boolean isClearable() {
        return success && status != ValidationStatus.ERROR && errors.isEmpty();
    }

    /**
     * Accepted with warnings that a human reviewer must see.
     */
    public boolean requiresReview() {
        return !warnings.isEmpty();
    }

    @Override
    public String toString() {
        return "SubmissionResult{success=" + success + ", status=" + status
            + ", invoiceHash='" + invoiceHash + "', errors=" + errors + ", warnings=" + warnings + '}';
    }

    public static class Builder {
        private boolean success;
        private ValidationStatus status = ValidationStatus.ERROR;
        private String invoiceHash;
        private String clearanceStatus;
        private String reportingStatus;
        private String qrCode;
        private String signedInvoice;
        private List<ApiError> info = Collections.emptyList();
        private List<ApiError> warnings = Collections.emptyList();
        private List<ApiError> errors = Collections.emptyList();

        public Builder success(boolean success) { this.success = success; return this; }
        public Builder status(ValidationStatus status) { this.status = status; return this; }
        public Builder invoiceHash(String invoiceHash) { this.invoiceHash = invoiceHash; return this; }
        public Builder clearanceStatus(String clearanceStatus) { this.clearanceStatus = clearanceStatus; return this; }
        public Builder reportingStatus(String reportingStatus) { this.reportingStatus = reportingStatus; return this; }
        public Builder qrCode(String qrCode) { this.qrCode = qrCode; return this; }
        public Builder signedInvoice(String signedInvoice) { this.signedInvoice = signedInvoice; return this; }
        public Builder info(List<ApiError> info) { this.info = info; return this; }
        public Builder warnings(List<ApiError> warnings) { this.warnings = warnings; return this; }
        public Builder errors(List<ApiError> errors) { this.errors = errors; return this; }

        public SubmissionResult build() {
            return new SubmissionResult(this);
        }
    }
}
