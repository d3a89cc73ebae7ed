package com.zatca.fatoora.submission;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 2xx body of clearance, reporting and compliance-invoice calls
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class SubmissionResponse {

    @JsonProperty("invoiceHash")
    private String invoiceHash;

    @JsonProperty("clearanceStatus")
    private String clearanceStatus;

    @JsonProperty("reportingStatus")
    private String reportingStatus;

    @JsonProperty("clearedInvoice")
    private String clearedInvoice;

    @JsonProperty("signedInvoice")
    private String signedInvoice;

    @JsonProperty("qrCode")
    private String qrCode;

    @JsonProperty("validationResults")
    private ValidationResults validationResults;

    public String getInvoiceHash() { return invoiceHash; }
    public void setInvoiceHash(String invoiceHash) { this.invoiceHash = invoiceHash; }

    public String getClearanceStatus() { return clearanceStatus; }
    public void setClearanceStatus(String clearanceStatus) { this.clearanceStatus = clearanceStatus; }

    public String getReportingStatus() { return reportingStatus; }
    public void setReportingStatus(String reportingStatus) { this.reportingStatus = reportingStatus; }

    public String getClearedInvoice() { return clearedInvoice; }
    public void setClearedInvoice(String clearedInvoice) { this.clearedInvoice = clearedInvoice; }

    public String getSignedInvoice() { return signedInvoice; }
    public void setSignedInvoice(String signedInvoice) { this.signedInvoice = signedInvoice; }

    public String getQrCode() { return qrCode; }
    public void setQrCode(String qrCode) { this.qrCode = qrCode; }

    public ValidationResults getValidationResults() { return validationResults; }
    public void setValidationResults(ValidationResults validationResults) { this.validationResults = validationResults; }
}
