package com.zatca.fatoora.submission;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Objects;

/**
 * Body shared by clearance, reporting and compliance-invoice submission.
 *
 * <p>Built once per logical invoice; retries resend this exact instance.
 */
public final class InvoiceSubmissionRequest {

    private final String invoiceHash;
    private final String uuid;
    private final String invoice;

    public InvoiceSubmissionRequest(String invoiceHash, String uuid, String invoice) {
        this.invoiceHash = Objects.requireNonNull(invoiceHash, "invoiceHash");
        this.uuid = Objects.requireNonNull(uuid, "uuid");
        this.invoice = Objects.requireNonNull(invoice, "invoice");
    }

    /**
     * @param xml rendered invoice XML; base64-encoded from its UTF-8 bytes
     */
    public static InvoiceSubmissionRequest of(String xml, String invoiceHash, String uuid) {
        String encoded = Base64.getEncoder().encodeToString(xml.getBytes(StandardCharsets.UTF_8));
        return new InvoiceSubmissionRequest(invoiceHash, uuid, encoded);
    }

    @JsonProperty("invoiceHash")
    public String getInvoiceHash() { return invoiceHash; }

    @JsonProperty("uuid")
    public String getUuid() { return uuid; }

    @JsonProperty("invoice")
    public String getInvoice() { return invoice; }
}
