package com.zatca.fatoora.model;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Fields shared by standard and simplified invoices.
 */
public interface InvoiceDocument {

    String getId();

    String getUuid();

    LocalDateTime getIssueDateTime();

    String getCurrency();

    InvoiceTypeCode getTypeCode();

    Party getSeller();

    List<InvoiceLineItem> getLineItems();

    BillingReference getBillingReference();

    /**
     * @return the chain position, or null before the invoice is sequenced
     */
    ChainPosition getChainPosition();

    /**
     * Copy of this invoice placed at the given chain position.
     */
    InvoiceDocument withChainPosition(ChainPosition chainPosition);

    /**
     * Simplified (B2C) invoices are reported; standard ones are cleared.
     */
    boolean isSimplified();

    default InvoiceTotals getTotals() {
        return InvoiceTotals.calculate(getLineItems());
    }
}
