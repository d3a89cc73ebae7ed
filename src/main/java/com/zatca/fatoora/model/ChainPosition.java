package com.zatca.fatoora.model;

import java.util.Objects;

/**
 * An invoice's place in its organization's hash chain: the invoice counter
 * value and the hash of the previous invoice.
 */
public final class ChainPosition {

    private final long invoiceCounterValue;
    private final String previousInvoiceHash;

    public ChainPosition(long invoiceCounterValue, String previousInvoiceHash) {
        this.invoiceCounterValue = invoiceCounterValue;
        this.previousInvoiceHash = previousInvoiceHash;
    }

    public long getInvoiceCounterValue() {
        return invoiceCounterValue;
    }

    public String getPreviousInvoiceHash() {
        return previousInvoiceHash;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ChainPosition that = (ChainPosition) o;
        return invoiceCounterValue == that.invoiceCounterValue
            && Objects.equals(previousInvoiceHash, that.previousInvoiceHash);
    }

    @Override
    public int hashCode() {
        return Objects.hash(invoiceCounterValue, previousInvoiceHash);
    }

    @Override
    public String toString() {
        return "ChainPosition{icv=" + invoiceCounterValue + ", pih='" + previousInvoiceHash + "'}";
    }
}
