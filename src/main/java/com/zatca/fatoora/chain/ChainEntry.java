package com.zatca.fatoora.chain;

import com.zatca.fatoora.model.ChainPosition;

import java.util.Objects;

/**
 * One recorded invoice: its chain position, its hash and the exact XML
 * that was hashed.
 */
public final class ChainEntry {

    private final String organizationId;
    private final long icv;
    private final String previousHash;
    private final String invoiceHash;
    private final String xml;

    public ChainEntry(String organizationId, long icv, String previousHash, String invoiceHash, String xml) {
        this.organizationId = Objects.requireNonNull(organizationId, "organizationId");
        this.icv = icv;
        this.previousHash = Objects.requireNonNull(previousHash, "previousHash");
        this.invoiceHash = Objects.requireNonNull(invoiceHash, "invoiceHash");
        this.xml = Objects.requireNonNull(xml, "xml");
    }

    public String getOrganizationId() { return organizationId; }
    public long getIcv() { return icv; }
    public String getPreviousHash() { return previousHash; }
    public String getInvoiceHash() { return invoiceHash; }
    public String getXml() { return xml; }

    public ChainPosition getPosition() {
        return new ChainPosition(icv, previousHash);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ChainEntry that = (ChainEntry) o;
        return icv == that.icv
            && organizationId.equals(that.organizationId)
            && previousHash.equals(that.previousHash)
            && invoiceHash.equals(that.invoiceHash)
            && xml.equals(that.xml);
    }

    @Override
    public int hashCode() {
        return Objects.hash(organizationId, icv, previousHash, invoiceHash, xml);
    }

    @Override
    public String toString() {
        return "ChainEntry{organizationId='" + organizationId + "', icv=" + icv
            + ", previousHash='" + previousHash + "', invoiceHash='" + invoiceHash + "'}";
    }
}
