package com.zatca.fatoora.model;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Simplified (B2C) invoice: seller only, no counterparty. Reported after
 * the fact rather than cleared.
 */
public final class SimplifiedInvoiceData implements InvoiceDocument {

    private final String id;
    private final String uuid;
    private final LocalDateTime issueDateTime;
    private final String currency;
    private final InvoiceTypeCode typeCode;
    private final Party seller;
    private final List<InvoiceLineItem> lineItems;
    private final BillingReference billingReference;
    private final ChainPosition chainPosition;

    private SimplifiedInvoiceData(Builder builder) {
        this.id = builder.id;
        this.uuid = builder.uuid;
        this.issueDateTime = builder.issueDateTime;
        this.currency = builder.currency;
        this.typeCode = builder.typeCode;
        this.seller = builder.seller;
        this.lineItems = Collections.unmodifiableList(new ArrayList<>(builder.lineItems));
        this.billingReference = builder.billingReference;
        this.chainPosition = builder.chainPosition;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .id(id)
            .uuid(uuid)
            .issueDateTime(issueDateTime)
            .currency(currency)
            .typeCode(typeCode)
            .seller(seller)
            .lineItems(lineItems)
            .billingReference(billingReference)
            .chainPosition(chainPosition);
    }

    @Override
    public SimplifiedInvoiceData withChainPosition(ChainPosition position) {
        return toBuilder().chainPosition(position).build();
    }

    @Override public String getId() { return id; }
    @Override public String getUuid() { return uuid; }
    @Override public LocalDateTime getIssueDateTime() { return issueDateTime; }
    @Override public String getCurrency() { return currency; }
    @Override public InvoiceTypeCode getTypeCode() { return typeCode; }
    @Override public Party getSeller() { return seller; }
    @Override public List<InvoiceLineItem> getLineItems() { return lineItems; }
    @Override public BillingReference getBillingReference() { return billingReference; }
    @Override public ChainPosition getChainPosition() { return chainPosition; }

    @Override
    public boolean isSimplified() {
        return true;
    }

    public static class Builder {
        private String id;
        private String uuid;
        private LocalDateTime issueDateTime;
        private String currency = "SAR";
        private InvoiceTypeCode typeCode = InvoiceTypeCode.TAX_INVOICE;
        private Party seller;
        private List<InvoiceLineItem> lineItems = new ArrayList<>();
        private BillingReference billingReference;
        private ChainPosition chainPosition;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder uuid(String uuid) {
            this.uuid = uuid;
            return this;
        }

        public Builder issueDateTime(LocalDateTime issueDateTime) {
            this.issueDateTime = issueDateTime;
            return this;
        }

        public Builder currency(String currency) {
            this.currency = currency;
            return this;
        }

        public Builder typeCode(InvoiceTypeCode typeCode) {
            this.typeCode = typeCode;
            return this;
        }

        public Builder seller(Party seller) {
            this.seller = seller;
            return this;
        }

        public Builder lineItems(List<InvoiceLineItem> lineItems) {
            this.lineItems = new ArrayList<>(lineItems);
            return this;
        }

        public Builder addLineItem(InvoiceLineItem lineItem) {
            this.lineItems.add(lineItem);
            return this;
        }

        public Builder billingReference(BillingReference billingReference) {
            this.billingReference = billingReference;
            return this;
        }

        public Builder chainPosition(ChainPosition chainPosition) {
            this.chainPosition = chainPosition;
            return this;
        }

        public SimplifiedInvoiceData build() {
            return new SimplifiedInvoiceData(this);
        }
    }
}
