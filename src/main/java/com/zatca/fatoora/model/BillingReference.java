package com.zatca.fatoora.model;

import java.util.Objects;

/**
 * Reference from a credit or debit note to the invoice it amends
 */
public final class BillingReference {

    private final String invoiceNumber;

    public BillingReference(String invoiceNumber) {
        this.invoiceNumber = Objects.requireNonNull(invoiceNumber, "invoiceNumber");
    }

    public String getInvoiceNumber() {
        return invoiceNumber;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return invoiceNumber.equals(((BillingReference) o).invoiceNumber);
    }

    @Override
    public int hashCode() {
        return invoiceNumber.hashCode();
    }
}
