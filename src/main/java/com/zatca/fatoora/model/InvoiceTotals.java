package com.zatca.fatoora.model;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

/**
 * Document-level monetary totals, summed from rounded line amounts.
 */
public final class InvoiceTotals {

    private final BigDecimal lineExtensionAmount;
    private final BigDecimal taxAmount;

    private InvoiceTotals(BigDecimal lineExtensionAmount, BigDecimal taxAmount) {
        this.lineExtensionAmount = lineExtensionAmount;
        this.taxAmount = taxAmount;
    }

    public static InvoiceTotals calculate(List<InvoiceLineItem> lineItems) {
        BigDecimal lineExtension = BigDecimal.ZERO.setScale(2, RoundingMode.HALF_UP);
        BigDecimal tax = BigDecimal.ZERO.setScale(2, RoundingMode.HALF_UP);
        for (InvoiceLineItem item : lineItems) {
            lineExtension = lineExtension.add(item.getLineExtensionAmount());
            tax = tax.add(item.getTaxAmount());
        }
        return new InvoiceTotals(lineExtension, tax);
    }

    public BigDecimal getLineExtensionAmount() {
        return lineExtensionAmount;
    }

    /** No document-level allowances or charges, so equal to the line extension */
    public BigDecimal getTaxExclusiveAmount() {
        return lineExtensionAmount;
    }

    public BigDecimal getTaxAmount() {
        return taxAmount;
    }

    public BigDecimal getTaxInclusiveAmount() {
        return lineExtensionAmount.add(taxAmount);
    }

    public BigDecimal getPayableAmount() {
        return getTaxInclusiveAmount();
    }

    @Override
    public String toString() {
        return "InvoiceTotals{lineExtension=" + lineExtensionAmount + ", tax=" + taxAmount
            + ", taxInclusive=" + getTaxInclusiveAmount() + '}';
    }
}
