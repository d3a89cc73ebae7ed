package com.zatca.fatoora.model;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Objects;

/**
 * One invoice line. Amounts are derived: line total is
 * {@code quantity * unitPrice}, VAT is {@code lineTotal * vatRate / 100},
 * both rounded half-up to two decimals.
 */
public final class InvoiceLineItem {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final String name;
    private final BigDecimal quantity;
    private final BigDecimal unitPrice;
    private final BigDecimal vatRate;

    public InvoiceLineItem(String name, BigDecimal quantity, BigDecimal unitPrice, BigDecimal vatRate) {
        this.name = name;
        this.quantity = Objects.requireNonNull(quantity, "quantity");
        this.unitPrice = Objects.requireNonNull(unitPrice, "unitPrice");
        this.vatRate = Objects.requireNonNull(vatRate, "vatRate");
    }

    public static InvoiceLineItem of(String name, double quantity, double unitPrice, double vatRate) {
        return new InvoiceLineItem(name, BigDecimal.valueOf(quantity), BigDecimal.valueOf(unitPrice),
            BigDecimal.valueOf(vatRate));
    }

    public String getName() {
        return name;
    }

    public BigDecimal getQuantity() {
        return quantity;
    }

    public BigDecimal getUnitPrice() {
        return unitPrice;
    }

    public BigDecimal getVatRate() {
        return vatRate;
    }

    public BigDecimal getLineExtensionAmount() {
        return quantity.multiply(unitPrice).setScale(2, RoundingMode.HALF_UP);
    }

    public BigDecimal getTaxAmount() {
        return getLineExtensionAmount().multiply(vatRate).divide(HUNDRED, 2, RoundingMode.HALF_UP);
    }

    public BigDecimal getAmountInclusive() {
        return getLineExtensionAmount().add(getTaxAmount());
    }

    public VatCategory getVatCategory() {
        return VatCategory.forRate(vatRate);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        InvoiceLineItem that = (InvoiceLineItem) o;
        return Objects.equals(name, that.name)
            && quantity.compareTo(that.quantity) == 0
            && unitPrice.compareTo(that.unitPrice) == 0
            && vatRate.compareTo(that.vatRate) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, quantity.stripTrailingZeros(), unitPrice.stripTrailingZeros(),
            vatRate.stripTrailingZeros());
    }

    @Override
    public String toString() {
        return "InvoiceLineItem{name='" + name + "', quantity=" + quantity
            + ", unitPrice=" + unitPrice + ", vatRate=" + vatRate + '}';
    }
}
