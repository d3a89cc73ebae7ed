package com.zatca.fatoora.model;

import java.math.BigDecimal;

/**
 * VAT category code derived from the line's rate.
 */
public enum VatCategory {
    /** Zero-rated */
    Z,
    /** Standard rate */
    S;

    /**
     * 0% maps to {@link #Z}, any other rate to {@link #S}.
     */
    public static VatCategory forRate(BigDecimal vatRate) {
        return vatRate.signum() == 0 ? Z : S;
    }

    public String getCode() {
        return name();
    }
}
