package com.zatca.fatoora.model;

/**
 * UNTDID 1001 document type codes accepted by the platform
 */
public enum InvoiceTypeCode {
    TAX_INVOICE("388", "Tax Invoice"),
    CREDIT_NOTE("381", "Credit Note"),
    DEBIT_NOTE("383", "Debit Note");

    private final String code;
    private final String displayName;

    InvoiceTypeCode(String code, String displayName) {
        this.code = code;
        this.displayName = displayName;
    }

    public String getCode() {
        return code;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Credit and debit notes amend an earlier invoice and must reference it.
     */
    public boolean isAmendment() {
        return this != TAX_INVOICE;
    }

    public static InvoiceTypeCode fromCode(String code) {
        for (InvoiceTypeCode type : values()) {
            if (type.code.equals(code)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown invoice type code: " + code);
    }
}
