package com.zatca.fatoora.tlv;

/**
 * QR payload tags. Tags 1-5 form the basic payload; Phase-2 adds 6-9.
 * The numeric order is part of the regulator contract.
 */
public enum QrTag {
    SELLER_NAME(1),
    VAT_NUMBER(2),
    TIMESTAMP(3),
    INVOICE_TOTAL(4),
    VAT_TOTAL(5),
    INVOICE_HASH(6),
    SIGNATURE(7),
    PUBLIC_KEY(8),
    CERTIFICATE_SIGNATURE(9);

    private final int tag;

    QrTag(int tag) {
        this.tag = tag;
    }

    public int getTag() {
        return tag;
    }

    public static QrTag fromTag(int tag) {
        for (QrTag qrTag : values()) {
            if (qrTag.tag == tag) {
                return qrTag;
            }
        }
        throw new IllegalArgumentException("Unknown QR tag: " + tag);
    }
}
