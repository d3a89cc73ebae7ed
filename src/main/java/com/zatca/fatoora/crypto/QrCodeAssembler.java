package com.zatca.fatoora.crypto;

import com.zatca.fatoora.exception.TlvEncodingException;
import com.zatca.fatoora.tlv.QrTag;
import com.zatca.fatoora.tlv.TlvCodec;
import com.zatca.fatoora.tlv.TlvRecord;

import java.util.ArrayList;
import java.util.Base64;
import java.util.List;

/**
 * Builds QR payloads: base64 of TLV records in fixed tag order.
 * Tags 1-5 are UTF-8 text; tags 6, 7 and 9 are the raw bytes behind their
 * base64 input; tag 8 is the public key text in UTF-8.
 */
public final class QrCodeAssembler {

    private QrCodeAssembler() {
    }

    /**
     * Basic payload, tags 1 to 5.
     */
    public static String assembleBasic(String sellerName, String vatNumber, String timestamp,
                                       String total, String vatTotal) {
        return TlvCodec.encodeSequence(basicRecords(sellerName, vatNumber, timestamp, total, vatTotal));
    }

    /**
     * Phase-2 payload, tags 1 to 9 in that order.
     *
     * @param invoiceHash base64 SHA-256 of the invoice XML
     * @param signature base64 ECDSA signature of the hash
     * @param publicKey public key text (base64 SubjectPublicKeyInfo)
     * @param certificateSignature base64 signature of the CSID certificate
     * @throws TlvEncodingException if a field exceeds 255 bytes or a binary field is not base64
     */
    public static String assemblePhase2(String sellerName, String vatNumber, String timestamp,
                                        String total, String vatTotal, String invoiceHash,
                                        String signature, String publicKey, String certificateSignature) {
        List<TlvRecord> records = basicRecords(sellerName, vatNumber, timestamp, total, vatTotal);
        records.add(TlvRecord.of(QrTag.INVOICE_HASH, decodeBinary(QrTag.INVOICE_HASH, invoiceHash)));
        records.add(TlvRecord.of(QrTag.SIGNATURE, decodeBinary(QrTag.SIGNATURE, signature)));
        records.add(TlvRecord.of(QrTag.PUBLIC_KEY, publicKey));
        records.add(TlvRecord.of(QrTag.CERTIFICATE_SIGNATURE,
            decodeBinary(QrTag.CERTIFICATE_SIGNATURE, certificateSignature)));
        return TlvCodec.encodeSequence(records);
    }

    private static List<TlvRecord> basicRecords(String sellerName, String vatNumber, String timestamp,
                                                String total, String vatTotal) {
        List<TlvRecord> records = new ArrayList<>(9);
        records.add(TlvRecord.of(QrTag.SELLER_NAME, sellerName));
        records.add(TlvRecord.of(QrTag.VAT_NUMBER, vatNumber));
        records.add(TlvRecord.of(QrTag.TIMESTAMP, timestamp));
        records.add(TlvRecord.of(QrTag.INVOICE_TOTAL, total));
        records.add(TlvRecord.of(QrTag.VAT_TOTAL, vatTotal));
        return records;
    }

    private static byte[] decodeBinary(QrTag tag, String base64) {
        if (base64 == null) {
            return new byte[0];
        }
        try {
            return Base64.getDecoder().decode(base64);
        } catch (IllegalArgumentException e) {
            throw new TlvEncodingException(
                "QR field " + tag + " is not valid base64", TlvEncodingException.INVALID_VALUE, tag.getTag(), e);
        }
    }
}
