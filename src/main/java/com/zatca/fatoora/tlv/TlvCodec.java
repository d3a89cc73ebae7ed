package com.zatca.fatoora.tlv;

import com.zatca.fatoora.exception.TlvEncodingException;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Collections;
import java.util.List;

/**
 * Stateless encoder/decoder for one-byte-tag, one-byte-length TLV records.
 *
 * <p>Values longer than {@link #MAX_VALUE_LENGTH} bytes cannot be represented
 * in the length byte and are rejected with {@link TlvEncodingException}.
 */
public final class TlvCodec {

    public static final int MAX_VALUE_LENGTH = 255;
    public static final int MAX_TAG = 255;

    private TlvCodec() {
    }

    /**
     * Encode one record: tag byte, length byte, value bytes.
     *
     * @param tag tag in 1..255
     * @param value raw value, at most 255 bytes
     * @return encoded record
     * @throws TlvEncodingException if the tag or value does not fit in one byte
     */
    public static byte[] encode(int tag, byte[] value) {
        if (tag < 1 || tag > MAX_TAG) {
            throw new TlvEncodingException("TLV tag must be between 1 and " + MAX_TAG + ": " + tag,
                TlvEncodingException.INVALID_TAG, tag);
        }
        byte[] bytes = value == null ? new byte[0] : value;
        if (bytes.length > MAX_VALUE_LENGTH) {
            throw TlvEncodingException.valueTooLong(tag, bytes.length, MAX_VALUE_LENGTH);
        }

        byte[] result = new byte[bytes.length + 2];
        result[0] = (byte) tag;
        result[1] = (byte) bytes.length;
        System.arraycopy(bytes, 0, result, 2, bytes.length);
        return result;
    }

    public static byte[] encode(int tag, String value) {
        return encode(tag, value == null ? new byte[0] : value.getBytes(StandardCharsets.UTF_8));
    }

    public static byte[] encode(TlvRecord record) {
        return encode(record.getTag(), record.getValue());
    }

    /**
     * Concatenate the encoded records in the given order.
     */
    public static byte[] encodeAll(List<TlvRecord> records) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (TlvRecord record : records) {
            byte[] encoded = encode(record);
            out.write(encoded, 0, encoded.length);
        }
        return out.toByteArray();
    }

    /**
     * Concatenate the records and base64-encode the result (QR payload form).
     */
    public static String encodeSequence(List<TlvRecord> records) {
        return Base64.getEncoder().encodeToString(encodeAll(records));
    }

    /**
     * Decode exactly one record.
     *
     * @throws TlvEncodingException if the input is truncated or has trailing bytes
     */
    public static TlvRecord decode(byte[] encoded) {
        List<TlvRecord> records = decodeAll(encoded);
        if (records.size() != 1) {
            throw new TlvEncodingException("Expected exactly one TLV record but found " + records.size(),
                TlvEncodingException.TRUNCATED, records.isEmpty() ? 0 : records.get(0).getTag());
        }
        return records.get(0);
    }

    /**
     * Decode a concatenated record sequence.
     */
    public static List<TlvRecord> decodeAll(byte[] encoded) {
        if (encoded == null || encoded.length == 0) {
            return Collections.emptyList();
        }

        List<TlvRecord> records = new ArrayList<>();
        int offset = 0;
        while (offset < encoded.length) {
            int tag = encoded[offset] & 0xFF;
            if (offset + 1 >= encoded.length) {
                throw new TlvEncodingException("TLV record for tag " + tag + " is missing its length byte",
                    TlvEncodingException.TRUNCATED, tag);
            }
            int length = encoded[offset + 1] & 0xFF;
            int start = offset + 2;
            if (start + length > encoded.length) {
                throw new TlvEncodingException(
                    String.format("TLV record for tag %d declares %d bytes but only %d remain",
                        tag, length, encoded.length - start),
                    TlvEncodingException.TRUNCATED, tag);
            }
            byte[] value = new byte[length];
            System.arraycopy(encoded, start, value, 0, length);
            records.add(new TlvRecord(tag, value));
            offset = start + length;
        }
        return records;
    }

    /**
     * Decode a base64 QR payload back into its records.
     */
    public static List<TlvRecord> decodeSequence(String base64) {
        return decodeAll(Base64.getDecoder().decode(base64));
    }
}
