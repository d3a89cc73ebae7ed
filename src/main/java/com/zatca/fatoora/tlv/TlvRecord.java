package com.zatca.fatoora.tlv;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * A single tag-length-value record. The length is implied by the value and
 * written as one byte on encoding.
 */
public final class TlvRecord {

    private final int tag;
    private final byte[] value;

    public TlvRecord(int tag, byte[] value) {
        this.tag = tag;
        this.value = value == null ? new byte[0] : value.clone();
    }

    public static TlvRecord of(int tag, String value) {
        return new TlvRecord(tag, value == null ? new byte[0] : value.getBytes(StandardCharsets.UTF_8));
    }

    public static TlvRecord of(QrTag tag, String value) {
        return of(tag.getTag(), value);
    }

    public static TlvRecord of(QrTag tag, byte[] value) {
        return new TlvRecord(tag.getTag(), value);
    }

    public int getTag() {
        return tag;
    }

    public byte[] getValue() {
        return value.clone();
    }

    public int getLength() {
        return value.length;
    }

    /**
     * Value decoded as UTF-8 text (tags 1-5 and 8)
     */
    public String getValueAsString() {
        return new String(value, StandardCharsets.UTF_8);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TlvRecord that = (TlvRecord) o;
        return tag == that.tag && Arrays.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return 31 * tag + Arrays.hashCode(value);
    }

    @Override
    public String toString() {
        return "TlvRecord{tag=" + tag + ", length=" + value.length + '}';
    }
}
