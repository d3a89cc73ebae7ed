package com.zatca.fatoora.exception;

/**
 * Raised when a TLV record cannot be encoded or decoded.
 */
public class TlvEncodingException extends ValidationException {

    public static final String VALUE_TOO_LONG = "TLV01";
    public static final String INVALID_TAG = "TLV02";
    public static final String TRUNCATED = "TLV03";
    public static final String INVALID_VALUE = "TLV04";

    private final int tag;

    public TlvEncodingException(String message, String code, int tag) {
        this(message, code, tag, null);
    }

    public TlvEncodingException(String message, String code, int tag, Throwable cause) {
        super(message, code, "tag" + tag, cause);
        this.tag = tag;
    }

    public int getTag() {
        return tag;
    }

    public static TlvEncodingException valueTooLong(int tag, int length, int max) {
        return new TlvEncodingException(
            String.format("TLV value for tag %d is %d bytes; the 1-byte length field allows at most %d",
                tag, length, max),
            VALUE_TOO_LONG,
            tag
        );
    }
}
