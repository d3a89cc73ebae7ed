package com.zatca.fatoora.tlv;

import com.zatca.fatoora.exception.TlvEncodingException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TlvCodecTest {

    @Nested
    @DisplayName("encode")
    class Encode {

        @Test
        @DisplayName("should write tag, length and value bytes")
        void shouldWriteTagLengthValue() {
            byte[] encoded = TlvCodec.encode(1, "Acme");

            assertArrayEquals(new byte[]{1, 4, 'A', 'c', 'm', 'e'}, encoded);
        }

        @Test
        @DisplayName("should count UTF-8 bytes, not characters")
        void shouldCountUtf8Bytes() {
            String arabic = "شركة";
            byte[] encoded = TlvCodec.encode(1, arabic);

            assertEquals(arabic.getBytes(StandardCharsets.UTF_8).length, encoded[1] & 0xFF);
            assertEquals(8, encoded[1]);
        }

        @Test
        @DisplayName("should accept a value of exactly 255 bytes")
        void shouldAcceptMaximumLength() {
            byte[] value = new byte[255];
            Arrays.fill(value, (byte) 'x');

            byte[] encoded = TlvCodec.encode(2, value);

            assertEquals(257, encoded.length);
            assertEquals(255, encoded[1] & 0xFF);
        }

        @Test
        @DisplayName("should fail on a value over 255 bytes instead of truncating")
        void shouldFailOnLongValue() {
            String value = "a".repeat(256);

            TlvEncodingException e = assertThrows(TlvEncodingException.class, () -> TlvCodec.encode(1, value));

            assertEquals(TlvEncodingException.VALUE_TOO_LONG, e.getCode());
            assertEquals(1, e.getTag());
        }

        @Test
        @DisplayName("should reject tags outside 1..255")
        void shouldRejectInvalidTag() {
            TlvEncodingException zero = assertThrows(TlvEncodingException.class, () -> TlvCodec.encode(0, "x"));
            assertEquals(TlvEncodingException.INVALID_TAG, zero.getCode());

            assertThrows(TlvEncodingException.class, () -> TlvCodec.encode(256, "x"));
        }

        @Test
        @DisplayName("should encode an empty value with length zero")
        void shouldEncodeEmptyValue() {
            assertArrayEquals(new byte[]{3, 0}, TlvCodec.encode(3, (String) null));
        }
    }

    @Nested
    @DisplayName("decode")
    class Decode {

        @Test
        @DisplayName("should return the original tag and value")
        void shouldRoundTrip() {
            TlvRecord record = TlvCodec.decode(TlvCodec.encode(5, "15.00"));

            assertEquals(5, record.getTag());
            assertEquals("15.00", record.getValueAsString());
        }

        @Test
        @DisplayName("should split a sequence in order")
        void shouldDecodeSequence() {
            List<TlvRecord> records = List.of(
                TlvRecord.of(QrTag.SELLER_NAME, "Acme"),
                TlvRecord.of(QrTag.VAT_NUMBER, "300000000000003"),
                TlvRecord.of(QrTag.INVOICE_HASH, new byte[]{(byte) 0xFF, 0, 1}));

            List<TlvRecord> decoded = TlvCodec.decodeSequence(TlvCodec.encodeSequence(records));

            assertEquals(records, decoded);
        }

        @Test
        @DisplayName("should fail on a truncated value")
        void shouldFailOnTruncatedValue() {
            byte[] truncated = {1, 5, 'a', 'b'};

            TlvEncodingException e = assertThrows(TlvEncodingException.class, () -> TlvCodec.decodeAll(truncated));
            assertEquals(TlvEncodingException.TRUNCATED, e.getCode());
        }

        @Test
        @DisplayName("should fail on a missing length byte")
        void shouldFailOnMissingLength() {
            assertThrows(TlvEncodingException.class, () -> TlvCodec.decodeAll(new byte[]{1, 1, 'a', 2}));
        }

        @Test
        @DisplayName("should require exactly one record in decode")
        void shouldRequireSingleRecord() {
            byte[] two = TlvCodec.encodeAll(List.of(TlvRecord.of(1, "a"), TlvRecord.of(2, "b")));

            assertThrows(TlvEncodingException.class, () -> TlvCodec.decode(two));
        }
    }

    @Test
    @DisplayName("should map QR tags to their numbers")
    void shouldMapQrTags() {
        assertEquals(9, QrTag.CERTIFICATE_SIGNATURE.getTag());
        assertEquals(QrTag.PUBLIC_KEY, QrTag.fromTag(8));
        assertThrows(IllegalArgumentException.class, () -> QrTag.fromTag(10));
    }
}
