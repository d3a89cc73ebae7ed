package com.zatca.fatoora.crypto;

import com.zatca.fatoora.exception.FatooraException;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Base64;

/**
 * SHA-256 invoice hashing. Hashes are base64 of the raw 32-byte digest.
 */
public final class InvoiceHashService {

    private static final String HASH_ALGORITHM = "SHA-256";

    /**
     * Previous-invoice hash of the first invoice in every chain: {@code hash("0")}.
     */
    public static final String INITIAL_HASH = hash("0");

    private InvoiceHashService() {
    }

    public static String hash(byte[] data) {
        return Base64.getEncoder().encodeToString(digest(data));
    }

    /**
     * Hash the UTF-8 bytes of {@code data}, typically serialized invoice XML.
     */
    public static String hash(String data) {
        return hash(data.getBytes(StandardCharsets.UTF_8));
    }

    public static byte[] digest(byte[] data) {
        try {
            return MessageDigest.getInstance(HASH_ALGORITHM).digest(data);
        } catch (NoSuchAlgorithmException e) {
            throw new FatooraException("SHA-256 not available", "CRYPTO20", e);
        }
    }
}
