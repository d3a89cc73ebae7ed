package com.zatca.fatoora.crypto;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * PEM armor helpers. Bodies are wrapped at 64 characters.
 */
final class PemSupport {

    private PemSupport() {
    }

    static String encode(byte[] der, String type) {
        String base64 = Base64.getEncoder().encodeToString(der);
        StringBuilder pem = new StringBuilder();
        pem.append("-----BEGIN ").append(type).append("-----\n");
        for (int i = 0; i < base64.length(); i += 64) {
            pem.append(base64, i, Math.min(i + 64, base64.length())).append('\n');
        }
        pem.append("-----END ").append(type).append("-----\n");
        return pem.toString();
    }

    /**
     * Strip PEM armor and whitespace and decode the body. Input without
     * armor is treated as plain base64.
     */
    static byte[] decode(String pemOrBase64) {
        String base64 = pemOrBase64
            .replaceAll("-----BEGIN[^-]*-----", "")
            .replaceAll("-----END[^-]*-----", "")
            .replaceAll("\\s", "");
        return Base64.getDecoder().decode(base64);
    }

    static boolean isPem(String value) {
        return value.contains("-----BEGIN");
    }

    static String toBase64Text(String text) {
        return Base64.getEncoder().encodeToString(text.getBytes(StandardCharsets.UTF_8));
    }
}
