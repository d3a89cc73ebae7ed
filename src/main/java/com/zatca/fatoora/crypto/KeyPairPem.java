package com.zatca.fatoora.crypto;

import java.util.Objects;

/**
 * PEM-encoded EC key pair: PKCS#8 private key and X.509 SubjectPublicKeyInfo
 * public key.
 */
public final class KeyPairPem {

    private final String privateKeyPem;
    private final String publicKeyPem;

    public KeyPairPem(String privateKeyPem, String publicKeyPem) {
        this.privateKeyPem = Objects.requireNonNull(privateKeyPem, "privateKeyPem");
        this.publicKeyPem = Objects.requireNonNull(publicKeyPem, "publicKeyPem");
    }

    public String getPrivateKeyPem() {
        return privateKeyPem;
    }

    public String getPublicKeyPem() {
        return publicKeyPem;
    }

    /**
     * Public key body without PEM armor, as carried in QR tag 8
     */
    public String getPublicKeyBase64() {
        return publicKeyPem
            .replaceAll("-----BEGIN[^-]*-----", "")
            .replaceAll("-----END[^-]*-----", "")
            .replaceAll("\\s", "");
    }

    @Override
    public String toString() {
        return "KeyPairPem{privateKeyPem=[REDACTED], publicKeyPem='" + getPublicKeyBase64() + "'}";
    }
}
