package com.zatca.fatoora;

import com.zatca.fatoora.crypto.CertificateManager;
import com.zatca.fatoora.crypto.KeyPairPem;

import java.util.Objects;

/**
 * Key material an EGS unit signs with: its EC key pair and the signature
 * of the CSID certificate issued for that key (QR tag 9).
 */
public final class SigningIdentity {

    private final KeyPairPem keyPair;
    private final String certificateSignature;

    public SigningIdentity(KeyPairPem keyPair, String certificateSignature) {
        this.keyPair = Objects.requireNonNull(keyPair, "keyPair");
        this.certificateSignature = Objects.requireNonNull(certificateSignature, "certificateSignature");
    }

    /**
     * @param certificate issued certificate as PEM, base64 DER or binary security token
     */
    public static SigningIdentity fromCertificate(KeyPairPem keyPair, String certificate) {
        return new SigningIdentity(keyPair, CertificateManager.extractCertificateSignature(certificate));
    }

    public KeyPairPem getKeyPair() {
        return keyPair;
    }

    public String getCertificateSignature() {
        return certificateSignature;
    }
}
