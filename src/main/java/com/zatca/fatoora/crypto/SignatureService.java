package com.zatca.fatoora.crypto;

import com.zatca.fatoora.exception.FatooraException;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.Signature;
import java.security.cert.X509Certificate;
import java.security.spec.PKCS8EncodedKeySpec;
import java.security.spec.X509EncodedKeySpec;
import java.util.Base64;

/**
 * ECDSA signing of invoice hashes
 * 
 * <p>Signatures are SHA256withECDSA over the supplied bytes, DER encoded and
 * returned as base64. Keys are EC keys on the configured curve, loaded from
 * PEM through the Bouncy Castle provider.
 * 
 * <p>Example usage:
 * <pre>{@code
 * SignatureService service = SignatureService.builder()
 *     .privateKey(keyPair.getPrivateKeyPem())
 *     .publicKey(keyPair.getPublicKeyPem())
 *     .build();
 * 
 * String signature = service.signInvoiceHash(invoiceHash);
 * boolean valid = service.verifyInvoiceHash(invoiceHash, signature);
 * }</pre>
 */
public class SignatureService {
    
    public static final String SIGNATURE_ALGORITHM = "SHA256withECDSA";
    static final String KEY_ALGORITHM = "EC";
    
    private final PrivateKey privateKey;
    private final PublicKey publicKey;
    
    private SignatureService(Builder builder) {
        CryptoProviders.ensureBouncyCastle();
        this.privateKey = builder.privateKey != null ? loadPrivateKey(builder.privateKey) : null;
        this.publicKey = builder.publicKey != null ? loadPublicKey(builder.publicKey) : null;
    }
    
    public static Builder builder() {
        return new Builder();
    }
    
    public static SignatureService forPrivateKey(String privateKeyPem) {
        return builder().privateKey(privateKeyPem).build();
    }
    
    /**
     * Parse a PKCS#8 EC private key from PEM or bare base64
     * 
     * @throws FatooraException with code CRYPTO30 on malformed key material
     */
    public static PrivateKey loadPrivateKey(String keyPem) {
        try {
            CryptoProviders.ensureBouncyCastle();
            byte[] keyBytes = PemSupport.decode(keyPem);
            KeyFactory keyFactory = KeyFactory.getInstance(KEY_ALGORITHM, CryptoProviders.BOUNCY_CASTLE);
            return keyFactory.generatePrivate(new PKCS8EncodedKeySpec(keyBytes));
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            throw new FatooraException("Failed to load private key: " + e.getMessage(), "CRYPTO30", e);
        }
    }
    
    /**
     * Parse an EC public key from a PUBLIC KEY PEM, bare base64, or a
     * certificate PEM
     * 
     * @throws FatooraException with code CRYPTO31 on malformed key material
     */
    public static PublicKey loadPublicKey(String keyOrCertPem) {
        try {
            CryptoProviders.ensureBouncyCastle();
            if (keyOrCertPem.contains("CERTIFICATE")) {
                X509Certificate certificate = CertificateManager.parseCertificate(keyOrCertPem);
                return certificate.getPublicKey();
            }
            byte[] keyBytes = PemSupport.decode(keyOrCertPem);
            KeyFactory keyFactory = KeyFactory.getInstance(KEY_ALGORITHM, CryptoProviders.BOUNCY_CASTLE);
            return keyFactory.generatePublic(new X509EncodedKeySpec(keyBytes));
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            throw new FatooraException("Failed to load public key: " + e.getMessage(), "CRYPTO31", e);
        }
    }
    
    /**
     * Sign raw bytes
     * 
     * @return base64 DER signature
     * @throws FatooraException if no private key is loaded or signing fails
     */
    public String sign(byte[] data) {
        if (privateKey == null) {
            throw new FatooraException("Private key not loaded", "CRYPTO32");
        }
        
        try {
            Signature signer = Signature.getInstance(SIGNATURE_ALGORITHM, CryptoProviders.BOUNCY_CASTLE);
            signer.initSign(privateKey);
            signer.update(data);
            return Base64.getEncoder().encodeToString(signer.sign());
        } catch (GeneralSecurityException e) {
            throw new FatooraException("Failed to sign data: " + e.getMessage(), "CRYPTO33", e);
        }
    }
    
    public String sign(String data) {
        return sign(data.getBytes(StandardCharsets.UTF_8));
    }
    
    /**
     * Sign an invoice hash. The signed bytes are the decoded 32-byte digest,
     * not its base64 text.
     * 
     * @param invoiceHash base64 SHA-256 digest of the invoice XML
     * @return base64 signature, as carried in QR tag 7
     */
    public String signInvoiceHash(String invoiceHash) {
        return sign(decodeHash(invoiceHash));
    }
    
    public boolean verify(byte[] data, String signature) {
        if (publicKey == null) {
            throw new FatooraException("Public key not loaded for verification", "CRYPTO34");
        }
        
        try {
            Signature verifier = Signature.getInstance(SIGNATURE_ALGORITHM, CryptoProviders.BOUNCY_CASTLE);
            verifier.initVerify(publicKey);
            verifier.update(data);
            return verifier.verify(Base64.getDecoder().decode(signature));
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            // A malformed signature does not verify
            return false;
        }
    }
    
    public boolean verify(String data, String signature) {
        return verify(data.getBytes(StandardCharsets.UTF_8), signature);
    }
    
    public boolean verifyInvoiceHash(String invoiceHash, String signature) {
        return verify(decodeHash(invoiceHash), signature);
    }
    
    public boolean hasPrivateKey() {
        return privateKey != null;
    }
    
    public boolean hasPublicKey() {
        return publicKey != null;
    }
    
    private static byte[] decodeHash(String invoiceHash) {
        try {
            return Base64.getDecoder().decode(invoiceHash);
        } catch (IllegalArgumentException e) {
            throw new FatooraException("Invoice hash is not valid base64", "CRYPTO35", e);
        }
    }
    
    /**
     * Builder for SignatureService
     */
    public static class Builder {
        private String privateKey;
        private String publicKey;
        
        /**
         * @param privateKeyPem PKCS#8 EC private key in PEM format
         */
        public Builder privateKey(String privateKeyPem) {
            this.privateKey = privateKeyPem;
            return this;
        }
        
        /**
         * @param publicKeyPem public key or certificate in PEM format
         */
        public Builder publicKey(String publicKeyPem) {
            this.publicKey = publicKeyPem;
            return this;
        }
        
        public SignatureService build() {
            return new SignatureService(this);
        }
    }
}
