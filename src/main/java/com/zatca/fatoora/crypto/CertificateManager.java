package com.zatca.fatoora.crypto;

import com.zatca.fatoora.config.FatooraConfig;
import com.zatca.fatoora.config.FatooraConfigConstants;
import com.zatca.fatoora.config.FatooraEnvironment;
import com.zatca.fatoora.exception.FatooraException;
import org.bouncycastle.asn1.ASN1ObjectIdentifier;
import org.bouncycastle.asn1.DERPrintableString;
import org.bouncycastle.asn1.pkcs.PKCSObjectIdentifiers;
import org.bouncycastle.asn1.x500.X500Name;
import org.bouncycastle.asn1.x500.X500NameBuilder;
import org.bouncycastle.asn1.x500.style.BCStyle;
import org.bouncycastle.asn1.x509.Extension;
import org.bouncycastle.asn1.x509.ExtensionsGenerator;
import org.bouncycastle.asn1.x509.GeneralName;
import org.bouncycastle.asn1.x509.GeneralNames;
import org.bouncycastle.pkcs.PKCS10CertificationRequest;
import org.bouncycastle.pkcs.jcajce.JcaPKCS10CertificationRequestBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.cert.CertificateFactory;
import java.security.cert.X509Certificate;
import java.security.spec.ECGenParameterSpec;
import java.util.Base64;

/**
 * EC key and certificate handling for Fatoora onboarding.
 *
 * <p>Handles key pair generation on the configured curve, CSR generation
 * for the Compliance CSID request, and reading the signature out of an
 * issued certificate for QR tag 9.
 *
 * <p>Example usage:
 * <pre>{@code
 * CertificateManager manager = new CertificateManager(config);
 * KeyPairPem keyPair = manager.generateKeyPair();
 * String csr = manager.generateCsr(CsrConfig.builder()
 *     .commonName("EGS1-886431145")
 *     .serialNumber("1-Fatoora|2-EGS|3-886431145")
 *     .organizationName("Maximum Speed Tech Supply LTD")
 *     .countryName("SA")
 *     .invoiceType("1100")
 *     .location("Riyadh")
 *     .industry("Supply activities")
 *     .build(), keyPair);
 * }</pre>
 */
public class CertificateManager {

    private static final Logger logger = LoggerFactory.getLogger(CertificateManager.class);

    /** Microsoft certificate template name extension */
    public static final ASN1ObjectIdentifier CERTIFICATE_TEMPLATE_NAME =
        new ASN1ObjectIdentifier("1.3.6.1.4.1.311.20.2");

    /** X.520 registeredAddress */
    public static final ASN1ObjectIdentifier REGISTERED_ADDRESS = new ASN1ObjectIdentifier("2.5.4.26");

    private static final String KEY_ALGORITHM = "EC";

    private final String curveName;
    private final FatooraEnvironment environment;

    public CertificateManager(FatooraConfig config) {
        this(config.getSigningCurve(), config.getEnvironment());
    }

    /**
     * @param curveName EC named curve, e.g. {@code secp256k1}
     * @param environment decides the certificate template requested in CSRs
     */
    public CertificateManager(String curveName, FatooraEnvironment environment) {
        this.curveName = curveName;
        this.environment = environment;
        CryptoProviders.ensureBouncyCastle();
    }

    /**
     * Generate a new EC key pair on the configured curve.
     *
     * @return PEM-encoded key pair
     * @throws FatooraException if the curve is unknown
     */
    public KeyPairPem generateKeyPair() {
        try {
            KeyPairGenerator generator = KeyPairGenerator.getInstance(KEY_ALGORITHM, CryptoProviders.BOUNCY_CASTLE);
            generator.initialize(new ECGenParameterSpec(curveName));
            KeyPair keyPair = generator.generateKeyPair();

            logger.debug("Generated EC key pair on curve {}", curveName);
            return new KeyPairPem(
                PemSupport.encode(keyPair.getPrivate().getEncoded(), "PRIVATE KEY"),
                PemSupport.encode(keyPair.getPublic().getEncoded(), "PUBLIC KEY")
            );
        } catch (GeneralSecurityException e) {
            throw new FatooraException(
                "Failed to generate key pair on curve " + curveName + ": " + e.getMessage(),
                "CRYPTO05",
                e
            );
        }
    }

    /**
     * Generate a PKCS#10 CSR for a Compliance CSID request.
     *
     * <p>The signature uses deterministic ECDSA, so the same key pair and
     * config always give the same output.
     *
     * @param config CSR subject data
     * @param keyPair key pair whose public key is certified
     * @return base64 of the PEM text, as sent in the {@code csr} request field
     * @throws com.zatca.fatoora.exception.ValidationException if a mandatory field is missing
     * @throws FatooraException if the key material is malformed
     */
    public String generateCsr(CsrConfig config, KeyPairPem keyPair) {
        return PemSupport.toBase64Text(generateCsrPem(config, keyPair));
    }

    /**
     * Same as {@link #generateCsr} but returns the PEM text itself.
     */
    public String generateCsrPem(CsrConfig config, KeyPairPem keyPair) {
        config.validate();

        PrivateKey privateKey = SignatureService.loadPrivateKey(keyPair.getPrivateKeyPem());
        PublicKey publicKey = SignatureService.loadPublicKey(keyPair.getPublicKeyPem());

        try {
            JcaPKCS10CertificationRequestBuilder csrBuilder =
                new JcaPKCS10CertificationRequestBuilder(buildSubject(config), publicKey);

            ExtensionsGenerator extGen = new ExtensionsGenerator();
            extGen.addExtension(CERTIFICATE_TEMPLATE_NAME, false,
                new DERPrintableString(FatooraConfigConstants.getCertificateTemplate(environment)));
            GeneralNames sans = new GeneralNames(
                new GeneralName(GeneralName.directoryName, buildAlternativeName(config)));
            extGen.addExtension(Extension.subjectAlternativeName, false, sans);
            csrBuilder.addAttribute(PKCSObjectIdentifiers.pkcs_9_at_extensionRequest, extGen.generate());

            PKCS10CertificationRequest csr = csrBuilder.build(new DeterministicEcdsaContentSigner(privateKey));
            return PemSupport.encode(csr.getEncoded(), "CERTIFICATE REQUEST");
        } catch (IOException e) {
            throw new FatooraException("Failed to generate CSR: " + e.getMessage(), "CRYPTO09", e);
        }
    }

    private X500Name buildSubject(CsrConfig config) {
        X500NameBuilder subject = new X500NameBuilder(BCStyle.INSTANCE);
        subject.addRDN(BCStyle.C, config.getCountryName());
        if (config.hasOrganizationUnitName()) {
            subject.addRDN(BCStyle.OU, config.getOrganizationUnitName());
        }
        subject.addRDN(BCStyle.O, config.getOrganizationName());
        subject.addRDN(BCStyle.CN, config.getCommonName());
        return subject.build();
    }

    private X500Name buildAlternativeName(CsrConfig config) {
        return new X500NameBuilder(BCStyle.INSTANCE)
            .addRDN(BCStyle.SN, config.getSerialNumber())
            .addRDN(BCStyle.T, config.getInvoiceType())
            .addRDN(REGISTERED_ADDRESS, config.getLocation())
            .addRDN(BCStyle.BUSINESS_CATEGORY, config.getIndustry())
            .build();
    }

    /**
     * Parse an X.509 certificate given as PEM, base64 DER, or a CSID
     * binary security token (base64 of the base64 DER).
     *
     * @throws FatooraException with code CRYPTO01 if the input is not a certificate
     */
    public static X509Certificate parseCertificate(String certificate) {
        try {
            CryptoProviders.ensureBouncyCastle();
            byte[] der = PemSupport.decode(certificate);
            if (!PemSupport.isPem(certificate) && der.length > 0 && der[0] != 0x30) {
                // Not a DER SEQUENCE: a token wrapping the base64 text
                der = PemSupport.decode(new String(der, StandardCharsets.US_ASCII));
            }

            CertificateFactory factory = CertificateFactory.getInstance("X.509", CryptoProviders.BOUNCY_CASTLE);
            return (X509Certificate) factory.generateCertificate(new ByteArrayInputStream(der));
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            throw new FatooraException("Failed to load certificate: " + e.getMessage(), "CRYPTO01", e);
        }
    }

    /**
     * Base64 of the issuer's signature over the certificate, as carried in QR tag 9.
     */
    public static String extractCertificateSignature(String certificate) {
        return Base64.getEncoder().encodeToString(parseCertificate(certificate).getSignature());
    }

    public String getCurveName() {
        return curveName;
    }

    public FatooraEnvironment getEnvironment() {
        return environment;
    }
}
