package com.zatca.fatoora.crypto;

import com.zatca.fatoora.exception.FatooraException;
import org.bouncycastle.asn1.ASN1Encodable;
import org.bouncycastle.asn1.ASN1Encoding;
import org.bouncycastle.asn1.ASN1Integer;
import org.bouncycastle.asn1.DERSequence;
import org.bouncycastle.asn1.x509.AlgorithmIdentifier;
import org.bouncycastle.asn1.x9.X9ObjectIdentifiers;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.params.AsymmetricKeyParameter;
import org.bouncycastle.crypto.signers.ECDSASigner;
import org.bouncycastle.crypto.signers.HMacDSAKCalculator;
import org.bouncycastle.jcajce.provider.asymmetric.util.ECUtil;
import org.bouncycastle.operator.ContentSigner;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.math.BigInteger;
import java.security.InvalidKeyException;
import java.security.PrivateKey;

/**
 * ecdsa-with-SHA256 content signer using RFC 6979 nonces, so the same key
 * and content always produce the same signature. One instance signs one
 * structure.
 */
final class DeterministicEcdsaContentSigner implements ContentSigner {

    private static final AlgorithmIdentifier ALGORITHM =
        new AlgorithmIdentifier(X9ObjectIdentifiers.ecdsa_with_SHA256);

    private final AsymmetricKeyParameter keyParameter;
    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();

    DeterministicEcdsaContentSigner(PrivateKey privateKey) {
        try {
            this.keyParameter = ECUtil.generatePrivateKeyParameter(privateKey);
        } catch (InvalidKeyException e) {
            throw new FatooraException("Private key is not an EC key: " + e.getMessage(), "CRYPTO06", e);
        }
    }

    @Override
    public AlgorithmIdentifier getAlgorithmIdentifier() {
        return ALGORITHM;
    }

    @Override
    public OutputStream getOutputStream() {
        return buffer;
    }

    @Override
    public byte[] getSignature() {
        byte[] digest = InvoiceHashService.digest(buffer.toByteArray());

        ECDSASigner signer = new ECDSASigner(new HMacDSAKCalculator(new SHA256Digest()));
        signer.init(true, keyParameter);
        BigInteger[] rs = signer.generateSignature(digest);

        try {
            return new DERSequence(new ASN1Encodable[] {
                new ASN1Integer(rs[0]),
                new ASN1Integer(rs[1])
            }).getEncoded(ASN1Encoding.DER);
        } catch (IOException e) {
            throw new FatooraException("Failed to encode CSR signature", "CRYPTO09", e);
        }
    }
}
