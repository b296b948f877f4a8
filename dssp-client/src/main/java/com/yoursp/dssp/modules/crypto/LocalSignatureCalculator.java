package com.yoursp.dssp.modules.crypto;

import com.yoursp.dssp.modules.session.dto.TwoStepSession;
import lombok.extern.slf4j.Slf4j;
import org.bouncycastle.asn1.ASN1Encoding;
import org.bouncycastle.asn1.ASN1ObjectIdentifier;
import org.bouncycastle.asn1.DERNull;
import org.bouncycastle.asn1.nist.NISTObjectIdentifiers;
import org.bouncycastle.asn1.x509.AlgorithmIdentifier;
import org.bouncycastle.asn1.x509.DigestInfo;
import org.bouncycastle.asn1.x509.X509ObjectIdentifiers;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.security.GeneralSecurityException;
import java.security.PrivateKey;
import java.security.Signature;
import java.util.Map;
import java.util.Objects;

/**
 * Computes the local signature of a two-step session.
 * <p>
 * The service returns a digest, not the data, so the signature is a raw
 * PKCS#1 v1.5 RSA signature over the DER {@code DigestInfo} of that digest,
 * equivalent to {@code SHAxxxwithRSA} over the original data.
 * </p>
 */
@Slf4j
@Component
public class LocalSignatureCalculator {

    private static final Map<String, ASN1ObjectIdentifier> DIGEST_ALGORITHMS = Map.of(
            "http://www.w3.org/2000/09/xmldsig#sha1", X509ObjectIdentifiers.id_SHA1,
            "http://www.w3.org/2001/04/xmldsig-more#sha224", NISTObjectIdentifiers.id_sha224,
            "http://www.w3.org/2001/04/xmlenc#sha256", NISTObjectIdentifiers.id_sha256,
            "http://www.w3.org/2001/04/xmldsig-more#sha384", NISTObjectIdentifiers.id_sha384,
            "http://www.w3.org/2001/04/xmlenc#sha512", NISTObjectIdentifiers.id_sha512);

    /**
     * Sign the session digest with the private key of the session signer.
     */
    public byte[] sign(TwoStepSession session) {
        Objects.requireNonNull(session, "session");
        if (session.getSigner() == null || session.getSigner().getPrivateKey() == null) {
            throw new IllegalStateException("Two-step session has no signer private key");
        }
        return sign(session, session.getSigner().getPrivateKey());
    }

    /**
     * Sign the session digest with the given RSA private key.
     */
    public byte[] sign(TwoStepSession session, PrivateKey privateKey) {
        Objects.requireNonNull(session, "session");
        Objects.requireNonNull(privateKey, "privateKey");
        if (!"RSA".equals(privateKey.getAlgorithm())) {
            throw new IllegalArgumentException("Only RSA signer keys are supported, got " + privateKey.getAlgorithm());
        }

        byte[] digestValue = session.getDigestValue();
        if (digestValue == null) {
            throw new IllegalStateException("Two-step session has no digest value");
        }
        ASN1ObjectIdentifier digestOid = DIGEST_ALGORITHMS.get(session.getDigestAlgorithm());
        if (digestOid == null) {
            throw new IllegalArgumentException("Unsupported digest algorithm: " + session.getDigestAlgorithm());
        }

        try {
            DigestInfo digestInfo = new DigestInfo(new AlgorithmIdentifier(digestOid, DERNull.INSTANCE), digestValue);

            Signature signature = Signature.getInstance("NONEwithRSA");
            signature.initSign(privateKey);
            signature.update(digestInfo.getEncoded(ASN1Encoding.DER));
            byte[] value = signature.sign();

            log.debug("Local signature computed: correlationId={}, digestAlgorithm={}",
                    session.getCorrelationId(), session.getDigestAlgorithm());
            return value;
        } catch (GeneralSecurityException | IOException e) {
            throw new IllegalStateException("Local signature computation failed", e);
        }
    }
}
