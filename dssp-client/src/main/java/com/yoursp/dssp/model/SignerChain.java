package com.yoursp.dssp.model;

import lombok.Getter;

import java.security.PrivateKey;
import java.security.cert.X509Certificate;
import java.util.List;

/**
 * Signer of a two-step signature: the certificate chain (end certificate
 * first) and the private key of the end certificate.
 * <p>
 * A chain of a single certificate that is not self-signed is completed from
 * the local trust store before it is sent. A longer chain is sent as given.
 * </p>
 */
@Getter
public class SignerChain {

    private final List<X509Certificate> certificates;
    private final PrivateKey privateKey;

    public SignerChain(List<X509Certificate> certificates, PrivateKey privateKey) {
        this.certificates = certificates == null ? List.of() : List.copyOf(certificates);
        this.privateKey = privateKey;
    }

    public SignerChain(X509Certificate signer, PrivateKey privateKey) {
        this(signer == null ? null : List.of(signer), privateKey);
    }

    /**
     * @return the end certificate, or {@code null} for an empty chain
     */
    public X509Certificate getSigner() {
        return certificates.isEmpty() ? null : certificates.get(0);
    }

    /**
     * A chain is usable when it has an end certificate and a private key for it.
     */
    public boolean isUsable() {
        return getSigner() != null && privateKey != null;
    }
}
