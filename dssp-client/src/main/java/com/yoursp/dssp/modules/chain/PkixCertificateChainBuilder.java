package com.yoursp.dssp.modules.chain;

import lombok.extern.slf4j.Slf4j;

import javax.net.ssl.TrustManager;
import javax.net.ssl.TrustManagerFactory;
import javax.net.ssl.X509TrustManager;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import java.security.KeyStoreException;
import java.security.cert.CertPathBuilder;
import java.security.cert.CertStore;
import java.security.cert.Certificate;
import java.security.cert.CollectionCertStoreParameters;
import java.security.cert.PKIXBuilderParameters;
import java.security.cert.PKIXCertPathBuilderResult;
import java.security.cert.TrustAnchor;
import java.security.cert.X509CertSelector;
import java.security.cert.X509Certificate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * PKIX chain builder over a set of trust anchors and intermediate certificates.
 * <p>
 * Revocation is not checked: the chain only tells the service which
 * certificates to embed, the service validates it. The anchor certificate is
 * appended, so the result runs from the signer up to the root.
 * </p>
 */
@Slf4j
public class PkixCertificateChainBuilder implements CertificateChainBuilder {

    private final Set<TrustAnchor> anchors;
    private final List<X509Certificate> intermediates;

    public PkixCertificateChainBuilder(Set<TrustAnchor> anchors, List<X509Certificate> intermediates) {
        this.anchors = Collections.unmodifiableSet(new HashSet<>(anchors));
        this.intermediates = List.copyOf(intermediates);
    }

    /**
     * Self-signed certificates of the key store become trust anchors, all other
     * certificates are candidate intermediates.
     */
    public static PkixCertificateChainBuilder fromKeyStore(KeyStore keyStore) {
        Set<TrustAnchor> anchors = new HashSet<>();
        List<X509Certificate> intermediates = new ArrayList<>();
        try {
            for (String alias : Collections.list(keyStore.aliases())) {
                Certificate certificate = keyStore.getCertificate(alias);
                if (!(certificate instanceof X509Certificate x509)) {
                    continue;
                }
                if (isSelfSigned(x509)) {
                    anchors.add(new TrustAnchor(x509, null));
                } else {
                    intermediates.add(x509);
                }
            }
        } catch (KeyStoreException e) {
            throw new IllegalStateException("Unable to read trust store", e);
        }
        log.info("Chain builder trust store loaded: anchors={}, intermediates={}", anchors.size(), intermediates.size());
        return new PkixCertificateChainBuilder(anchors, intermediates);
    }

    /**
     * Uses the JDK default trust anchors (the {@code cacerts} store).
     */
    public static PkixCertificateChainBuilder fromDefaultTrustStore() {
        try {
            TrustManagerFactory factory = TrustManagerFactory.getInstance(TrustManagerFactory.getDefaultAlgorithm());
            factory.init((KeyStore) null);

            Set<TrustAnchor> anchors = new HashSet<>();
            for (TrustManager trustManager : factory.getTrustManagers()) {
                if (trustManager instanceof X509TrustManager x509TrustManager) {
                    for (X509Certificate issuer : x509TrustManager.getAcceptedIssuers()) {
                        anchors.add(new TrustAnchor(issuer, null));
                    }
                }
            }
            log.info("Chain builder using JDK default trust anchors: anchors={}", anchors.size());
            return new PkixCertificateChainBuilder(anchors, List.of());
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Unable to load the default trust store", e);
        }
    }

    @Override
    public List<X509Certificate> buildChain(X509Certificate signer) {
        if (anchors.isEmpty()) {
            log.warn("No trust anchors available, sending signer certificate only: subject={}",
                    signer.getSubjectX500Principal());
            return List.of(signer);
        }

        try {
            X509CertSelector target = new X509CertSelector();
            target.setCertificate(signer);

            List<X509Certificate> candidates = new ArrayList<>(intermediates);
            candidates.add(signer);

            PKIXBuilderParameters parameters = new PKIXBuilderParameters(anchors, target);
            parameters.setRevocationEnabled(false);
            parameters.addCertStore(CertStore.getInstance("Collection", new CollectionCertStoreParameters(candidates)));

            PKIXCertPathBuilderResult result = (PKIXCertPathBuilderResult) CertPathBuilder.getInstance("PKIX")
                    .build(parameters);

            List<X509Certificate> chain = new ArrayList<>();
            for (Certificate certificate : result.getCertPath().getCertificates()) {
                chain.add((X509Certificate) certificate);
            }
            X509Certificate anchor = result.getTrustAnchor().getTrustedCert();
            if (anchor != null && !chain.contains(anchor)) {
                chain.add(anchor);
            }

            log.debug("Signer chain built: subject={}, length={}", signer.getSubjectX500Principal(), chain.size());
            return chain;
        } catch (GeneralSecurityException e) {
            log.warn("Unable to build signer chain, sending signer certificate only: subject={}, error={}",
                    signer.getSubjectX500Principal(), e.getMessage());
            return List.of(signer);
        }
    }

    public static boolean isSelfSigned(X509Certificate certificate) {
        return certificate.getIssuerX500Principal().equals(certificate.getSubjectX500Principal());
    }
}
