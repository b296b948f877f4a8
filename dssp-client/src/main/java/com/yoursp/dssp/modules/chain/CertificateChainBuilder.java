package com.yoursp.dssp.modules.chain;

import java.security.cert.X509Certificate;
import java.util.List;

/**
 * Completes a signer certificate into its chain from a local trust store.
 */
public interface CertificateChainBuilder {

    /**
     * @param signer end certificate
     * @return the chain, end certificate first; just the signer when no chain can be built
     */
    List<X509Certificate> buildChain(X509Certificate signer);
}
