package com.yoursp.dssp.modules.channel;

import com.yoursp.dssp.modules.channel.dto.CertificateLookup;

import java.security.KeyStore;

/**
 * Finds the application certificate and key for
 * {@link AuthenticationMode#CLIENT_CERT_BY_LOOKUP}.
 */
public interface CertificateStoreLookup {

    /**
     * @throws IllegalStateException when the store cannot be read or holds no matching key entry
     */
    KeyStore.PrivateKeyEntry find(CertificateLookup lookup);
}
