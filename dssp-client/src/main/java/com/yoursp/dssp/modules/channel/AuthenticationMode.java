package com.yoursp.dssp.modules.channel;

/**
 * How a call authenticates to the signing service.
 */
public enum AuthenticationMode {

    ANONYMOUS,

    /** Mutual TLS with a certificate and key held in memory. */
    CLIENT_CERT,

    /** Mutual TLS with a certificate found in a key store. */
    CLIENT_CERT_BY_LOOKUP,

    /** WS-Security UsernameToken. */
    USERNAME_PASSWORD,

    /** Security-context token of an asynchronous session. */
    SECURE_CONVERSATION
}
