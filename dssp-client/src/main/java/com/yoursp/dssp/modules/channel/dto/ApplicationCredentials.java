package com.yoursp.dssp.modules.channel.dto;

import lombok.Getter;

import java.security.PrivateKey;
import java.security.cert.X509Certificate;
import java.util.Objects;

/**
 * Identity of the calling application. At most one kind of credential is
 * set: none, a username and password, an inline certificate, or a
 * certificate lookup.
 */
@Getter
public final class ApplicationCredentials {

    private static final ApplicationCredentials NONE = new ApplicationCredentials(null, null, null, null, null);

    private final String username;
    private final String password;
    private final X509Certificate certificate;
    private final PrivateKey privateKey;
    private final CertificateLookup certificateLookup;

    private ApplicationCredentials(String username, String password, X509Certificate certificate,
            PrivateKey privateKey, CertificateLookup certificateLookup) {
        this.username = username;
        this.password = password;
        this.certificate = certificate;
        this.privateKey = privateKey;
        this.certificateLookup = certificateLookup;
    }

    public static ApplicationCredentials none() {
        return NONE;
    }

    public static ApplicationCredentials usernamePassword(String username, String password) {
        return new ApplicationCredentials(Objects.requireNonNull(username, "username"),
                Objects.requireNonNull(password, "password"), null, null, null);
    }

    public static ApplicationCredentials clientCertificate(X509Certificate certificate, PrivateKey privateKey) {
        return new ApplicationCredentials(null, null, Objects.requireNonNull(certificate, "certificate"),
                Objects.requireNonNull(privateKey, "privateKey"), null);
    }

    public static ApplicationCredentials clientCertificateLookup(CertificateLookup lookup) {
        return new ApplicationCredentials(null, null, null, null, Objects.requireNonNull(lookup, "lookup"));
    }

    public boolean hasPassword() {
        return password != null && !password.isEmpty();
    }

    public boolean hasCertificate() {
        return certificate != null;
    }

    public boolean hasCertificateLookup() {
        return certificateLookup != null;
    }

    @Override
    public String toString() {
        return "ApplicationCredentials[username=" + username + ", certificate="
                + (certificate == null ? null : certificate.getSubjectX500Principal()) + ", lookup="
                + certificateLookup + "]";
    }
}
