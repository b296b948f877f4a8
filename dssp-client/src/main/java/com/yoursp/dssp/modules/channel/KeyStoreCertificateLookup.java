package com.yoursp.dssp.modules.channel;

import com.yoursp.dssp.modules.channel.dto.CertificateLookup;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import java.security.MessageDigest;
import java.security.cert.Certificate;
import java.security.cert.X509Certificate;
import java.util.Collections;
import java.util.HexFormat;
import java.util.Locale;

/**
 * {@link CertificateStoreLookup} over a key store file.
 * <p>
 * ALIAS matches the entry alias exactly, SUBJECT_NAME matches a substring
 * of the subject (case-insensitive), THUMBPRINT matches the SHA-1
 * fingerprint in hex, ignoring case, spaces and colons.
 * </p>
 */
@Slf4j
public class KeyStoreCertificateLookup implements CertificateStoreLookup {

    @Override
    public KeyStore.PrivateKeyEntry find(CertificateLookup lookup) {
        char[] password = lookup.storePassword() == null ? new char[0] : lookup.storePassword().toCharArray();
        try {
            KeyStore keyStore = load(lookup, password);
            for (String alias : Collections.list(keyStore.aliases())) {
                if (!keyStore.isKeyEntry(alias)) {
                    continue;
                }
                Certificate certificate = keyStore.getCertificate(alias);
                if (certificate instanceof X509Certificate x509 && matches(lookup, alias, x509)) {
                    KeyStore.Entry entry = keyStore.getEntry(alias, new KeyStore.PasswordProtection(password));
                    if (entry instanceof KeyStore.PrivateKeyEntry privateKeyEntry) {
                        log.info("Application certificate found: alias={}, subject={}",
                                alias, x509.getSubjectX500Principal());
                        return privateKeyEntry;
                    }
                }
            }
        } catch (IOException | GeneralSecurityException e) {
            throw new IllegalStateException("Unable to read key store " + lookup.location(), e);
        }
        throw new IllegalStateException("No key entry matching " + lookup.findType() + "="
                + lookup.findValue() + " in " + lookup.location());
    }

    private static KeyStore load(CertificateLookup lookup, char[] password)
            throws IOException, GeneralSecurityException {
        KeyStore keyStore = KeyStore.getInstance(lookup.storeType());
        try (InputStream in = Files.newInputStream(Path.of(lookup.location()))) {
            keyStore.load(in, password);
        }
        return keyStore;
    }

    static boolean matches(CertificateLookup lookup, String alias, X509Certificate certificate)
            throws GeneralSecurityException {
        String value = lookup.findValue();
        switch (lookup.findType()) {
            case ALIAS:
                return alias.equals(value);
            case SUBJECT_NAME:
                return certificate.getSubjectX500Principal().getName().toLowerCase(Locale.ROOT)
                        .contains(value.toLowerCase(Locale.ROOT));
            case THUMBPRINT:
                String thumbprint = HexFormat.of().formatHex(
                        MessageDigest.getInstance("SHA-1").digest(certificate.getEncoded()));
                return thumbprint.equalsIgnoreCase(value.replace(" ", "").replace(":", ""));
            default:
                return false;
        }
    }
}
