package com.yoursp.dssp.modules.channel.soap;

import com.yoursp.dssp.config.DsspProperties;
import com.yoursp.dssp.modules.channel.CertificateStoreLookup;
import com.yoursp.dssp.modules.channel.ChannelBinding;
import com.yoursp.dssp.modules.channel.DsspPort;
import com.yoursp.dssp.modules.channel.DsspPortFactory;
import com.yoursp.dssp.modules.channel.dto.ApplicationCredentials;
import lombok.extern.slf4j.Slf4j;

import javax.net.ssl.KeyManagerFactory;
import javax.net.ssl.SSLContext;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import java.security.PrivateKey;
import java.security.cert.Certificate;
import java.util.concurrent.Executor;

/**
 * Builds a fresh {@link SoapDsspPort}, with its own {@link HttpClient}, for
 * every binding. The two certificate modes get a client key in the TLS
 * context; the trust side stays on the JDK defaults.
 */
@Slf4j
public class SoapDsspPortFactory implements DsspPortFactory {

    private static final char[] IN_MEMORY_PASSWORD = "dssp".toCharArray();

    private final DsspProperties properties;
    private final SoapMessageCodec codec;
    private final CertificateStoreLookup certificateStoreLookup;
    private final Executor executor;

    public SoapDsspPortFactory(DsspProperties properties, SoapMessageCodec codec,
            CertificateStoreLookup certificateStoreLookup, Executor executor) {
        this.properties = properties;
        this.codec = codec;
        this.certificateStoreLookup = certificateStoreLookup;
        this.executor = executor;
    }

    @Override
    public DsspPort create(ChannelBinding binding) {
        HttpClient.Builder builder = HttpClient.newBuilder()
                .connectTimeout(properties.getConnectTimeout())
                .executor(executor);

        switch (binding.getMode()) {
            case CLIENT_CERT:
                ApplicationCredentials credentials = binding.getCredentials();
                builder.sslContext(clientSslContext(credentials.getPrivateKey(),
                        new Certificate[] { credentials.getCertificate() }));
                break;
            case CLIENT_CERT_BY_LOOKUP:
                KeyStore.PrivateKeyEntry entry = certificateStoreLookup.find(
                        binding.getCredentials().getCertificateLookup());
                builder.sslContext(clientSslContext(entry.getPrivateKey(), entry.getCertificateChain()));
                break;
            default:
                break;
        }

        return new SoapDsspPort(builder.build(), URI.create(properties.getAddress()),
                properties.getRequestTimeout(), codec, binding);
    }

    private static SSLContext clientSslContext(PrivateKey key, Certificate[] chain) {
        try {
            KeyStore keyStore = KeyStore.getInstance("PKCS12");
            keyStore.load(null, null);
            keyStore.setKeyEntry("client", key, IN_MEMORY_PASSWORD, chain);

            KeyManagerFactory keyManagerFactory = KeyManagerFactory.getInstance(
                    KeyManagerFactory.getDefaultAlgorithm());
            keyManagerFactory.init(keyStore, IN_MEMORY_PASSWORD);

            SSLContext sslContext = SSLContext.getInstance("TLS");
            sslContext.init(keyManagerFactory.getKeyManagers(), null, null);
            return sslContext;
        } catch (IOException | GeneralSecurityException e) {
            throw new IllegalStateException("Unable to set up client certificate TLS context", e);
        }
    }
}
