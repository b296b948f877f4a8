package com.yoursp.dssp.config;

import com.yoursp.dssp.modules.chain.CertificateChainBuilder;
import com.yoursp.dssp.modules.chain.PkixCertificateChainBuilder;
import com.yoursp.dssp.modules.channel.CertificateStoreLookup;
import com.yoursp.dssp.modules.channel.ChannelSelector;
import com.yoursp.dssp.modules.channel.DsspPortFactory;
import com.yoursp.dssp.modules.channel.KeyStoreCertificateLookup;
import com.yoursp.dssp.modules.channel.dto.ApplicationCredentials;
import com.yoursp.dssp.modules.channel.dto.CertificateLookup;
import com.yoursp.dssp.modules.channel.soap.SoapDsspPortFactory;
import com.yoursp.dssp.modules.channel.soap.SoapMessageCodec;
import com.yoursp.dssp.modules.client.DsspClient;
import com.yoursp.dssp.modules.crypto.LocalSignatureCalculator;
import com.yoursp.dssp.modules.request.DsspRequestFactory;
import com.yoursp.dssp.modules.session.DsspResponseProcessor;
import com.yoursp.dssp.modules.verify.VerificationReportMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import java.util.concurrent.Executor;

/**
 * Wires the DSS-P client. Registered as an auto-configuration, so adding the
 * module to a Spring Boot application and setting {@code dssp.address} is
 * enough. Credentials, chain building, certificate lookup and the port
 * factory back off when the application defines its own.
 */
@Slf4j
@AutoConfiguration
@EnableConfigurationProperties(DsspProperties.class)
@Import({ AsyncConfig.class, SoapMessageCodec.class, DsspRequestFactory.class, DsspResponseProcessor.class,
        VerificationReportMapper.class, ChannelSelector.class, LocalSignatureCalculator.class, DsspClient.class })
public class DsspClientConfig {

    @Bean
    @ConditionalOnMissingBean
    public ApplicationCredentials applicationCredentials(DsspProperties properties) {
        ApplicationCredentials credentials = toCredentials(properties.getApplication());
        log.info("DSS-P client configured: address={}, credentials={}", properties.getAddress(), credentials);
        return credentials;
    }

    @Bean
    @ConditionalOnMissingBean
    public CertificateChainBuilder certificateChainBuilder(DsspProperties properties) {
        DsspProperties.TrustStore trustStore = properties.getTrustStore();
        if (!trustStore.isConfigured()) {
            return PkixCertificateChainBuilder.fromDefaultTrustStore();
        }

        char[] password = trustStore.getPassword() == null ? null : trustStore.getPassword().toCharArray();
        try (InputStream in = Files.newInputStream(Path.of(trustStore.getPath()))) {
            KeyStore keyStore = KeyStore.getInstance(trustStore.getType());
            keyStore.load(in, password);
            return PkixCertificateChainBuilder.fromKeyStore(keyStore);
        } catch (IOException | GeneralSecurityException e) {
            throw new IllegalStateException("Unable to load trust store " + trustStore.getPath(), e);
        }
    }

    @Bean
    @ConditionalOnMissingBean
    public CertificateStoreLookup certificateStoreLookup() {
        return new KeyStoreCertificateLookup();
    }

    @Bean
    @ConditionalOnMissingBean
    public DsspPortFactory dsspPortFactory(DsspProperties properties, SoapMessageCodec codec,
            CertificateStoreLookup certificateStoreLookup, @Qualifier("dsspExecutor") Executor dsspExecutor) {
        return new SoapDsspPortFactory(properties, codec, certificateStoreLookup, dsspExecutor);
    }

    /**
     * Collapses the application properties into one credential.
     *
     * @throws IllegalStateException when a password and a certificate are both configured
     */
    static ApplicationCredentials toCredentials(DsspProperties.Application application) {
        boolean hasPassword = application.getPassword() != null && !application.getPassword().isEmpty();
        DsspProperties.Certificate certificate = application.getCertificate();
        boolean hasCertificate = certificate != null && certificate.isConfigured();

        if (hasPassword && hasCertificate) {
            throw new IllegalStateException(
                    "dssp.application: configure either username/password or a certificate, not both");
        }
        if (hasCertificate) {
            return ApplicationCredentials.clientCertificateLookup(new CertificateLookup(
                    certificate.getKeystorePath(), certificate.getKeystoreType(),
                    certificate.getKeystorePassword(), certificate.getFindType(), certificate.getFindValue()));
        }
        if (hasPassword) {
            return ApplicationCredentials.usernamePassword(
                    application.getUsername() == null ? "" : application.getUsername(), application.getPassword());
        }
        return ApplicationCredentials.none();
    }
}
