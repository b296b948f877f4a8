package com.yoursp.dssp.config;

import com.yoursp.dssp.modules.channel.AuthenticationMode;
import com.yoursp.dssp.modules.channel.ChannelSelector;
import com.yoursp.dssp.modules.channel.dto.ApplicationCredentials;
import com.yoursp.dssp.modules.channel.dto.CertificateLookup;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DsspClientConfigTest {

    @Test
    @DisplayName("Nothing configured → anonymous credentials")
    void noCredentials() {
        ApplicationCredentials credentials = DsspClientConfig.toCredentials(new DsspProperties.Application());

        assertSame(ApplicationCredentials.none(), credentials);
        assertEquals(AuthenticationMode.ANONYMOUS, ChannelSelector.select(credentials).getMode());
    }

    @Test
    @DisplayName("Username and password → username/password credentials")
    void usernamePassword() {
        DsspProperties.Application application = new DsspProperties.Application();
        application.setUsername("app");
        application.setPassword("secret");

        ApplicationCredentials credentials = DsspClientConfig.toCredentials(application);

        assertEquals("app", credentials.getUsername());
        assertEquals(AuthenticationMode.USERNAME_PASSWORD, ChannelSelector.select(credentials).getMode());
    }

    @Test
    @DisplayName("Key store certificate → lookup credentials")
    void certificateLookup() {
        DsspProperties.Application application = new DsspProperties.Application();
        application.getCertificate().setKeystorePath("/etc/dssp/app.p12");
        application.getCertificate().setKeystorePassword("changeit");
        application.getCertificate().setFindType(CertificateLookup.FindType.THUMBPRINT);
        application.getCertificate().setFindValue("a1b2c3");

        ApplicationCredentials credentials = DsspClientConfig.toCredentials(application);

        assertEquals(CertificateLookup.FindType.THUMBPRINT, credentials.getCertificateLookup().findType());
        assertEquals("PKCS12", credentials.getCertificateLookup().storeType());
        assertEquals(AuthenticationMode.CLIENT_CERT_BY_LOOKUP, ChannelSelector.select(credentials).getMode());
    }

    @Test
    @DisplayName("Password and certificate together → IllegalStateException")
    void passwordAndCertificateRejected() {
        DsspProperties.Application application = new DsspProperties.Application();
        application.setUsername("app");
        application.setPassword("secret");
        application.getCertificate().setKeystorePath("/etc/dssp/app.p12");
        application.getCertificate().setFindValue("app");

        assertThrows(IllegalStateException.class, () -> DsspClientConfig.toCredentials(application));
    }
}
