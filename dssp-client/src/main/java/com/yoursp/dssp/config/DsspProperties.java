package com.yoursp.dssp.config;

import com.yoursp.dssp.modules.channel.dto.CertificateLookup;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Binds the {@code dssp.*} properties into a typed bean. The field
 * initializers are the defaults; only {@code dssp.address} is required.
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "dssp")
public class DsspProperties {

    /** DSS-P endpoint URL. */
    @NotBlank
    private String address;

    /** Requested signature type; blank lets the service choose. */
    private String signatureType;

    private Duration connectTimeout = Duration.ofSeconds(30);
    private Duration requestTimeout = Duration.ofSeconds(60);

    @Valid
    private Application application = new Application();

    private TrustStore trustStore = new TrustStore();

    private Async async = new Async();

    @Getter
    @Setter
    public static class Application {
        private String username;
        private String password;
        private Certificate certificate = new Certificate();
    }

    /** Key store lookup of the application certificate. */
    @Getter
    @Setter
    public static class Certificate {
        private String keystorePath;
        private String keystoreType = "PKCS12";
        private String keystorePassword;
        private CertificateLookup.FindType findType = CertificateLookup.FindType.ALIAS;
        private String findValue;

        public boolean isConfigured() {
            return keystorePath != null && !keystorePath.isBlank();
        }
    }

    /** Trust store for signer chain completion. */
    @Getter
    @Setter
    public static class TrustStore {
        private String path;
        private String type = "PKCS12";
        private String password;

        public boolean isConfigured() {
            return path != null && !path.isBlank();
        }
    }

    /** Worker threads of the HTTP client; the queue is unbounded. */
    @Getter
    @Setter
    public static class Async {
        private int poolSize = 4;
    }
}
