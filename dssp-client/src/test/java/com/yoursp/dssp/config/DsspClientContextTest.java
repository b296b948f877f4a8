package com.yoursp.dssp.config;

import com.yoursp.dssp.model.Document;
import com.yoursp.dssp.modules.channel.DsspPortFactory;
import com.yoursp.dssp.modules.channel.dto.ApplicationCredentials;
import com.yoursp.dssp.modules.channel.soap.SoapDsspPortFactory;
import com.yoursp.dssp.modules.client.DsspClient;
import com.yoursp.dssp.modules.request.DsspRequestFactory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

class DsspClientContextTest {

    private static final String ADDRESS = "dssp.address=https://dss.example.test/dss-ws/dss";

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(DsspClientConfig.class));

    @Test
    @DisplayName("Address and username/password set → client wired")
    void clientWired() {
        contextRunner
                .withPropertyValues(ADDRESS,
                        "dssp.application.username=app",
                        "dssp.application.password=secret")
                .run(context -> {
                    assertNull(context.getStartupFailure());
                    assertNotNull(context.getBean(DsspClient.class));
                    assertEquals("app", context.getBean(ApplicationCredentials.class).getUsername());
                    assertInstanceOf(SoapDsspPortFactory.class, context.getBean(DsspPortFactory.class));
                });
    }

    @Test
    @DisplayName("Missing address → startup fails")
    void addressRequired() {
        contextRunner.run(context -> assertNotNull(context.getStartupFailure()));
    }

    @Test
    @DisplayName("Only the address set → defaults from the properties class, anonymous credentials")
    void defaultsWithoutBundledConfig() {
        contextRunner.withPropertyValues(ADDRESS).run(context -> {
            assertNull(context.getStartupFailure());
            DsspProperties properties = context.getBean(DsspProperties.class);
            assertEquals(30, properties.getConnectTimeout().getSeconds());
            assertEquals(60, properties.getRequestTimeout().getSeconds());
            assertNull(properties.getSignatureType());
            assertFalse(context.getBean(ApplicationCredentials.class).hasPassword());
        });
    }

    @Test
    @DisplayName("dssp.signature-type → used by the request factory")
    void signatureTypeFromProperties() {
        contextRunner
                .withPropertyValues(ADDRESS, "dssp.signature-type=urn:be:e-contract:dssp:signature:pades-baseline")
                .run(context -> {
                    Document document = new Document("application/pdf",
                            "%PDF-1.4".getBytes(StandardCharsets.US_ASCII));
                    assertEquals("urn:be:e-contract:dssp:signature:pades-baseline",
                            context.getBean(DsspRequestFactory.class).createSealRequest(document)
                                    .getOptionalInputs().getSignatureType());
                });
    }

    @Test
    @DisplayName("Application port factory → auto-configured one backs off")
    void portFactoryBacksOff() {
        DsspPortFactory custom = mock(DsspPortFactory.class);
        contextRunner
                .withPropertyValues(ADDRESS)
                .withBean(DsspPortFactory.class, () -> custom)
                .run(context -> {
                    assertNull(context.getStartupFailure());
                    assertSame(custom, context.getBean(DsspPortFactory.class));
                });
    }

    @Test
    @DisplayName("dsspExecutor → unbounded queue, pool size from properties")
    void executorQueueUnbounded() {
        contextRunner
                .withPropertyValues(ADDRESS, "dssp.async.pool-size=2")
                .run(context -> {
                    ThreadPoolTaskExecutor executor = context.getBean("dsspExecutor", ThreadPoolTaskExecutor.class);
                    assertEquals(2, executor.getCorePoolSize());
                    assertEquals(Integer.MAX_VALUE, executor.getThreadPoolExecutor().getQueue().remainingCapacity());
                });
    }
}
