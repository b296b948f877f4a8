package com.yoursp.dssp.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Executor behind the asynchronous DSS-P calls. The queue stays unbounded so
 * a burst of calls waits for a worker instead of being rejected.
 */
@Configuration
public class AsyncConfig {

    @Bean(name = "dsspExecutor")
    public ThreadPoolTaskExecutor dsspExecutor(DsspProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getAsync().getPoolSize());
        executor.setThreadNamePrefix("dssp-");
        executor.initialize();
        return executor;
    }
}
