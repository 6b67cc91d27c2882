package com.shieldsync.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Named thread pools: sync-executor runs relayer batch fetch + decryption in parallel within one cycle.
 */
@Configuration
@EnableConfigurationProperties({ PoolProperties.class, AssetProperties.class })
public class AsyncConfig {

    public static final String SYNC_EXECUTOR = "sync-executor";

    @Bean(name = SYNC_EXECUTOR)
    public Executor syncExecutor() {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(4);
        e.setMaxPoolSize(8);
        e.setQueueCapacity(1_000);
        e.setThreadNamePrefix("sync-");
        e.initialize();
        return e;
    }
}
