package com.shieldsync.ingestion.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.shieldsync.common.RetryPolicy;
import com.shieldsync.config.AssetProperties;
import com.shieldsync.ingestion.relayer.RelayerClient;
import com.shieldsync.ingestion.relayer.RelayerEndpointRotator;
import com.shieldsync.ingestion.relayer.WebClientRelayerClient;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Relayer client, per-asset endpoint rotators and the local relayer rate limiter.
 */
@Configuration
@EnableConfigurationProperties({ RelayerRetryProperties.class, RelayerRateLimitProperties.class })
public class RelayerAdapterConfig {

    @Bean
    public RelayerClient relayerClient(WebClient.Builder webClientBuilder, ObjectMapper objectMapper) {
        return new WebClientRelayerClient(webClientBuilder, objectMapper);
    }

    /** Assets without relayer urls are left out; operations on them fail with UNKNOWN_ASSET. */
    @Bean
    public Map<String, RelayerEndpointRotator> relayerRotatorsByAsset(AssetProperties assetProperties,
                                                                       RelayerRetryProperties retryProperties) {
        RetryPolicy retryPolicy = new RetryPolicy(
                retryProperties.getBaseDelayMs(),
                retryProperties.getJitterFactor(),
                retryProperties.getMaxAttempts());
        Map<String, RelayerEndpointRotator> rotators = new LinkedHashMap<>();
        assetProperties.getAssets().forEach((asset, entry) -> {
            if (entry != null && entry.getRelayerUrls() != null && !entry.getRelayerUrls().isEmpty()) {
                rotators.put(asset, new RelayerEndpointRotator(asset, entry.getRelayerUrls(), retryPolicy));
            }
        });
        return rotators;
    }

    @Bean(name = "relayerRateLimiter")
    public RateLimiter relayerRateLimiter(RelayerRateLimitProperties properties) {
        int rps = Math.max(1, properties.getMaxRequestsPerSecond());
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(rps)
                .timeoutDuration(Duration.ofMillis(Math.max(0L, properties.getTimeoutMs())))
                .build();
        return RateLimiter.of("relayer", config);
    }
}
