package com.shieldsync.ingestion.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Relayer read retry policy (exponential backoff ± jitter). Documented in application.yml.
 */
@ConfigurationProperties(prefix = "shieldsync.relayer.retry")
@NoArgsConstructor
@Getter
@Setter
public class RelayerRetryProperties {

    /** Base delay in ms for first retry; doubles each attempt. */
    private long baseDelayMs = 500L;

    /** Jitter factor 0..1 (e.g. 0.2 = ±20%). */
    private double jitterFactor = 0.2;

    /** Attempts in total, including the first call. */
    private int maxAttempts = 3;
}
