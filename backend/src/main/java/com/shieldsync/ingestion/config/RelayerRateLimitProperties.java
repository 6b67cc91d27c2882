package com.shieldsync.ingestion.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Local throttling of relayer calls, shared by all assets of this client.
 */
@ConfigurationProperties(prefix = "shieldsync.relayer.rate-limit")
@NoArgsConstructor
@Getter
@Setter
public class RelayerRateLimitProperties {

    private int maxRequestsPerSecond = 20;

    /** How long a call may wait for a permit before failing. */
    private long timeoutMs = 5_000L;
}
