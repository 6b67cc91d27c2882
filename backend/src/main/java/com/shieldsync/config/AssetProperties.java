package com.shieldsync.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Supported assets. Key = token address the pool is deployed for; one account state per entry.
 */
@ConfigurationProperties(prefix = "shieldsync")
@NoArgsConstructor
@Getter
@Setter
public class AssetProperties {

    private Map<String, AssetEntry> assets = new LinkedHashMap<>();

    public void setAssets(Map<String, AssetEntry> assets) {
        this.assets = assets != null ? assets : new LinkedHashMap<>();
    }

    /**
     * One asset's relayer endpoints and unit conversion.
     */
    @NoArgsConstructor
    @Getter
    @Setter
    public static class AssetEntry {

        private List<String> relayerUrls = new ArrayList<>();

        /** Wei per pool unit. Amounts are divided by this before entering the pool. */
        private long denominator = 1_000_000_000L;

        /** Optional. Largest single deposit in pool units; null = unlimited. */
        private Long depositLimit;

        /** Optional. Fixed fee per tx in pool units; null = ask the relayer. */
        private Long fee;

        /** Send deposit signatures in 64-byte compact form (EIP-2098), as EVM pool contracts expect. */
        private boolean compactSignature;

        public void setRelayerUrls(List<String> relayerUrls) {
            this.relayerUrls = relayerUrls != null ? relayerUrls : new ArrayList<>();
        }
    }
}
