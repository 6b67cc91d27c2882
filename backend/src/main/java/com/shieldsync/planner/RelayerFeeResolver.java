package com.shieldsync.planner;

import com.shieldsync.config.AssetProperties;
import com.shieldsync.config.CaffeineConfig;
import com.shieldsync.ingestion.relayer.RelayerGateway;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Component;

/**
 * Fee per transaction for an asset: the configured fixed fee when present, else the relayer's advertised fee.
 * Cached in relayerFeeCache (60s TTL).
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RelayerFeeResolver {

    private final RelayerGateway relayerGateway;
    private final AssetProperties assetProperties;

    @Cacheable(cacheNames = CaffeineConfig.RELAYER_FEE_CACHE, key = "#asset")
    public long feePerTx(String asset) {
        AssetProperties.AssetEntry entry = assetProperties.getAssets().get(asset);
        if (entry != null && entry.getFee() != null) {
            return entry.getFee();
        }
        long fee = relayerGateway.fee(asset);
        log.debug("Relayer fee for {}: {}", asset, fee);
        return fee;
    }
}
