package com.shieldsync.state;

import com.shieldsync.common.UnknownAssetException;
import com.shieldsync.config.AssetProperties;
import com.shieldsync.config.PoolProperties;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Owns one {@link PoolAccount} per configured asset and the spending key they share.
 */
@Slf4j
@Component
public class PoolAccountRegistry {

    private final Map<String, PoolAccount> accounts;
    private final byte[] spendingKey;

    public PoolAccountRegistry(AssetProperties assetProperties, PoolProperties poolProperties) {
        Map<String, PoolAccount> created = new LinkedHashMap<>();
        assetProperties.getAssets().forEach((asset, entry) ->
                created.put(asset, new PoolAccount(asset, entry.getDenominator(), entry.getDepositLimit(), entry.isCompactSignature())));
        this.accounts = Collections.unmodifiableMap(created);
        this.spendingKey = poolProperties.spendingKeyBytes();
        log.info("Pool accounts initialised for {} asset(s): {}", accounts.size(), accounts.keySet());
    }

    public PoolAccount get(String asset) {
        PoolAccount account = accounts.get(asset);
        if (account == null) {
            throw new UnknownAssetException(asset);
        }
        return account;
    }

    /**
     * Copy of the spending key; callers should zero it after use.
     */
    public byte[] spendingKey() {
        return spendingKey.clone();
    }

    @PreDestroy
    public void free() {
        accounts.values().forEach(a -> {
            a.getState().wipe();
            a.getHistory().clear();
        });
        Arrays.fill(spendingKey, (byte) 0);
        log.info("Pool accounts freed");
    }
}
