package com.shieldsync.ingestion.sync;

import com.shieldsync.config.PoolProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Syncs repeatedly until the account is ready to transact, within a bounded number of attempts.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ReadinessPoller {

    private final SyncCoordinator syncCoordinator;
    private final PoolProperties poolProperties;

    /**
     * @return false when the account is still not ready after the configured attempts
     */
    public boolean waitReadyToTransact(String asset) {
        int attempts = Math.max(1, poolProperties.getReadyMaxAttempts());
        for (int attempt = 1; attempt <= attempts; attempt++) {
            if (syncCoordinator.updateState(asset)) {
                return true;
            }
            if (attempt < attempts) {
                log.info("{} has an own transaction pending, retrying sync in {} ms ({}/{})",
                        asset, poolProperties.getReadyPollIntervalMs(), attempt, attempts);
                if (!sleep(poolProperties.getReadyPollIntervalMs())) {
                    return false;
                }
            }
        }
        log.warn("{} not ready to transact after {} sync attempts", asset, attempts);
        return false;
    }

    private static boolean sleep(long millis) {
        try {
            Thread.sleep(Math.max(0L, millis));
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
