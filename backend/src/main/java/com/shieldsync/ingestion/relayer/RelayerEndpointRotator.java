package com.shieldsync.ingestion.relayer;

import com.shieldsync.common.RetryPolicy;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Relayer mirrors of one asset, handed out round-robin. A mirror that fails {@value #SUSPECT_AFTER_FAILURES}
 * calls in a row is skipped until it answers again; when every mirror is suspect, rotation covers all of them.
 */
@Slf4j
public class RelayerEndpointRotator {

    static final int SUSPECT_AFTER_FAILURES = 3;

    private final String asset;
    private final List<String> endpoints;
    private final AtomicInteger index = new AtomicInteger(0);
    private final ConcurrentHashMap<String, AtomicInteger> consecutiveFailures = new ConcurrentHashMap<>();
    private final RetryPolicy retryPolicy;

    public RelayerEndpointRotator(String asset, List<String> endpoints, RetryPolicy retryPolicy) {
        if (endpoints == null || endpoints.isEmpty()) {
            throw new IllegalArgumentException("At least one relayer endpoint required for " + asset);
        }
        this.asset = asset;
        this.endpoints = List.copyOf(endpoints);
        this.retryPolicy = retryPolicy != null ? retryPolicy : RetryPolicy.defaultPolicy();
        this.endpoints.forEach(e -> consecutiveFailures.put(e, new AtomicInteger()));
    }

    public String getNextEndpoint() {
        int size = endpoints.size();
        int start = Math.floorMod(index.getAndIncrement(), size);
        for (int i = 0; i < size; i++) {
            String candidate = endpoints.get((start + i) % size);
            if (!isSuspect(candidate)) {
                return candidate;
            }
        }
        return endpoints.get(start);
    }

    public void markFailed(String endpoint) {
        AtomicInteger failures = consecutiveFailures.get(endpoint);
        if (failures == null) {
            return;
        }
        int count = failures.incrementAndGet();
        if (count == SUSPECT_AFTER_FAILURES && endpoints.size() > 1) {
            log.warn("Relayer {} for {} failed {} times in a row; failing over to other mirrors", endpoint, asset, count);
        }
    }

    public void markSucceeded(String endpoint) {
        AtomicInteger failures = consecutiveFailures.get(endpoint);
        if (failures != null && failures.getAndSet(0) >= SUSPECT_AFTER_FAILURES) {
            log.info("Relayer {} for {} is answering again", endpoint, asset);
        }
    }

    public boolean isSuspect(String endpoint) {
        AtomicInteger failures = consecutiveFailures.get(endpoint);
        return failures != null && failures.get() >= SUSPECT_AFTER_FAILURES;
    }

    /**
     * Delay in ms before retrying after the given attempt (0-based).
     */
    public long retryDelayMs(int attempt) {
        return retryPolicy.delayMs(attempt);
    }

    public int getMaxAttempts() {
        return retryPolicy.getMaxAttempts();
    }

    public String getAsset() {
        return asset;
    }

    public List<String> getEndpoints() {
        return endpoints;
    }
}
