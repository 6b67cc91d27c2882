package com.shieldsync.ingestion.relayer;

import com.shieldsync.common.UnknownAssetException;
import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Blocking access to the relayer of each asset: endpoint rotation, retries with backoff for reads,
 * local rate limiting. Submissions are never retried.
 */
@Slf4j
@Component
public class RelayerGateway {

    private final RelayerClient relayerClient;
    private final Map<String, RelayerEndpointRotator> rotatorsByAsset;
    private final RateLimiter relayerRateLimiter;

    public RelayerGateway(
            RelayerClient relayerClient,
            @Qualifier("relayerRotatorsByAsset") Map<String, RelayerEndpointRotator> rotatorsByAsset,
            @Qualifier("relayerRateLimiter") RateLimiter relayerRateLimiter
    ) {
        this.relayerClient = relayerClient;
        this.rotatorsByAsset = rotatorsByAsset;
        this.relayerRateLimiter = relayerRateLimiter;
    }

    public List<String> fetchTransactions(String asset, long offset, int limit) {
        return callWithRetry(asset, "transactions@" + offset, url -> relayerClient.fetchTransactions(url, offset, limit));
    }

    public RelayerInfo info(String asset) {
        return callWithRetry(asset, "info", relayerClient::info);
    }

    public Optional<RelayerJob> getJob(String asset, String jobId) {
        return callWithRetry(asset, "job/" + jobId, url -> relayerClient.getJob(url, jobId));
    }

    public long fee(String asset) {
        return callWithRetry(asset, "fee", relayerClient::fee);
    }

    public String sendTransactions(String asset, List<RelayerTxRequest> transactions) {
        String endpoint = rotatorFor(asset).getNextEndpoint();
        acquirePermit("sendTransactions", endpoint);
        String jobId = relayerClient.sendTransactions(endpoint, transactions).block();
        if (jobId == null) {
            throw new RelayerException("Empty sendTransactions response from " + endpoint);
        }
        log.info("Relayer {} accepted {} transaction(s) as job {}", endpoint, transactions.size(), jobId);
        return jobId;
    }

    private <T> T callWithRetry(String asset, String operation, Function<String, Mono<T>> call) {
        RelayerEndpointRotator rotator = rotatorFor(asset);
        RelayerException lastException = null;
        for (int attempt = 0; attempt < rotator.getMaxAttempts(); attempt++) {
            if (attempt > 0) {
                sleep(rotator.retryDelayMs(attempt - 1));
            }
            String endpoint = rotator.getNextEndpoint();
            try {
                acquirePermit(operation, endpoint);
                T result = call.apply(endpoint).block();
                if (result == null) {
                    throw new RelayerException("Empty " + operation + " response from " + endpoint);
                }
                rotator.markSucceeded(endpoint);
                return result;
            } catch (RelayerException e) {
                lastException = e;
                rotator.markFailed(endpoint);
                log.warn("Relayer {} on {} failed (attempt {}/{}): {}",
                        operation, endpoint, attempt + 1, rotator.getMaxAttempts(), e.getMessage());
            }
        }
        throw new RelayerException("Relayer " + operation + " failed after " + rotator.getMaxAttempts()
                + " attempts: " + lastException.getMessage(), lastException);
    }

    private void acquirePermit(String operation, String endpoint) {
        if (!relayerRateLimiter.acquirePermission()) {
            throw new RelayerException("Local limiter timeout before " + operation + " on " + endpoint);
        }
    }

    private RelayerEndpointRotator rotatorFor(String asset) {
        RelayerEndpointRotator rotator = rotatorsByAsset.get(asset);
        if (rotator == null) {
            throw new UnknownAssetException(asset);
        }
        return rotator;
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(Math.max(0L, millis));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RelayerException("Interrupted during relayer retry", e);
        }
    }
}
