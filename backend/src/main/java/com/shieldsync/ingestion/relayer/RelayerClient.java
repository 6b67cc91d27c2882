package com.shieldsync.ingestion.relayer;

import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Optional;

/**
 * Relayer HTTP API. Implementations map transport and HTTP failures to {@link RelayerException}.
 */
public interface RelayerClient {

    /**
     * Raw log entries starting at log index {@code offset}; at most {@code limit} entries, ordered by index.
     */
    Mono<List<String>> fetchTransactions(String baseUrl, long offset, int limit);

    Mono<RelayerInfo> info(String baseUrl);

    /**
     * Submits transactions as one job.
     *
     * @return relayer job id
     */
    Mono<String> sendTransactions(String baseUrl, List<RelayerTxRequest> transactions);

    /**
     * Job status; empty when the relayer does not know the id.
     */
    Mono<Optional<RelayerJob>> getJob(String baseUrl, String jobId);

    /**
     * Fee per transaction the relayer currently charges, in pool units.
     */
    Mono<Long> fee(String baseUrl);
}
