package com.shieldsync.ingestion.relayer;

import java.util.List;

/**
 * GET /job/{id} response.
 */
public record RelayerJob(String jobId, RelayerJobState state, List<String> txHashes, String failedReason) {

    public RelayerJob {
        txHashes = txHashes == null ? List.of() : List.copyOf(txHashes);
    }
}
