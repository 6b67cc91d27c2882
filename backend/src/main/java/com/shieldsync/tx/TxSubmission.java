package com.shieldsync.tx;

import java.util.List;

/**
 * Relayer jobs a deposit, transfer or withdrawal was sent as, one per part, and the resulting tx hashes.
 */
public record TxSubmission(List<String> jobIds, List<String> txHashes) {

    public TxSubmission {
        jobIds = List.copyOf(jobIds);
        txHashes = List.copyOf(txHashes);
    }
}
