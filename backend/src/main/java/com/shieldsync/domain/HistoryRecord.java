package com.shieldsync.domain;

/**
 * One history entry, keyed by the log index of the tx that produced it.
 */
public record HistoryRecord(
        HistoryTransactionType type,
        long amount,
        long fee,
        boolean pending,
        String txHash,
        long index
) {

    public HistoryRecord confirmed() {
        return pending ? new HistoryRecord(type, amount, fee, false, txHash, index) : this;
    }
}
