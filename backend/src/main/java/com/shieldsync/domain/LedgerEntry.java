package com.shieldsync.domain;

/**
 * One raw commitment-log entry at a fixed log index, as decoded from the relayer's wire string.
 * Transient: discarded once classified into mined or pending work.
 */
public record LedgerEntry(
        long index,
        boolean mined,
        String txHash,
        String commitment,
        String memo
) {

    public IndexedTx toIndexedTx() {
        return new IndexedTx(index, memo, commitment);
    }
}
