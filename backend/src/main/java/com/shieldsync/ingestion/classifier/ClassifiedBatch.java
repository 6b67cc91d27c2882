package com.shieldsync.ingestion.classifier;

import com.shieldsync.domain.IndexedTx;
import com.shieldsync.domain.LedgerEntry;
import com.shieldsync.domain.SyncResult;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * One relayer batch split into mined and pending entries, both in arrival order.
 */
public record ClassifiedBatch(long offset, List<LedgerEntry> mined, List<LedgerEntry> pending) {

    public ClassifiedBatch {
        mined = List.copyOf(mined);
        pending = List.copyOf(pending);
    }

    public List<IndexedTx> minedTxs() {
        return mined.stream().map(LedgerEntry::toIndexedTx).toList();
    }

    public List<IndexedTx> pendingTxs() {
        return pending.stream().map(LedgerEntry::toIndexedTx).toList();
    }

    public Map<Long, String> txHashes() {
        Map<Long, String> hashes = new HashMap<>();
        mined.forEach(e -> hashes.put(e.index(), e.txHash()));
        pending.forEach(e -> hashes.put(e.index(), e.txHash()));
        return hashes;
    }

    public long maxMinedIndex() {
        return mined.stream().mapToLong(LedgerEntry::index).max().orElse(SyncResult.NONE);
    }

    public long maxPendingIndex() {
        return pending.stream().mapToLong(LedgerEntry::index).max().orElse(SyncResult.NONE);
    }

    public int size() {
        return mined.size() + pending.size();
    }

    public SyncResult toSyncResult() {
        return new SyncResult(size(), maxMinedIndex(), maxPendingIndex());
    }
}
