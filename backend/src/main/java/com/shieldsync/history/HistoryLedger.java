package com.shieldsync.history;

import com.shieldsync.domain.HistoryRecord;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Index-keyed transaction history of one account, confirmed and pending records side by side.
 * A confirmed record always wins over a pending one at the same index.
 */
@Slf4j
public class HistoryLedger {

    private final TreeMap<Long, HistoryRecord> records = new TreeMap<>();

    public synchronized void append(HistoryRecord record) {
        HistoryRecord existing = records.get(record.index());
        if (existing != null && !existing.pending() && record.pending()) {
            return;
        }
        if (existing != null && existing.pending() && !record.pending() && sameTx(existing, record)) {
            markConfirmed(record.index());
            return;
        }
        records.put(record.index(), record);
    }

    /**
     * Flips the pending record at {@code index} to confirmed.
     *
     * @return false when there is no pending record at that index
     */
    public synchronized boolean markConfirmed(long index) {
        HistoryRecord existing = records.get(index);
        if (existing == null || !existing.pending()) {
            return false;
        }
        records.put(index, existing.confirmed());
        return true;
    }

    /**
     * Drops pending records superseded by confirmation (index ≤ maxMinedIndex) and stale ones
     * (not reaffirmed in this cycle and beyond maxPendingIndex).
     *
     * @return number of records removed
     */
    public synchronized int trimPending(long maxMinedIndex, long maxPendingIndex, Set<Long> reaffirmedIndices) {
        int removed = 0;
        Iterator<Map.Entry<Long, HistoryRecord>> it = records.entrySet().iterator();
        while (it.hasNext()) {
            HistoryRecord record = it.next().getValue();
            if (!record.pending()) {
                continue;
            }
            boolean superseded = record.index() <= maxMinedIndex;
            boolean stale = record.index() > maxPendingIndex && !reaffirmedIndices.contains(record.index());
            if (superseded || stale) {
                it.remove();
                removed++;
            }
        }
        if (removed > 0) {
            log.debug("Trimmed {} pending history record(s) (maxMined={}, maxPending={})", removed, maxMinedIndex, maxPendingIndex);
        }
        return removed;
    }

    /**
     * All records in log order.
     */
    public synchronized List<HistoryRecord> records() {
        return new ArrayList<>(records.values());
    }

    public synchronized List<HistoryRecord> pendingRecords() {
        return records.values().stream().filter(HistoryRecord::pending).toList();
    }

    /**
     * Confirmed balance adjusted by what pending records will add or take away once mined.
     */
    public synchronized long optimisticBalance(long confirmedBalance) {
        long balance = confirmedBalance;
        for (HistoryRecord record : records.values()) {
            if (!record.pending()) {
                continue;
            }
            if (record.type().isIncoming()) {
                balance += record.amount();
            } else {
                balance -= record.amount() + record.fee();
            }
        }
        return balance;
    }

    public synchronized void clear() {
        records.clear();
    }

    private static boolean sameTx(HistoryRecord pending, HistoryRecord confirmed) {
        return pending.type() == confirmed.type()
                && pending.amount() == confirmed.amount()
                && pending.fee() == confirmed.fee();
    }
}
