package com.shieldsync.domain;

/**
 * Per-batch sync outcome; batches of one cycle are reduced with {@link #merge(SyncResult)}.
 * Index -1 means none seen.
 */
public record SyncResult(int processedCount, long maxMinedIndex, long maxPendingIndex) {

    public static final long NONE = -1L;

    public static final SyncResult EMPTY = new SyncResult(0, NONE, NONE);

    public SyncResult merge(SyncResult other) {
        return new SyncResult(
                processedCount + other.processedCount,
                Math.max(maxMinedIndex, other.maxMinedIndex),
                Math.max(maxPendingIndex, other.maxPendingIndex));
    }
}
