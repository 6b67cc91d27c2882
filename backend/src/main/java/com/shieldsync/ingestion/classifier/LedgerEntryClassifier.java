package com.shieldsync.ingestion.classifier;

import com.shieldsync.common.InternalStateException;
import com.shieldsync.domain.LedgerEntry;
import com.shieldsync.ingestion.relayer.RelayerException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Decodes relayer log entries and splits a batch into mined and pending work.
 *
 * <p>Entry layout (characters): [0] mined flag '1'/'0', [1..64] tx hash hex, [65..128] commitment hex,
 * [129..] memo. The n-th entry of a batch fetched at {@code offset} sits at log index offset + n * stride.
 */
@Component
public class LedgerEntryClassifier {

    static final int HASH_OFFSET = 1;
    static final int HASH_LENGTH = 64;
    static final int COMMITMENT_OFFSET = HASH_OFFSET + HASH_LENGTH;
    static final int COMMITMENT_LENGTH = 64;
    static final int MEMO_OFFSET = COMMITMENT_OFFSET + COMMITMENT_LENGTH;

    public LedgerEntry decode(String raw, long index) {
        if (raw == null || raw.length() < MEMO_OFFSET) {
            throw new RelayerException("Malformed log entry at index " + index + ": too short");
        }
        char flag = raw.charAt(0);
        if (flag != '1' && flag != '0') {
            throw new RelayerException("Malformed log entry at index " + index + ": mined flag '" + flag + "'");
        }
        String txHash = "0x" + raw.substring(HASH_OFFSET, HASH_OFFSET + HASH_LENGTH);
        String commitment = raw.substring(COMMITMENT_OFFSET, COMMITMENT_OFFSET + COMMITMENT_LENGTH);
        String memo = raw.substring(MEMO_OFFSET);
        return new LedgerEntry(index, flag == '1', txHash, commitment, memo);
    }

    public ClassifiedBatch classify(List<String> rawEntries, long offset, int stride) {
        if (offset < 0 || stride <= 0 || offset % stride != 0) {
            throw new InternalStateException("Batch offset " + offset + " is not aligned to stride " + stride);
        }
        List<LedgerEntry> mined = new ArrayList<>();
        List<LedgerEntry> pending = new ArrayList<>();
        for (int i = 0; i < rawEntries.size(); i++) {
            LedgerEntry entry = decode(rawEntries.get(i), offset + (long) i * stride);
            if (entry.mined()) {
                mined.add(entry);
            } else {
                pending.add(entry);
            }
        }
        return new ClassifiedBatch(offset, mined, pending);
    }
}
