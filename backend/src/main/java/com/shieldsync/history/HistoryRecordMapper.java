package com.shieldsync.history;

import com.shieldsync.common.InternalStateException;
import com.shieldsync.domain.DecryptedMemo;
import com.shieldsync.domain.HistoryRecord;
import com.shieldsync.domain.HistoryTransactionType;

import java.util.Optional;

/**
 * Maps a decrypted memo to the history record it stands for. Memos carrying the owner's account were
 * created by the owner; others can only bring incoming notes.
 */
public final class HistoryRecordMapper {

    private HistoryRecordMapper() {
    }

    public static Optional<HistoryRecord> toRecord(DecryptedMemo memo, boolean pending) {
        if (memo.accountPresent()) {
            if (memo.txType() == null) {
                throw new InternalStateException("Own memo at index " + memo.index() + " has no tx type");
            }
            HistoryTransactionType type = switch (memo.txType()) {
                case DEPOSIT -> HistoryTransactionType.DEPOSIT;
                case WITHDRAWAL -> HistoryTransactionType.WITHDRAWAL;
                case TRANSFER -> HistoryTransactionType.TRANSFER_OUT;
            };
            return Optional.of(new HistoryRecord(type, memo.amount(), memo.fee(), pending, memo.txHash(), memo.index()));
        }
        long incoming = memo.incomingAmount();
        if (incoming > 0) {
            return Optional.of(new HistoryRecord(
                    HistoryTransactionType.TRANSFER_IN, incoming, 0L, pending, memo.txHash(), memo.index()));
        }
        return Optional.empty();
    }
}
