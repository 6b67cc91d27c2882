package com.shieldsync.api.dto;

import com.shieldsync.domain.HistoryTransactionType;

public record HistoryItemResponse(
        long index,
        HistoryTransactionType type,
        long amount,
        long fee,
        boolean pending,
        String txHash
) {
}
