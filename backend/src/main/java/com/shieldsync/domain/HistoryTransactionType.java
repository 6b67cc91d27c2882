package com.shieldsync.domain;

public enum HistoryTransactionType {
    DEPOSIT(true),
    TRANSFER_IN(true),
    TRANSFER_OUT(false),
    WITHDRAWAL(false);

    private final boolean incoming;

    HistoryTransactionType(boolean incoming) {
        this.incoming = incoming;
    }

    public boolean isIncoming() {
        return incoming;
    }
}
