package com.shieldsync.domain;

/**
 * Pool transaction kinds with the code the relayer expects in sendTransactions.
 */
public enum TxType {
    DEPOSIT("0000"),
    TRANSFER("0001"),
    WITHDRAWAL("0002");

    private final String wireCode;

    TxType(String wireCode) {
        this.wireCode = wireCode;
    }

    public String getWireCode() {
        return wireCode;
    }
}
