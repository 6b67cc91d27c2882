package com.shieldsync.domain;

/**
 * One output of a transfer tx: shielded recipient address and amount in pool units.
 */
public record TxOutput(String to, long amount) {
}
