package com.shieldsync.domain;

/**
 * Balances of one account in pool units.
 *
 * @param total      account plus notes
 * @param optimistic total adjusted by the owner's pending transactions
 */
public record Balances(long total, long account, long notes, long optimistic) {
}
