package com.shieldsync.domain;

/**
 * One elementary transaction of a (possibly multi-part) transfer or withdrawal.
 *
 * @param accountLimit input value available to this part (account contribution plus its note chunk);
 *                     amount + fee never exceeds it
 */
public record TxPart(long amount, long fee, long accountLimit) {
}
