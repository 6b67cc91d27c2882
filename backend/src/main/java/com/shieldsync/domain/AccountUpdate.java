package com.shieldsync.domain;

/**
 * New account leaf for the owner.
 *
 * @param spentNoteBoundary notes with an index below this value were consumed by the tx
 */
public record AccountUpdate(long index, long balance, long spentNoteBoundary) {
}
