package com.shieldsync.domain;

/**
 * Spendable note owned by the account. Value is in pool units.
 */
public record Note(long index, long value) {

    public Note {
        if (index < 0) {
            throw new IllegalArgumentException("Note index must be non-negative, got: " + index);
        }
        if (value < 0) {
            throw new IllegalArgumentException("Note value must be non-negative, got: " + value);
        }
    }
}
