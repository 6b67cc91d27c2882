package com.shieldsync.domain;

import java.util.List;

/**
 * Immutable copy of an account's state, taken after a completed sync. Notes are ascending by index.
 */
public record AccountSnapshot(
        long nextTreeIndex,
        long accountIndex,
        long accountBalance,
        List<Note> usableNotes
) {

    public AccountSnapshot {
        usableNotes = List.copyOf(usableNotes);
    }

    public long noteBalance() {
        return usableNotes.stream().mapToLong(Note::value).sum();
    }

    public long totalBalance() {
        return accountBalance + noteBalance();
    }
}
