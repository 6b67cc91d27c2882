package com.shieldsync.domain;

import java.util.List;

/**
 * Account state delta derived from mined memos.
 */
public record StateUpdate(List<AccountUpdate> newAccounts, List<Note> newNotes) {

    public StateUpdate {
        newAccounts = newAccounts == null ? List.of() : List.copyOf(newAccounts);
        newNotes = newNotes == null ? List.of() : List.copyOf(newNotes);
    }

    public static StateUpdate empty() {
        return new StateUpdate(List.of(), List.of());
    }
}
