package com.shieldsync.state;

import com.shieldsync.common.InternalStateException;
import com.shieldsync.domain.AccountSnapshot;
import com.shieldsync.domain.AccountUpdate;
import com.shieldsync.domain.Note;
import com.shieldsync.domain.StateUpdate;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.TreeMap;

/**
 * Local view of the owner's account in one pool: next free log index, unspent notes and account balance.
 * Only the sync coordinator mutates it, through {@link #apply(StateUpdate, long)}; everyone else reads snapshots.
 * Notes are kept ascending by index, which is the spend order the planner relies on.
 */
public class AccountState {

    private final TreeMap<Long, Note> notes = new TreeMap<>();
    private long nextTreeIndex;
    private long accountIndex = -1L;
    private long accountBalance;
    private long spentNoteBoundary;

    public synchronized long nextTreeIndex() {
        return nextTreeIndex;
    }

    /**
     * Applies a delta derived from mined memos and moves the next free index forward to {@code nextIndex}.
     * The index never moves backwards; account leaves older than the current one are ignored.
     */
    public synchronized void apply(StateUpdate update, long nextIndex) {
        if (nextIndex < 0) {
            throw new InternalStateException("Negative tree index: " + nextIndex);
        }
        for (Note note : update.newNotes()) {
            if (note.index() < spentNoteBoundary || note.value() == 0) {
                continue;
            }
            notes.put(note.index(), note);
        }
        List<AccountUpdate> accounts = new ArrayList<>(update.newAccounts());
        accounts.sort(Comparator.comparingLong(AccountUpdate::index));
        for (AccountUpdate account : accounts) {
            if (account.index() < accountIndex) {
                continue;
            }
            if (account.balance() < 0) {
                throw new InternalStateException("Negative account balance at index " + account.index());
            }
            accountIndex = account.index();
            accountBalance = account.balance();
            spentNoteBoundary = Math.max(spentNoteBoundary, account.spentNoteBoundary());
            notes.headMap(spentNoteBoundary).clear();
        }
        nextTreeIndex = Math.max(nextTreeIndex, nextIndex);
    }

    public synchronized AccountSnapshot snapshot() {
        return new AccountSnapshot(nextTreeIndex, accountIndex, accountBalance, new ArrayList<>(notes.values()));
    }

    /**
     * Forgets everything; used on shutdown.
     */
    public synchronized void wipe() {
        notes.clear();
        nextTreeIndex = 0L;
        accountIndex = -1L;
        accountBalance = 0L;
        spentNoteBoundary = 0L;
    }
}
