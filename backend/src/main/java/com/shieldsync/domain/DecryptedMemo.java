package com.shieldsync.domain;

import java.util.List;

/**
 * Memo of a log entry that belongs to the owner, as returned by the decryption capability.
 *
 * @param accountPresent true when the memo carries the owner's account, i.e. the owner created the tx
 * @param txType         kind of tx; only known for memos the owner created
 * @param amount         amount the tx moved out of (or into, for deposits) the account, pool units
 * @param incomingNotes  notes in this tx addressed to the owner
 */
public record DecryptedMemo(
        long index,
        String txHash,
        boolean accountPresent,
        TxType txType,
        long amount,
        long fee,
        List<Note> incomingNotes
) {

    public DecryptedMemo {
        incomingNotes = incomingNotes == null ? List.of() : List.copyOf(incomingNotes);
    }

    public DecryptedMemo withTxHash(String hash) {
        return new DecryptedMemo(index, hash, accountPresent, txType, amount, fee, incomingNotes);
    }

    public long incomingAmount() {
        return incomingNotes.stream().mapToLong(Note::value).sum();
    }
}
