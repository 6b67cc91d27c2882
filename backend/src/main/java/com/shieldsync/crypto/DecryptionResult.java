package com.shieldsync.crypto;

import com.shieldsync.domain.DecryptedMemo;
import com.shieldsync.domain.StateUpdate;

import java.util.List;

public record DecryptionResult(List<DecryptedMemo> decryptedMemos, StateUpdate stateUpdate) {

    public DecryptionResult {
        decryptedMemos = decryptedMemos == null ? List.of() : List.copyOf(decryptedMemos);
        stateUpdate = stateUpdate == null ? StateUpdate.empty() : stateUpdate;
    }

    public static DecryptionResult empty() {
        return new DecryptionResult(List.of(), StateUpdate.empty());
    }
}
