package com.shieldsync.history;

import com.shieldsync.domain.HistoryRecord;
import com.shieldsync.domain.HistoryTransactionType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class HistoryLedgerTest {

    private final HistoryLedger ledger = new HistoryLedger();

    private static HistoryRecord pending(HistoryTransactionType type, long amount, long fee, long index) {
        return new HistoryRecord(type, amount, fee, true, "0x" + index, index);
    }

    private static HistoryRecord confirmed(HistoryTransactionType type, long amount, long fee, long index) {
        return new HistoryRecord(type, amount, fee, false, "0x" + index, index);
    }

    @Test
    void records_areInIndexOrder() {
        ledger.append(confirmed(HistoryTransactionType.DEPOSIT, 100L, 1L, 256L));
        ledger.append(confirmed(HistoryTransactionType.TRANSFER_IN, 50L, 0L, 0L));

        assertThat(ledger.records()).extracting(HistoryRecord::index).containsExactly(0L, 256L);
    }

    @Test
    @DisplayName("a pending record never replaces a confirmed one")
    void append_pendingDoesNotOverrideConfirmed() {
        ledger.append(confirmed(HistoryTransactionType.DEPOSIT, 100L, 1L, 128L));
        ledger.append(pending(HistoryTransactionType.DEPOSIT, 100L, 1L, 128L));

        assertThat(ledger.records()).singleElement().extracting(HistoryRecord::pending).isEqualTo(false);
    }

    @Test
    void append_confirmationOfSameTx_flipsPending() {
        ledger.append(pending(HistoryTransactionType.WITHDRAWAL, 70L, 5L, 128L));
        ledger.append(confirmed(HistoryTransactionType.WITHDRAWAL, 70L, 5L, 128L));

        assertThat(ledger.pendingRecords()).isEmpty();
        assertThat(ledger.records()).hasSize(1);
    }

    @Test
    void markConfirmed_withoutPendingRecord_returnsFalse() {
        assertThat(ledger.markConfirmed(7L)).isFalse();
    }

    @Test
    @DisplayName("trim drops pending records at or below maxMined and stale ones beyond maxPending")
    void trimPending_dropsSupersededAndStale() {
        ledger.append(pending(HistoryTransactionType.TRANSFER_OUT, 10L, 1L, 4L));
        ledger.append(pending(HistoryTransactionType.TRANSFER_OUT, 10L, 1L, 500L));
        ledger.append(pending(HistoryTransactionType.TRANSFER_OUT, 10L, 1L, 504L));
        ledger.append(pending(HistoryTransactionType.TRANSFER_OUT, 10L, 1L, 508L));
        ledger.append(confirmed(HistoryTransactionType.DEPOSIT, 100L, 1L, 0L));

        int removed = ledger.trimPending(500L, 504L, Set.of(504L));

        assertThat(removed).isEqualTo(3);
        assertThat(ledger.records()).extracting(HistoryRecord::index).containsExactly(0L, 504L);
    }

    @Test
    void trimPending_keepsReaffirmedBeyondMaxPending() {
        ledger.append(pending(HistoryTransactionType.TRANSFER_IN, 10L, 0L, 640L));

        assertThat(ledger.trimPending(512L, -1L, Set.of(640L))).isZero();
    }

    @Test
    @DisplayName("optimistic balance adds pending incoming and subtracts pending outgoing with fee")
    void optimisticBalance() {
        ledger.append(confirmed(HistoryTransactionType.DEPOSIT, 1_000L, 10L, 0L));
        ledger.append(pending(HistoryTransactionType.TRANSFER_IN, 200L, 0L, 128L));
        ledger.append(pending(HistoryTransactionType.TRANSFER_OUT, 300L, 10L, 256L));
        ledger.append(pending(HistoryTransactionType.WITHDRAWAL, 100L, 10L, 384L));

        assertThat(ledger.optimisticBalance(1_000L)).isEqualTo(1_000L + 200L - 310L - 110L);
    }
}
