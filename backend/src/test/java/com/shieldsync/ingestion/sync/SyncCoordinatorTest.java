package com.shieldsync.ingestion.sync;

import com.fasterxml.jackson.databind.JsonNode;
import com.shieldsync.common.InternalStateException;
import com.shieldsync.config.AssetProperties;
import com.shieldsync.config.PoolProperties;
import com.shieldsync.crypto.CryptoCapability;
import com.shieldsync.crypto.DecryptionResult;
import com.shieldsync.crypto.Proof;
import com.shieldsync.domain.AccountUpdate;
import com.shieldsync.domain.DecryptedMemo;
import com.shieldsync.domain.HistoryRecord;
import com.shieldsync.domain.HistoryTransactionType;
import com.shieldsync.domain.IndexedTx;
import com.shieldsync.domain.Note;
import com.shieldsync.domain.StateUpdate;
import com.shieldsync.domain.TxType;
import com.shieldsync.ingestion.classifier.LedgerEntryClassifier;
import com.shieldsync.ingestion.relayer.RelayerException;
import com.shieldsync.ingestion.relayer.RelayerGateway;
import com.shieldsync.ingestion.relayer.RelayerInfo;
import com.shieldsync.state.PoolAccount;
import com.shieldsync.state.PoolAccountRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SyncCoordinatorTest {

    private static final String ASSET = "0xtoken";
    private static final int STRIDE = 4;

    @Mock
    private RelayerGateway relayerGateway;

    private final ConcurrentSkipListMap<Long, String> relayerLog = new ConcurrentSkipListMap<>();
    private final FakeCrypto crypto = new FakeCrypto();
    private ExecutorService executor;
    private PoolAccountRegistry registry;
    private SyncCoordinator coordinator;

    @BeforeEach
    void setUp() {
        PoolProperties pool = new PoolProperties();
        pool.setOutputsPerTx(STRIDE - 1);
        pool.setBatchSize(2);
        pool.setSpendingKey("0a0b");
        AssetProperties assets = new AssetProperties();
        assets.setAssets(Map.of(ASSET, new AssetProperties.AssetEntry()));
        registry = new PoolAccountRegistry(assets, pool);
        executor = Executors.newFixedThreadPool(4);
        CommitmentBatchProcessor processor = new CommitmentBatchProcessor(
                relayerGateway, new LedgerEntryClassifier(), crypto, registry);
        coordinator = new SyncCoordinator(registry, relayerGateway, processor, pool, executor);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private PoolAccount account() {
        return registry.get(ASSET);
    }

    private void serveLog() {
        when(relayerGateway.fetchTransactions(eq(ASSET), anyLong(), anyInt())).thenAnswer(inv -> {
            long offset = inv.getArgument(1);
            int limit = inv.getArgument(2);
            List<String> out = new ArrayList<>();
            for (int i = 0; i < limit; i++) {
                String raw = relayerLog.get(offset + (long) i * STRIDE);
                if (raw == null) {
                    break;
                }
                out.add(raw);
            }
            return out;
        });
    }

    private void relayerAt(long deltaIndex) {
        when(relayerGateway.info(ASSET)).thenReturn(new RelayerInfo("root", deltaIndex));
    }

    private void logEntry(long index, boolean mined) {
        relayerLog.put(index, (mined ? "1" : "0") + String.format("%064x", index) + "0".repeat(64) + "memo" + index);
    }

    private static String hashOf(long index) {
        return "0x" + String.format("%064x", index);
    }

    private void incomingNote(long index, long value) {
        crypto.memos.put(index, new DecryptedMemo(index, null, false, null, 0L, 0L, List.of(new Note(index + 1, value))));
    }

    private void ownTx(long index, TxType type, long amount, long fee, long newBalance, long spentBoundary) {
        crypto.memos.put(index, new DecryptedMemo(index, null, true, type, amount, fee, List.of()));
        crypto.accounts.put(index, new AccountUpdate(index, newBalance, spentBoundary));
    }

    @Test
    @DisplayName("nothing to fetch when the relayer has no entries past the local index")
    void updateState_upToDate_returnsReadyWithoutFetching() {
        relayerAt(-1L);

        assertThat(coordinator.updateState(ASSET)).isTrue();

        verify(relayerGateway, never()).fetchTransactions(eq(ASSET), anyLong(), anyInt());
        assertThat(account().getState().nextTreeIndex()).isZero();
    }

    @Test
    @DisplayName("a second sync against an unchanged relayer fetches nothing")
    void updateState_isIdempotent() {
        logEntry(0L, true);
        logEntry(4L, true);
        incomingNote(4L, 70L);
        relayerAt(4L);
        serveLog();

        assertThat(coordinator.updateState(ASSET)).isTrue();
        long indexAfterFirst = account().getState().nextTreeIndex();
        assertThat(coordinator.updateState(ASSET)).isTrue();

        assertThat(indexAfterFirst).isEqualTo(8L);
        assertThat(account().getState().nextTreeIndex()).isEqualTo(8L);
        verify(relayerGateway, times(1)).fetchTransactions(eq(ASSET), anyLong(), anyInt());
        assertThat(account().getHistory().records()).hasSize(1);
    }

    @Test
    @DisplayName("the range is fetched in parallel batches and applied in log order")
    void updateState_appliesAllBatches() {
        for (long i = 0; i <= 16; i += STRIDE) {
            logEntry(i, true);
        }
        incomingNote(0L, 10L);
        incomingNote(8L, 20L);
        ownTx(16L, TxType.DEPOSIT, 500L, 1L, 500L, 0L);
        relayerAt(16L);
        serveLog();

        assertThat(coordinator.updateState(ASSET)).isTrue();

        verify(relayerGateway).fetchTransactions(ASSET, 0L, 2);
        verify(relayerGateway).fetchTransactions(ASSET, 8L, 2);
        verify(relayerGateway).fetchTransactions(ASSET, 16L, 2);
        assertThat(account().getState().nextTreeIndex()).isEqualTo(20L);
        assertThat(account().getState().snapshot().totalBalance()).isEqualTo(530L);
        assertThat(account().getHistory().records())
                .extracting(HistoryRecord::index, HistoryRecord::type, HistoryRecord::txHash)
                .containsExactly(
                        tuple(0L, HistoryTransactionType.TRANSFER_IN, hashOf(0L)),
                        tuple(8L, HistoryTransactionType.TRANSFER_IN, hashOf(8L)),
                        tuple(16L, HistoryTransactionType.DEPOSIT, hashOf(16L)));
    }

    @Test
    @DisplayName("an own pending transaction blocks spending until it is mined")
    void updateState_ownPending_notReadyUntilMined() {
        logEntry(0L, true);
        incomingNote(0L, 100L);
        logEntry(4L, false);
        ownTx(4L, TxType.TRANSFER, 60L, 5L, 35L, 4L);
        relayerAt(4L);
        serveLog();

        assertThat(coordinator.updateState(ASSET)).isFalse();
        assertThat(account().getState().nextTreeIndex()).isEqualTo(4L);
        assertThat(account().getHistory().pendingRecords())
                .singleElement()
                .satisfies(r -> {
                    assertThat(r.index()).isEqualTo(4L);
                    assertThat(r.type()).isEqualTo(HistoryTransactionType.TRANSFER_OUT);
                });
        assertThat(account().getHistory().optimisticBalance(100L)).isEqualTo(35L);

        logEntry(4L, true);

        assertThat(coordinator.updateState(ASSET)).isTrue();
        assertThat(account().getState().nextTreeIndex()).isEqualTo(8L);
        assertThat(account().getState().snapshot().totalBalance()).isEqualTo(35L);
        assertThat(account().getHistory().pendingRecords()).isEmpty();
        assertThat(account().getHistory().records()).hasSize(2);
    }

    @Test
    @DisplayName("pending records are trimmed against the highest mined and pending index")
    void updateState_trimsStalePendingHistory() {
        account().getState().apply(StateUpdate.empty(), 496L);
        account().getHistory().append(new HistoryRecord(HistoryTransactionType.TRANSFER_OUT, 10L, 1L, true, hashOf(500L), 500L));
        account().getHistory().append(new HistoryRecord(HistoryTransactionType.TRANSFER_IN, 10L, 0L, true, hashOf(508L), 508L));
        logEntry(496L, true);
        logEntry(500L, true);
        ownTx(500L, TxType.TRANSFER, 10L, 1L, 0L, 0L);
        logEntry(504L, false);
        incomingNote(504L, 40L);
        relayerAt(504L);
        serveLog();

        assertThat(coordinator.updateState(ASSET)).isTrue();

        assertThat(account().getHistory().records())
                .extracting(HistoryRecord::index, HistoryRecord::pending)
                .containsExactly(
                        tuple(500L, false),
                        tuple(504L, true));
    }

    @Test
    @DisplayName("concurrent callers share one in-flight cycle")
    void updateState_singleFlight() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(relayerGateway.info(ASSET)).thenAnswer(inv -> {
            entered.countDown();
            release.await(5, TimeUnit.SECONDS);
            return new RelayerInfo("root", -1L);
        });

        AtomicReference<Boolean> first = new AtomicReference<>();
        AtomicReference<Boolean> second = new AtomicReference<>();
        Thread a = new Thread(() -> first.set(coordinator.updateState(ASSET)));
        a.start();
        assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(account().isSyncInFlight()).isTrue();

        Thread b = new Thread(() -> second.set(coordinator.updateState(ASSET)));
        b.start();
        long deadline = System.currentTimeMillis() + 5_000;
        while (b.getState() != Thread.State.WAITING && System.currentTimeMillis() < deadline) {
            Thread.sleep(5);
        }
        release.countDown();
        a.join(5_000);
        b.join(5_000);

        assertThat(first.get()).isTrue();
        assertThat(second.get()).isTrue();
        verify(relayerGateway, times(1)).info(ASSET);
        assertThat(account().isSyncInFlight()).isFalse();
    }

    @Test
    @DisplayName("a failed cycle clears the guard so the next call runs")
    void updateState_failureClearsGuard() {
        when(relayerGateway.info(ASSET))
                .thenThrow(new RelayerException("relayer down"))
                .thenReturn(new RelayerInfo("root", -1L));

        assertThatThrownBy(() -> coordinator.updateState(ASSET)).isInstanceOf(RelayerException.class);
        assertThat(account().isSyncInFlight()).isFalse();
        assertThat(coordinator.updateState(ASSET)).isTrue();
    }

    @Test
    @DisplayName("batches before a failing batch stay applied")
    void updateState_batchFailure_keepsEarlierBatches() {
        for (long i = 0; i <= 16; i += STRIDE) {
            logEntry(i, true);
        }
        incomingNote(4L, 25L);
        incomingNote(16L, 99L);
        relayerAt(16L);
        serveLog();
        when(relayerGateway.fetchTransactions(ASSET, 8L, 2)).thenThrow(new RelayerException("timeout"));

        assertThatThrownBy(() -> coordinator.updateState(ASSET))
                .isInstanceOf(RelayerException.class)
                .hasMessageContaining("timeout");

        assertThat(account().getState().nextTreeIndex()).isEqualTo(8L);
        assertThat(account().getState().snapshot().totalBalance()).isEqualTo(25L);
        assertThat(account().isSyncInFlight()).isFalse();
    }

    @Test
    void updateState_misalignedIndex_throwsInternalState() {
        account().getState().apply(StateUpdate.empty(), 6L);

        assertThatThrownBy(() -> coordinator.updateState(ASSET))
                .isInstanceOf(InternalStateException.class)
                .hasMessageContaining("not aligned");
        assertThat(account().isSyncInFlight()).isFalse();
    }

    /**
     * Deterministic decryption: memos and account leaves are registered per log index up front.
     */
    static final class FakeCrypto implements CryptoCapability {

        final Map<Long, DecryptedMemo> memos = new ConcurrentHashMap<>();
        final Map<Long, AccountUpdate> accounts = new ConcurrentHashMap<>();

        @Override
        public DecryptionResult decrypt(byte[] secretKey, List<IndexedTx> indexedTxs) {
            List<DecryptedMemo> found = new ArrayList<>();
            List<AccountUpdate> newAccounts = new ArrayList<>();
            List<Note> newNotes = new ArrayList<>();
            for (IndexedTx tx : indexedTxs) {
                DecryptedMemo memo = memos.get(tx.index());
                if (memo == null) {
                    continue;
                }
                found.add(memo);
                newNotes.addAll(memo.incomingNotes());
                AccountUpdate account = accounts.get(tx.index());
                if (account != null) {
                    newAccounts.add(account);
                }
            }
            return new DecryptionResult(found, new StateUpdate(newAccounts, newNotes));
        }

        @Override
        public boolean isValidAddress(String address) {
            return true;
        }

        @Override
        public Proof prove(JsonNode publicInputs, JsonNode secretInputs) {
            throw new UnsupportedOperationException();
        }

        @Override
        public boolean verify(JsonNode verifyingKey, JsonNode publicInputs, JsonNode proof) {
            throw new UnsupportedOperationException();
        }

        @Override
        public JsonNode transferVerifyingKey() {
            throw new UnsupportedOperationException();
        }
    }
}
