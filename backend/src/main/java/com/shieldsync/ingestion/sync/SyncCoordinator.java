package com.shieldsync.ingestion.sync;

import com.shieldsync.common.Futures;
import com.shieldsync.common.InternalStateException;
import com.shieldsync.config.AsyncConfig;
import com.shieldsync.config.PoolProperties;
import com.shieldsync.domain.DecryptedMemo;
import com.shieldsync.domain.SyncResult;
import com.shieldsync.history.HistoryLedger;
import com.shieldsync.history.HistoryRecordMapper;
import com.shieldsync.ingestion.classifier.ClassifiedBatch;
import com.shieldsync.ingestion.relayer.RelayerGateway;
import com.shieldsync.ingestion.relayer.RelayerInfo;
import com.shieldsync.state.PoolAccount;
import com.shieldsync.state.PoolAccountRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Reconciles an asset's account state and history with the relayer's commitment log.
 *
 * <p>One cycle: read the latest confirmed index, fetch the missing range in parallel batches, apply mined
 * deltas in log order, record pending memos, trim stale pending history. Only one cycle per asset runs at a
 * time; concurrent callers wait for and share its result. A failing batch aborts the cycle, but batches
 * applied before it stay applied.
 */
@Slf4j
@Component
public class SyncCoordinator {

    /**
     * The relayer does not expose a pending-log index yet; one past the latest confirmed entry stands in for it.
     */
    static final long OPTIMISTIC_INDEX_OFFSET = 1L;

    private final PoolAccountRegistry registry;
    private final RelayerGateway relayerGateway;
    private final CommitmentBatchProcessor batchProcessor;
    private final PoolProperties poolProperties;
    private final Executor syncExecutor;

    public SyncCoordinator(
            PoolAccountRegistry registry,
            RelayerGateway relayerGateway,
            CommitmentBatchProcessor batchProcessor,
            PoolProperties poolProperties,
            @Qualifier(AsyncConfig.SYNC_EXECUTOR) Executor syncExecutor
    ) {
        this.registry = registry;
        this.relayerGateway = relayerGateway;
        this.batchProcessor = batchProcessor;
        this.poolProperties = poolProperties;
        this.syncExecutor = syncExecutor;
    }

    /**
     * Brings the asset's account up to date with the relayer.
     *
     * @return false when one of the owner's own transactions is still pending, i.e. the account is about to
     * change and must not be spent from yet
     */
    public boolean updateState(String asset) {
        PoolAccount account = registry.get(asset);
        CompletableFuture<Boolean> cycle = new CompletableFuture<>();
        CompletableFuture<Boolean> inFlight = account.claimSync(cycle);
        if (inFlight != null) {
            log.debug("Sync for {} already in flight, awaiting its result", asset);
            return Futures.joinUnwrapped(inFlight);
        }
        boolean ready;
        try {
            ready = runCycle(account);
        } catch (RuntimeException | Error e) {
            account.releaseSync(cycle);
            cycle.completeExceptionally(e);
            throw e;
        }
        account.releaseSync(cycle);
        cycle.complete(ready);
        return ready;
    }

    private boolean runCycle(PoolAccount account) {
        String asset = account.getAsset();
        int stride = poolProperties.stride();
        long startIndex = account.getState().nextTreeIndex();
        if (startIndex % stride != 0) {
            throw new InternalStateException("Next tree index " + startIndex + " of " + asset + " is not aligned to stride " + stride);
        }
        RelayerInfo info = relayerGateway.info(asset);
        long nextIndex = info.deltaIndex();
        if (nextIndex < SyncResult.NONE) {
            throw new InternalStateException("Relayer reported negative delta index " + nextIndex + " for " + asset);
        }
        long optimisticIndex = nextIndex + OPTIMISTIC_INDEX_OFFSET;
        if (optimisticIndex <= startIndex) {
            log.debug("{} is up to date at index {}", asset, startIndex);
            return true;
        }

        int batchSize = Math.max(1, poolProperties.getBatchSize());
        long span = (long) batchSize * stride;
        List<CompletableFuture<BatchOutcome>> batches = new ArrayList<>();
        for (long offset = startIndex; offset <= nextIndex; offset += span) {
            long batchOffset = offset;
            batches.add(CompletableFuture.supplyAsync(
                    () -> batchProcessor.process(asset, batchOffset, batchSize, stride), syncExecutor));
        }
        log.info("Syncing {} from index {} to {} in {} batch(es)", asset, startIndex, nextIndex, batches.size());

        boolean readyToTransact = true;
        SyncResult total = SyncResult.EMPTY;
        Set<Long> reaffirmed = new HashSet<>();
        for (CompletableFuture<BatchOutcome> future : batches) {
            BatchOutcome outcome;
            try {
                outcome = Futures.joinUnwrapped(future);
            } catch (RuntimeException e) {
                log.warn("Sync of {} aborted at batch {} of {}: {}", asset, batches.indexOf(future) + 1, batches.size(), e.getMessage());
                throw e;
            }
            readyToTransact &= applyOutcome(account, outcome, reaffirmed, stride);
            total = total.merge(outcome.batch().toSyncResult());
        }

        int trimmed = account.getHistory().trimPending(total.maxMinedIndex(), total.maxPendingIndex(), reaffirmed);
        log.info("Synced {}: {} entries, maxMined={}, maxPending={}, next index {}, {} stale pending record(s) trimmed, ready={}",
                asset, total.processedCount(), total.maxMinedIndex(), total.maxPendingIndex(),
                account.getState().nextTreeIndex(), trimmed, readyToTransact);
        return readyToTransact;
    }

    private boolean applyOutcome(PoolAccount account, BatchOutcome outcome, Set<Long> reaffirmed, int stride) {
        ClassifiedBatch batch = outcome.batch();
        Map<Long, String> hashes = batch.txHashes();
        HistoryLedger history = account.getHistory();

        if (!batch.mined().isEmpty()) {
            account.getState().apply(outcome.mined().stateUpdate(), batch.maxMinedIndex() + stride);
            for (DecryptedMemo memo : outcome.mined().decryptedMemos()) {
                HistoryRecordMapper.toRecord(withHash(memo, hashes), false).ifPresent(history::append);
            }
        }

        boolean ready = true;
        for (DecryptedMemo memo : outcome.pending().decryptedMemos()) {
            if (memo.accountPresent()) {
                ready = false;
            }
            HistoryRecordMapper.toRecord(withHash(memo, hashes), true).ifPresent(record -> {
                history.append(record);
                reaffirmed.add(record.index());
            });
        }
        return ready;
    }

    private static DecryptedMemo withHash(DecryptedMemo memo, Map<Long, String> hashes) {
        String hash = hashes.get(memo.index());
        if (hash == null) {
            throw new InternalStateException("Decrypted memo index " + memo.index() + " is not part of its batch");
        }
        return memo.withTxHash(hash);
    }
}
