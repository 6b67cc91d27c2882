package com.shieldsync.ingestion.sync;

import com.shieldsync.crypto.CryptoCapability;
import com.shieldsync.crypto.DecryptionResult;
import com.shieldsync.domain.IndexedTx;
import com.shieldsync.ingestion.classifier.ClassifiedBatch;
import com.shieldsync.ingestion.classifier.LedgerEntryClassifier;
import com.shieldsync.ingestion.relayer.RelayerGateway;
import com.shieldsync.state.PoolAccountRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;

/**
 * Fetches one batch of log entries, classifies it and decrypts mined and pending entries separately.
 * Touches no account state, so batches of a cycle can run in parallel.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CommitmentBatchProcessor {

    private final RelayerGateway relayerGateway;
    private final LedgerEntryClassifier classifier;
    private final CryptoCapability cryptoCapability;
    private final PoolAccountRegistry registry;

    public BatchOutcome process(String asset, long offset, int limit, int stride) {
        List<String> raw = relayerGateway.fetchTransactions(asset, offset, limit);
        ClassifiedBatch batch = classifier.classify(raw, offset, stride);
        DecryptionResult mined = decrypt(batch.minedTxs());
        DecryptionResult pending = decrypt(batch.pendingTxs());
        log.debug("Batch {}@{}: {} mined, {} pending, {} own mined memo(s), {} own pending memo(s)",
                asset, offset, batch.mined().size(), batch.pending().size(),
                mined.decryptedMemos().size(), pending.decryptedMemos().size());
        return new BatchOutcome(batch, mined, pending);
    }

    private DecryptionResult decrypt(List<IndexedTx> txs) {
        if (txs.isEmpty()) {
            return DecryptionResult.empty();
        }
        byte[] key = registry.spendingKey();
        try {
            return cryptoCapability.decrypt(key, txs);
        } finally {
            Arrays.fill(key, (byte) 0);
        }
    }
}
