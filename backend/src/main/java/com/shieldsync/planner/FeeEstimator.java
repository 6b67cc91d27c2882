package com.shieldsync.planner;

import com.shieldsync.domain.AccountSnapshot;
import com.shieldsync.domain.FeeEstimate;
import com.shieldsync.domain.TxPart;
import com.shieldsync.domain.TxType;
import com.shieldsync.ingestion.sync.SyncCoordinator;
import com.shieldsync.state.PoolAccountRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Fee totals and the largest transferable amount, computed on freshly synced state.
 */
@Component
@RequiredArgsConstructor
public class FeeEstimator {

    private final SyncCoordinator syncCoordinator;
    private final PoolAccountRegistry registry;
    private final TxPartPlanner planner;
    private final RelayerFeeResolver feeResolver;

    /**
     * @param fee explicit fee per tx; null to use the asset's fee
     * @throws InsufficientFundsException when a transfer or withdrawal of {@code amount} cannot be planned
     */
    public FeeEstimate feeEstimate(String asset, long amount, TxType txType, Long fee) {
        long feePerTx = resolveFee(asset, fee);
        if (txType == TxType.DEPOSIT) {
            registry.get(asset); // rejects unknown assets when the fee was given explicitly
            return new FeeEstimate(feePerTx, feePerTx, 1);
        }
        List<TxPart> parts = planParts(asset, amount, feePerTx);
        return new FeeEstimate(feePerTx * parts.size(), feePerTx, parts.size());
    }

    /**
     * Plans a transfer or withdrawal on freshly synced state.
     *
     * @throws InsufficientFundsException when the plan is empty
     */
    public List<TxPart> planParts(String asset, long amount, long feePerTx) {
        syncCoordinator.updateState(asset);
        AccountSnapshot snapshot = registry.get(asset).getState().snapshot();
        List<TxPart> parts = planner.plan(amount, feePerTx, snapshot.usableNotes(), snapshot.accountBalance());
        if (parts.isEmpty()) {
            throw new InsufficientFundsException(TxPartPlanner.saturatedAdd(amount, feePerTx), snapshot.totalBalance());
        }
        return parts;
    }

    /**
     * Account balance plus all notes, minus the fees of the parts needed to spend them; never negative.
     */
    public long calcMaxAvailableTransfer(String asset, Long fee) {
        long feePerTx = resolveFee(asset, fee);
        syncCoordinator.updateState(asset);
        AccountSnapshot snapshot = registry.get(asset).getState().snapshot();
        int partCount = planner.estimatedPartCount(snapshot.usableNotes().size());
        if (feePerTx > snapshot.totalBalance() / partCount) {
            return 0L;
        }
        return Math.max(0L, snapshot.totalBalance() - feePerTx * partCount);
    }

    public long resolveFee(String asset, Long fee) {
        if (fee == null) {
            return feeResolver.feePerTx(asset);
        }
        if (fee < 0) {
            throw new IllegalArgumentException("Fee must be non-negative, got: " + fee);
        }
        return fee;
    }
}
