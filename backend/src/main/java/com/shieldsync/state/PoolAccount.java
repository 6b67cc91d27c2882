package com.shieldsync.state;

import com.shieldsync.common.TxInvalidArgumentException;
import com.shieldsync.history.HistoryLedger;
import lombok.Getter;

import java.math.BigInteger;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Everything the client holds for one asset: account state, history, unit conversion and the
 * single-flight slot that admits one sync cycle at a time.
 */
@Getter
public class PoolAccount {

    private final String asset;
    private final long denominator;
    private final Long depositLimit;
    private final boolean compactSignature;
    private final AccountState state = new AccountState();
    private final HistoryLedger history = new HistoryLedger();
    private final AtomicReference<CompletableFuture<Boolean>> inFlightSync = new AtomicReference<>();

    public PoolAccount(String asset, long denominator, Long depositLimit) {
        this(asset, denominator, depositLimit, false);
    }

    public PoolAccount(String asset, long denominator, Long depositLimit, boolean compactSignature) {
        if (denominator <= 0) {
            throw new IllegalArgumentException("Denominator must be positive for " + asset + ", got: " + denominator);
        }
        this.asset = asset;
        this.denominator = denominator;
        this.depositLimit = depositLimit;
        this.compactSignature = compactSignature;
    }

    /**
     * Installs {@code cycle} as the in-flight sync unless another one is already running.
     *
     * @return the cycle already in flight, or null when {@code cycle} was installed
     */
    public CompletableFuture<Boolean> claimSync(CompletableFuture<Boolean> cycle) {
        while (true) {
            CompletableFuture<Boolean> current = inFlightSync.get();
            if (current != null) {
                return current;
            }
            if (inFlightSync.compareAndSet(null, cycle)) {
                return null;
            }
        }
    }

    public void releaseSync(CompletableFuture<Boolean> cycle) {
        inFlightSync.compareAndSet(cycle, null);
    }

    public boolean isSyncInFlight() {
        return inFlightSync.get() != null;
    }

    /**
     * Wei to pool units (integer division, remainder dropped).
     *
     * @throws TxInvalidArgumentException when the result does not fit in pool units
     */
    public long toPoolUnits(BigInteger amountWei) {
        BigInteger units = amountWei.divide(BigInteger.valueOf(denominator));
        if (units.bitLength() > 63) {
            throw new TxInvalidArgumentException("Amount " + amountWei + " wei is out of range for " + asset);
        }
        return units.longValue();
    }
}
