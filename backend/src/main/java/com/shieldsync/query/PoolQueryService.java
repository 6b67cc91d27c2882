package com.shieldsync.query;

import com.shieldsync.domain.AccountSnapshot;
import com.shieldsync.domain.Balances;
import com.shieldsync.domain.HistoryRecord;
import com.shieldsync.ingestion.sync.SyncCoordinator;
import com.shieldsync.state.PoolAccount;
import com.shieldsync.state.PoolAccountRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Read side: balances and history, each after a sync so they reflect the relayer's latest log.
 */
@Service
@RequiredArgsConstructor
public class PoolQueryService {

    private final SyncCoordinator syncCoordinator;
    private final PoolAccountRegistry registry;

    public Balances getBalances(String asset) {
        PoolAccount account = registry.get(asset);
        syncCoordinator.updateState(asset);
        AccountSnapshot snapshot = account.getState().snapshot();
        long total = snapshot.totalBalance();
        return new Balances(total, snapshot.accountBalance(), snapshot.noteBalance(),
                account.getHistory().optimisticBalance(total));
    }

    /**
     * Confirmed and pending records in log order.
     */
    public List<HistoryRecord> getHistory(String asset) {
        PoolAccount account = registry.get(asset);
        syncCoordinator.updateState(asset);
        return account.getHistory().records();
    }
}
