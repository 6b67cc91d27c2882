package com.shieldsync.crypto;

import com.shieldsync.domain.AccountSnapshot;
import com.shieldsync.domain.TxOutput;

import java.util.List;

/**
 * Builds transaction inputs (which notes to spend, new account, encrypted memo) for one tx part.
 * Supplied by the deployment together with {@link CryptoCapability}. Amounts are pool units.
 */
public interface TxDataFactory {

    TxData createDeposit(AccountSnapshot account, long amount, long fee);

    /**
     * @param outputs recipients of this tx; their amounts sum to the part amount
     */
    TxData createTransfer(AccountSnapshot account, List<TxOutput> outputs, long fee);

    TxData createWithdraw(AccountSnapshot account, String to, long amount, long fee);
}
