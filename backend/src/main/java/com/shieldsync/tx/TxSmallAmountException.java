package com.shieldsync.tx;

import com.shieldsync.common.PoolClientException;
import lombok.Getter;

@Getter
public class TxSmallAmountException extends PoolClientException {

    public static final String ERROR_CODE = "TX_AMOUNT_TOO_SMALL";

    private final long amount;
    private final long minAmount;

    public TxSmallAmountException(long amount, long minAmount) {
        super(ERROR_CODE, "Transaction amount " + amount + " is below the minimum " + minAmount);
        this.amount = amount;
        this.minAmount = minAmount;
    }
}
