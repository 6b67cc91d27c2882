package com.shieldsync.tx;

import com.shieldsync.common.PoolClientException;
import lombok.Getter;

/**
 * Deposit exceeds the asset's configured deposit limit.
 */
@Getter
public class TxLimitException extends PoolClientException {

    public static final String ERROR_CODE = "TX_LIMIT_EXCEEDED";

    private final long amount;
    private final long limit;

    public TxLimitException(long amount, long limit) {
        super(ERROR_CODE, "Deposit amount " + amount + " exceeds the limit " + limit);
        this.amount = amount;
        this.limit = limit;
    }
}
