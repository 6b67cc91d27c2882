package com.shieldsync.planner;

import com.shieldsync.common.PoolClientException;
import lombok.Getter;

/**
 * The requested amount plus fees cannot be covered by the account and its usable notes.
 */
@Getter
public class InsufficientFundsException extends PoolClientException {

    public static final String ERROR_CODE = "INSUFFICIENT_FUNDS";

    private final long needed;
    private final long available;

    public InsufficientFundsException(long needed, long available) {
        super(ERROR_CODE, "Insufficient funds: needed " + needed + ", available " + available);
        this.needed = needed;
        this.available = available;
    }
}
