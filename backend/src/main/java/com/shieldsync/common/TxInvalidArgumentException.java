package com.shieldsync.common;

/**
 * Caller-supplied transaction argument the pool cannot accept: a recipient that is not a shielded address,
 * an amount outside the pool's unit range, an output list the circuit cannot carry.
 */
public class TxInvalidArgumentException extends PoolClientException {

    public static final String ERROR_CODE = "TX_INVALID_ARGUMENT";

    public TxInvalidArgumentException(String message) {
        super(ERROR_CODE, message);
    }
}
