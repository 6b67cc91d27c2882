package com.shieldsync.common;

/**
 * Internal invariant violation (negative or misaligned index, missing state). Never retried.
 */
public class InternalStateException extends PoolClientException {

    public static final String ERROR_CODE = "INTERNAL_STATE";

    public InternalStateException(String message) {
        super(ERROR_CODE, message);
    }
}
