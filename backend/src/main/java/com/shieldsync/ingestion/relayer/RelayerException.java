package com.shieldsync.ingestion.relayer;

import com.shieldsync.common.PoolClientException;

/**
 * Relayer unreachable or answered with an HTTP/transport error.
 */
public class RelayerException extends PoolClientException {

    public static final String ERROR_CODE = "RELAYER_UNAVAILABLE";

    public RelayerException(String message) {
        super(ERROR_CODE, message);
    }

    public RelayerException(String message, Throwable cause) {
        super(ERROR_CODE, message, cause);
    }
}
