package com.shieldsync.tx;

import com.shieldsync.common.PoolClientException;

/**
 * Locally generated proof did not verify. The transaction is never sent.
 */
public class TxProofException extends PoolClientException {

    public static final String ERROR_CODE = "TX_PROOF_INVALID";

    public TxProofException(String message) {
        super(ERROR_CODE, message);
    }
}
