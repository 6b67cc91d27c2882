package com.shieldsync.tx;

/**
 * Signs a deposit's nullifier with the depositor's wallet key and returns the 65-byte {@code r || s || v}
 * signature as hex. Sender address prefix and compact encoding are applied by the service.
 */
@FunctionalInterface
public interface DepositSigner {

    String sign(String nullifier);
}
