package com.shieldsync.domain;

import java.math.BigInteger;

/**
 * One recipient of a shielded transfer as requested by the caller; amount in wei.
 */
public record TransferOutput(String to, BigInteger amountWei) {
}
