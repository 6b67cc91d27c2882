package com.shieldsync.domain;

public record FeeEstimate(long total, long perTx, int partCount) {
}
