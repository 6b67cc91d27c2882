package com.shieldsync.api.dto;

public record FeeEstimateResponse(long total, long perTx, int partCount) {
}
