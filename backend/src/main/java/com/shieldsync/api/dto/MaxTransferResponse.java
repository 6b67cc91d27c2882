package com.shieldsync.api.dto;

public record MaxTransferResponse(String asset, long maxAmount) {
}
