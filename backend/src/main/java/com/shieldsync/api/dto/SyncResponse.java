package com.shieldsync.api.dto;

public record SyncResponse(String asset, boolean readyToTransact) {
}
