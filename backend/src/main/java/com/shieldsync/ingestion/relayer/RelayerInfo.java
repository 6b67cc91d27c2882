package com.shieldsync.ingestion.relayer;

/**
 * GET /info. deltaIndex is the index of the latest confirmed log entry.
 */
public record RelayerInfo(String root, long deltaIndex) {
}
