package com.shieldsync.ingestion.relayer;

import java.util.Locale;

public enum RelayerJobState {
    WAITING,
    ACTIVE,
    PENDING,
    COMPLETED,
    FAILED;

    /**
     * Unrecognised states count as still in progress.
     */
    public static RelayerJobState fromWire(String value) {
        if (value == null || value.isBlank()) {
            return PENDING;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return PENDING;
        }
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
