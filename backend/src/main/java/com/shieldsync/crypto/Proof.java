package com.shieldsync.crypto;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Transaction proof as sent to the relayer: public inputs plus the proof itself.
 */
public record Proof(JsonNode inputs, JsonNode proof) {
}
