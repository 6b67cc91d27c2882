package com.shieldsync.crypto;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Prover inputs and memo for one transaction, built from an account snapshot.
 *
 * @param nullifier hex nullifier; deposits are signed over it
 */
public record TxData(JsonNode publicInputs, JsonNode secretInputs, String memo, String nullifier) {
}
