package com.shieldsync.crypto;

import com.fasterxml.jackson.databind.JsonNode;
import com.shieldsync.domain.IndexedTx;

import java.util.List;

/**
 * Note decryption and zero-knowledge proving, supplied by the deployment (native prover, remote
 * prover service, or a deterministic double in tests). Implementations must be thread-safe: the sync
 * coordinator decrypts several batches in parallel.
 */
public interface CryptoCapability {

    /**
     * Decrypts the memos that belong to the owner of {@code secretKey} and derives the state delta they imply.
     * Entries that do not belong to the owner produce no memo.
     */
    DecryptionResult decrypt(byte[] secretKey, List<IndexedTx> indexedTxs);

    /**
     * Whether {@code address} is a well-formed shielded address (checksum included).
     */
    boolean isValidAddress(String address);

    Proof prove(JsonNode publicInputs, JsonNode secretInputs);

    boolean verify(JsonNode verifyingKey, JsonNode publicInputs, JsonNode proof);

    /**
     * Verifying key of the transfer circuit, used to check every proof before submission.
     */
    JsonNode transferVerifyingKey();
}
