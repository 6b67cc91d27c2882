package com.shieldsync.domain;

/**
 * Unit handed to the decryption capability: memo ciphertext and output commitment at a log index.
 */
public record IndexedTx(long index, String memo, String commitment) {
}
