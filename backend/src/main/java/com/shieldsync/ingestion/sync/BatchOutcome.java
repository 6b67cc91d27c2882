package com.shieldsync.ingestion.sync;

import com.shieldsync.crypto.DecryptionResult;
import com.shieldsync.ingestion.classifier.ClassifiedBatch;

/**
 * Fetched, classified and decrypted batch, not yet applied to the account.
 */
public record BatchOutcome(ClassifiedBatch batch, DecryptionResult mined, DecryptionResult pending) {
}
