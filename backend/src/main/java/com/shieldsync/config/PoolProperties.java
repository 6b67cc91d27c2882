package com.shieldsync.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.HexFormat;

/**
 * Pool protocol constants and client polling settings. Documented in application.yml.
 */
@ConfigurationProperties(prefix = "shieldsync.pool")
@NoArgsConstructor
@Getter
@Setter
public class PoolProperties {

    /** Note outputs per transaction. Log index stride is this plus one (the account leaf). */
    private int outputsPerTx = 127;

    /** Maximum input notes one transaction may spend, besides the account. */
    private int maxInputs = 3;

    /** Log entries requested per /transactions call. */
    private int batchSize = 100;

    /** Smallest amount (pool units) a single transaction may carry. */
    private long minTxAmount = 50_000_000L;

    /** Interval between sync attempts while waiting to become ready to transact. */
    private long readyPollIntervalMs = 5_000L;

    /** Sync attempts before waitReadyToTransact gives up and reports "not ready". */
    private int readyMaxAttempts = 10;

    /** Interval between relayer job status polls. */
    private long jobPollIntervalMs = 1_000L;

    /** Job polls before a submitted tx is reported as failed. */
    private int jobPollMaxAttempts = 300;

    /** Spending key, hex encoded. Only handed to the decryption capability. */
    private String spendingKey;

    public int stride() {
        return outputsPerTx + 1;
    }

    public byte[] spendingKeyBytes() {
        if (spendingKey == null || spendingKey.isBlank()) {
            return new byte[0];
        }
        String hex = spendingKey.startsWith("0x") ? spendingKey.substring(2) : spendingKey;
        return HexFormat.of().parseHex(hex);
    }
}
