package com.shieldsync.ingestion.relayer;

import com.shieldsync.common.PoolClientException;
import lombok.Getter;

/**
 * Relayer job reported failed, is unknown to the relayer, or never completed within the poll budget.
 */
@Getter
public class RelayerJobException extends PoolClientException {

    public static final String ERROR_CODE = "RELAYER_JOB_FAILED";

    private final String jobId;
    private final String reason;

    public RelayerJobException(String jobId, String reason) {
        super(ERROR_CODE, "Job " + jobId + " failed with reason: " + reason);
        this.jobId = jobId;
        this.reason = reason;
    }
}
