package com.shieldsync.tx;

import com.shieldsync.config.PoolProperties;
import com.shieldsync.ingestion.relayer.RelayerGateway;
import com.shieldsync.ingestion.relayer.RelayerJob;
import com.shieldsync.ingestion.relayer.RelayerJobException;
import com.shieldsync.ingestion.relayer.RelayerJobState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Polls a relayer job until it completes, fails, or the poll budget runs out.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JobTracker {

    private final RelayerGateway relayerGateway;
    private final PoolProperties poolProperties;

    /**
     * @return tx hashes of the completed job
     * @throws RelayerJobException when the job failed, is unknown to the relayer, or did not finish in time
     */
    public List<String> waitForJob(String asset, String jobId) {
        int attempts = Math.max(1, poolProperties.getJobPollMaxAttempts());
        for (int attempt = 1; attempt <= attempts; attempt++) {
            Optional<RelayerJob> job = relayerGateway.getJob(asset, jobId);
            if (job.isEmpty()) {
                throw new RelayerJobException(jobId, "job not found");
            }
            RelayerJob current = job.get();
            if (current.state() == RelayerJobState.FAILED) {
                throw new RelayerJobException(jobId,
                        current.failedReason() != null ? current.failedReason() : "unknown reason");
            }
            if (current.state().isTerminal()) {
                log.info("Job {} on {} completed: {}", jobId, asset, current.txHashes());
                return current.txHashes();
            }
            log.debug("Job {} on {} is {} ({}/{})", jobId, asset, current.state(), attempt, attempts);
            if (attempt < attempts) {
                sleep(jobId, poolProperties.getJobPollIntervalMs());
            }
        }
        throw new RelayerJobException(jobId, "not completed after " + attempts + " polls");
    }

    private static void sleep(String jobId, long millis) {
        try {
            Thread.sleep(Math.max(0L, millis));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RelayerJobException(jobId, "interrupted while polling");
        }
    }
}
