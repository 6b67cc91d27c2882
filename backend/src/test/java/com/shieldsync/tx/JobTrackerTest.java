package com.shieldsync.tx;

import com.shieldsync.config.PoolProperties;
import com.shieldsync.ingestion.relayer.RelayerGateway;
import com.shieldsync.ingestion.relayer.RelayerJob;
import com.shieldsync.ingestion.relayer.RelayerJobException;
import com.shieldsync.ingestion.relayer.RelayerJobState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class JobTrackerTest {

    private static final String ASSET = "0xtoken";

    @Mock
    private RelayerGateway relayerGateway;

    private JobTracker tracker;

    @BeforeEach
    void setUp() {
        PoolProperties properties = new PoolProperties();
        properties.setJobPollIntervalMs(0L);
        properties.setJobPollMaxAttempts(4);
        tracker = new JobTracker(relayerGateway, properties);
    }

    private static Optional<RelayerJob> job(RelayerJobState state, List<String> hashes, String reason) {
        return Optional.of(new RelayerJob("7", state, hashes, reason));
    }

    @Test
    void waitForJob_pollsUntilCompleted() {
        when(relayerGateway.getJob(ASSET, "7")).thenReturn(
                job(RelayerJobState.WAITING, List.of(), null),
                job(RelayerJobState.ACTIVE, List.of(), null),
                job(RelayerJobState.COMPLETED, List.of("0xabc"), null));

        assertThat(tracker.waitForJob(ASSET, "7")).containsExactly("0xabc");
        verify(relayerGateway, times(3)).getJob(ASSET, "7");
    }

    @Test
    @DisplayName("a failed job surfaces the relayer's reason")
    void waitForJob_failed_throwsWithReason() {
        when(relayerGateway.getJob(ASSET, "7")).thenReturn(job(RelayerJobState.FAILED, List.of(), "nullifier already spent"));

        assertThatThrownBy(() -> tracker.waitForJob(ASSET, "7"))
                .isInstanceOfSatisfying(RelayerJobException.class, e -> {
                    assertThat(e.getJobId()).isEqualTo("7");
                    assertThat(e.getReason()).isEqualTo("nullifier already spent");
                });
    }

    @Test
    @DisplayName("an unknown job id is fatal and not polled again")
    void waitForJob_unknownJob_throwsImmediately() {
        when(relayerGateway.getJob(ASSET, "7")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> tracker.waitForJob(ASSET, "7"))
                .isInstanceOf(RelayerJobException.class)
                .hasMessageContaining("job not found");
        verify(relayerGateway, times(1)).getJob(ASSET, "7");
    }

    @Test
    void waitForJob_neverCompletes_throwsAfterBudget() {
        when(relayerGateway.getJob(ASSET, "7")).thenReturn(job(RelayerJobState.PENDING, List.of(), null));

        assertThatThrownBy(() -> tracker.waitForJob(ASSET, "7"))
                .isInstanceOf(RelayerJobException.class)
                .hasMessageContaining("not completed after 4 polls");
        verify(relayerGateway, times(4)).getJob(ASSET, "7");
    }
}
