package com.example.ingestionservice.scheduler;

import com.example.ingestionservice.entity.BackfillCheckpoint;
import com.example.ingestionservice.repository.BackfillCheckpointRepository;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatNoException;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoMoreInteractions;
import static org.mockito.Mockito.when;

class InterruptedBatchReporterTest {

    private final BackfillCheckpointRepository repository = mock(BackfillCheckpointRepository.class);
    private final InterruptedBatchReporter reporter = new InterruptedBatchReporter(repository);

    @Test
    void testReport_RunningBatches_ReadOnlyNoStateChange() {
        // GIVEN: a batch left RUNNING by a crashed process
        BackfillCheckpoint crashed = BackfillCheckpoint.pending("tempo", "tempo-1", null, null);
        crashed.markAsRunning("BACKFILL-crashed1");
        crashed.recordTotal(1000);
        crashed.recordProgress(500, 480, 20);
        when(repository.findRunning()).thenReturn(List.of(crashed));

        // WHEN
        reporter.reportInterruptedBatches();

        // THEN: only read, the checkpoint keeps its progress for resume
        verify(repository).findRunning();
        verifyNoMoreInteractions(repository);
        assertThat(crashed.getStatus())
                .isEqualTo(BackfillCheckpoint.CheckpointStatus.RUNNING);
        assertThat(crashed.getProcessedItems()).isEqualTo(500);
    }

    @Test
    void testReport_NothingRunning_NoError() {
        when(repository.findRunning()).thenReturn(List.of());

        assertThatNoException().isThrownBy(reporter::reportInterruptedBatches);
    }
}
