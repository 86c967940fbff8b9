package com.example.ingestionservice.scheduler;

import com.example.ingestionservice.entity.BackfillCheckpoint;
import com.example.ingestionservice.repository.BackfillCheckpointRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Lists batches left RUNNING by a previous process once the application is up.
 * They resume when the same batch id is submitted again; nothing is restarted here.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class InterruptedBatchReporter {

    private final BackfillCheckpointRepository checkpointRepository;

    @EventListener(ApplicationReadyEvent.class)
    @Transactional(readOnly = true)
    public void reportInterruptedBatches() {
        List<BackfillCheckpoint> running = checkpointRepository.findRunning();
        if (running.isEmpty()) {
            log.info("✅ No interrupted backfill batches");
            return;
        }
        for (BackfillCheckpoint checkpoint : running) {
            log.warn("⚠️ Interrupted batch {}/{}: processed={} of total={}, started at {}",
                    checkpoint.getSource(), checkpoint.getBatchId(), checkpoint.getProcessedItems(),
                    checkpoint.getTotalItems(), checkpoint.getStartedAt());
        }
    }
}
