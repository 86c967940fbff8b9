package com.example.ingestionservice.service;

import com.example.ingestionservice.entity.BackfillCheckpoint;
import com.example.ingestionservice.repository.BackfillCheckpointRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.Optional;

/**
 * Service for checkpoint writes with transactional boundaries.
 * 
 * CRITICAL DESIGN:
 * - @Transactional methods are SHORT-LIVED (one row, no external calls)
 * - Callers hold a detached snapshot; every update re-reads the row by id
 * - State machine rules live on the entity; illegal transitions throw IllegalStateException
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CheckpointService {

    private final BackfillCheckpointRepository checkpointRepository;

    @Transactional(readOnly = true)
    public Optional<BackfillCheckpoint> find(String source, String batchId) {
        return checkpointRepository.findBySourceAndBatchId(source, batchId);
    }

    /**
     * Create the checkpoint if missing and move it to RUNNING.
     * 
     * - COMPLETED row → returned unchanged, caller must not run the batch
     * - FAILED row → reset to PENDING, then RUNNING (progress kept for resume)
     * - RUNNING row (crashed run) → kept, progress kept for resume
     * 
     * Not @Transactional: the insert commits on its own, so a unique violation from a
     * concurrent claim of the same (source, batch_id) can be answered by re-reading.
     */
    public BackfillCheckpoint claim(String source, String batchId, LocalDate startDate, LocalDate endDate,
                                    String correlationId) {
        BackfillCheckpoint checkpoint = find(source, batchId).orElse(null);
        if (checkpoint == null) {
            try {
                checkpoint = checkpointRepository.saveAndFlush(
                        BackfillCheckpoint.pending(source, batchId, startDate, endDate));
                log.debug("Created checkpoint id={} for {}/{}", checkpoint.getId(), source, batchId);
            } catch (DataIntegrityViolationException e) {
                log.warn("⚠️ Concurrent creation of checkpoint {}/{}, re-reading", source, batchId);
                checkpoint = find(source, batchId).orElseThrow(() -> e);
            }
        }

        if (checkpoint.isCompleted()) {
            return checkpoint;
        }
        if (checkpoint.getStatus() == BackfillCheckpoint.CheckpointStatus.FAILED) {
            log.info("Resetting FAILED checkpoint {}/{} for re-run (processed={})",
                    source, batchId, checkpoint.getProcessedItems());
            checkpoint.resetForRetry();
        } else if (checkpoint.getStatus() == BackfillCheckpoint.CheckpointStatus.RUNNING) {
            log.warn("⚠️ Checkpoint {}/{} was left RUNNING by a previous attempt, resuming at processed={}",
                    source, batchId, checkpoint.getProcessedItems());
        }
        checkpoint.markAsRunning(correlationId);
        return checkpointRepository.save(checkpoint);
    }

    @Transactional
    public BackfillCheckpoint recordTotal(Long checkpointId, int totalItems) {
        BackfillCheckpoint checkpoint = load(checkpointId);
        checkpoint.recordTotal(totalItems);
        return checkpointRepository.save(checkpoint);
    }

    @Transactional
    public BackfillCheckpoint restartProgress(Long checkpointId) {
        BackfillCheckpoint checkpoint = load(checkpointId);
        checkpoint.restartProgress();
        return checkpointRepository.save(checkpoint);
    }

    /**
     * Persist progress after a chunk. Transaction duration: <50ms
     */
    @Transactional
    public BackfillCheckpoint recordProgress(Long checkpointId, int processed, int ingested, int skipped) {
        BackfillCheckpoint checkpoint = load(checkpointId);
        checkpoint.recordProgress(processed, ingested, skipped);
        return checkpointRepository.save(checkpoint);
    }

    @Transactional
    public BackfillCheckpoint complete(Long checkpointId, int processed, int ingested, int skipped) {
        BackfillCheckpoint checkpoint = load(checkpointId);
        checkpoint.markAsCompleted(processed, ingested, skipped);
        BackfillCheckpoint saved = checkpointRepository.save(checkpoint);
        log.info("✅ Checkpoint {}/{} completed: processed={}, ingested={}, skipped={}",
                saved.getSource(), saved.getBatchId(), processed, ingested, skipped);
        return saved;
    }

    @Transactional
    public BackfillCheckpoint fail(Long checkpointId, String errorMessage) {
        BackfillCheckpoint checkpoint = load(checkpointId);
        checkpoint.markAsFailed(errorMessage);
        BackfillCheckpoint saved = checkpointRepository.save(checkpoint);
        log.error("❌ Checkpoint {}/{} failed at processed={}: {}",
                saved.getSource(), saved.getBatchId(), saved.getProcessedItems(), errorMessage);
        return saved;
    }

    private BackfillCheckpoint load(Long checkpointId) {
        return checkpointRepository.findById(checkpointId)
                .orElseThrow(() -> new IllegalArgumentException("Checkpoint not found: " + checkpointId));
    }
}
