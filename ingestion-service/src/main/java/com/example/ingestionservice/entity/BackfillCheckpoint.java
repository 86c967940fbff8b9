package com.example.ingestionservice.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Durable progress of one backfill batch, keyed by (source, batch_id).
 * 
 * CRITICAL DESIGN:
 * - Status moves PENDING → RUNNING → {COMPLETED | FAILED} only
 * - COMPLETED is terminal: every mutator throws {@link IllegalStateException}
 * - FAILED goes back to PENDING only through {@link #resetForRetry()} (explicit re-run)
 * - processedItems never decreases, except through {@link #restartProgress()}
 */
@Entity
@Table(name = "backfill_checkpoints",
        uniqueConstraints = @UniqueConstraint(name = "uk_backfill_checkpoints_source_batch",
                columnNames = {"source", "batch_id"}),
        indexes = {
                @Index(name = "idx_backfill_checkpoints_status", columnList = "status")
        })
@Getter
@Setter(AccessLevel.PACKAGE)
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BackfillCheckpoint extends BaseEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "source", nullable = false, length = 50)
    private String source;

    @Column(name = "batch_id", nullable = false, length = 200)
    private String batchId;

    @Column(name = "start_date")
    private LocalDate startDate;

    @Column(name = "end_date")
    private LocalDate endDate;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private CheckpointStatus status;

    @Column(name = "total_items")
    private Integer totalItems;

    @Builder.Default
    @Column(name = "processed_items", nullable = false)
    private int processedItems = 0;

    @Builder.Default
    @Column(name = "ingested_items", nullable = false)
    private int ingestedItems = 0;

    @Builder.Default
    @Column(name = "skipped_items", nullable = false)
    private int skippedItems = 0;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @Column(name = "correlation_id", length = 100)
    private String correlationId;

    @Column(name = "started_at")
    private LocalDateTime startedAt;

    @Column(name = "completed_at")
    private LocalDateTime completedAt;

    public static BackfillCheckpoint pending(String source, String batchId, LocalDate startDate, LocalDate endDate) {
        return BackfillCheckpoint.builder()
                .source(source)
                .batchId(batchId)
                .startDate(startDate)
                .endDate(endDate)
                .status(CheckpointStatus.PENDING)
                .build();
    }

    public boolean isCompleted() {
        return status == CheckpointStatus.COMPLETED;
    }

    /**
     * PENDING → RUNNING. A RUNNING row left behind by a crash is kept as is,
     * so its progress can be resumed.
     */
    public void markAsRunning(String correlationId) {
        requireNotCompleted("start");
        if (status == CheckpointStatus.FAILED) {
            throw new IllegalStateException("Checkpoint " + describe() + " is FAILED; reset it before starting");
        }
        if (status == CheckpointStatus.PENDING) {
            this.startedAt = LocalDateTime.now();
        }
        this.status = CheckpointStatus.RUNNING;
        this.correlationId = correlationId;
        this.errorMessage = null;
    }

    /**
     * FAILED → PENDING, keeping processed counts for resume.
     */
    public void resetForRetry() {
        requireNotCompleted("reset");
        if (status != CheckpointStatus.FAILED) {
            throw new IllegalStateException("Only a FAILED checkpoint can be reset, " + describe() + " is " + status);
        }
        this.status = CheckpointStatus.PENDING;
        this.completedAt = null;
    }

    public void recordTotal(int totalItems) {
        requireRunning("record total");
        this.totalItems = totalItems;
    }

    public void recordProgress(int processedItems, int ingestedItems, int skippedItems) {
        requireRunning("record progress");
        if (processedItems < this.processedItems) {
            throw new IllegalStateException("processed_items cannot decrease: " + this.processedItems
                    + " -> " + processedItems + " for " + describe());
        }
        this.processedItems = processedItems;
        this.ingestedItems = ingestedItems;
        this.skippedItems = skippedItems;
    }

    /**
     * Drop recorded progress of a RUNNING batch whose upstream data changed since the
     * previous attempt. The batch is reprocessed from the first record.
     */
    public void restartProgress() {
        requireRunning("restart progress");
        this.processedItems = 0;
        this.ingestedItems = 0;
        this.skippedItems = 0;
    }

    public void markAsCompleted(int processedItems, int ingestedItems, int skippedItems) {
        recordProgress(processedItems, ingestedItems, skippedItems);
        this.status = CheckpointStatus.COMPLETED;
        this.completedAt = LocalDateTime.now();
        this.errorMessage = null;
    }

    public void markAsFailed(String errorMessage) {
        requireNotCompleted("fail");
        this.status = CheckpointStatus.FAILED;
        this.completedAt = LocalDateTime.now();
        this.errorMessage = errorMessage;
    }

    private void requireRunning(String action) {
        requireNotCompleted(action);
        if (status != CheckpointStatus.RUNNING) {
            throw new IllegalStateException("Cannot " + action + " on " + describe() + " in status " + status);
        }
    }

    private void requireNotCompleted(String action) {
        if (status == CheckpointStatus.COMPLETED) {
            throw new IllegalStateException("Cannot " + action + ": checkpoint " + describe() + " is COMPLETED");
        }
    }

    private String describe() {
        return source + "/" + batchId;
    }

    public enum CheckpointStatus {
        PENDING,
        RUNNING,
        COMPLETED,
        FAILED
    }
}
