package com.example.ingestionservice.service;

import com.example.ingestionservice.client.external.ExternalApiException;
import com.example.ingestionservice.dto.BackfillResult;
import com.example.ingestionservice.dto.ChunkedBackfillResult;
import com.example.ingestionservice.entity.BackfillCheckpoint;
import com.example.ingestionservice.record.Source;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.LocalDate;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Multi-month backfill as a sequence of 30-day batches.
 * 
 * CRITICAL DESIGN:
 * - Chunks run one after another on the calling task thread
 * - Already-completed chunks are skipped without a pause
 * - Pause between executed chunks lets upstream rate-limit windows recover;
 *   it holds no lock and an interrupt ends the run
 * - A failed chunk is recorded and the next chunk still runs, except for
 *   credential errors which fail every chunk the same way
 */
@Service
@Slf4j
public class ChunkedBackfillRunner {

    @FunctionalInterface
    public interface Pause {
        void sleep(Duration duration) throws InterruptedException;
    }

    private final BackfillOrchestrator backfillOrchestrator;
    private final CheckpointService checkpointService;
    private final ChunkPlanner chunkPlanner;
    private final int chunkDays;
    private final Duration chunkPause;
    private final Pause pause;

    @Autowired
    public ChunkedBackfillRunner(BackfillOrchestrator backfillOrchestrator,
                                 CheckpointService checkpointService,
                                 ChunkPlanner chunkPlanner,
                                 @Value("${ingestion.backfill.chunk-days:30}") int chunkDays,
                                 @Value("${ingestion.backfill.chunk-pause:PT180S}") Duration chunkPause) {
        this(backfillOrchestrator, checkpointService, chunkPlanner, chunkDays, chunkPause,
                duration -> Thread.sleep(duration.toMillis()));
    }

    ChunkedBackfillRunner(BackfillOrchestrator backfillOrchestrator,
                          CheckpointService checkpointService,
                          ChunkPlanner chunkPlanner,
                          int chunkDays,
                          Duration chunkPause,
                          Pause pause) {
        this.backfillOrchestrator = backfillOrchestrator;
        this.checkpointService = checkpointService;
        this.chunkPlanner = chunkPlanner;
        this.chunkDays = chunkDays;
        this.chunkPause = chunkPause;
        this.pause = pause;
    }

    @Async("backfillTaskExecutor")
    public CompletableFuture<ChunkedBackfillResult> runAsync(Source source, LocalDate startDate, LocalDate endDate) {
        return CompletableFuture.completedFuture(run(source, startDate, endDate));
    }

    public ChunkedBackfillResult run(Source source, LocalDate startDate, LocalDate endDate) {
        List<BackfillChunk> chunks = chunkPlanner.plan(source, startDate, endDate, chunkDays);
        log.info("Chunked backfill source={}: {} chunks of {} days from {} to {}",
                source.key(), chunks.size(), chunkDays, startDate, endDate);

        ChunkedBackfillResult result = ChunkedBackfillResult.builder()
                .source(source.key())
                .totalChunks(chunks.size())
                .build();

        boolean ranPrevious = false;
        for (BackfillChunk chunk : chunks) {
            String batchId = chunk.batchId();
            boolean completed = checkpointService.find(source.key(), batchId)
                    .map(BackfillCheckpoint::isCompleted)
                    .orElse(false);
            if (completed) {
                result.setSkippedChunks(result.getSkippedChunks() + 1);
                log.info("Chunk {} already completed, skipping", batchId);
                continue;
            }

            if (ranPrevious && !chunkPause.isZero()) {
                log.info("Pausing {}s before chunk {}", chunkPause.toSeconds(), batchId);
                try {
                    pause.sleep(chunkPause);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    result.setInterrupted(true);
                    log.warn("⚠️ Chunked backfill interrupted before chunk {}", batchId);
                    break;
                }
            }

            ranPrevious = true;
            try {
                BackfillResult chunkResult = backfillOrchestrator.run(chunk.toRequest());
                result.getChunks().add(chunkResult);
                result.setCompletedChunks(result.getCompletedChunks() + 1);
                result.setTotalIngested(result.getTotalIngested() + chunkResult.getIngestedItems());
            } catch (ExternalApiException.AuthenticationException
                     | ExternalApiException.SourceNotConfiguredException e) {
                result.setFailedChunks(result.getFailedChunks() + 1);
                result.getErrors().add(batchId + ": " + e.getMessage());
                log.error("❌ Chunk {} failed on credentials, stopping chunked backfill: {}", batchId, e.getMessage());
                break;
            } catch (RuntimeException e) {
                result.setFailedChunks(result.getFailedChunks() + 1);
                result.getErrors().add(batchId + ": " + e.getMessage());
                log.error("❌ Chunk {} failed, continuing with the next chunk: {}", batchId, e.getMessage());
            }
        }

        log.info("Chunked backfill source={} finished: completed={}, skipped={}, failed={}, ingested={}",
                source.key(), result.getCompletedChunks(), result.getSkippedChunks(),
                result.getFailedChunks(), result.getTotalIngested());
        return result;
    }
}
