package com.example.ingestionservice.service;

import com.example.ingestionservice.dedup.DedupResult;
import com.example.ingestionservice.dedup.DedupStats;
import com.example.ingestionservice.dedup.TranscriptDeduplicator;
import com.example.ingestionservice.dto.BackfillResult;
import com.example.ingestionservice.entity.BackfillCheckpoint;
import com.example.ingestionservice.metrics.IngestionMetrics;
import com.example.ingestionservice.record.ActivityRecord;
import com.example.ingestionservice.record.FirefliesTranscriptRecord;
import com.example.ingestionservice.record.RecordKind;
import com.example.ingestionservice.record.Source;
import com.example.ingestionservice.resolver.EntityResolver;
import com.example.ingestionservice.resolver.IssueKeyExtractor;
import com.example.ingestionservice.resolver.ResolutionStats;
import com.example.ingestionservice.resolver.ResolvedRecord;
import com.example.ingestionservice.resolver.ResolverCache;
import com.example.ingestionservice.source.RecordSource;
import com.example.ingestionservice.vector.SinkResult;
import com.example.ingestionservice.vector.VectorIngestionSink;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

/**
 * Runs one batch: fetch → dedup → resolve → embed/upsert, with a durable checkpoint.
 * 
 * CRITICAL DESIGN:
 * - COMPLETED checkpoint → stored counts returned, ZERO fetch/resolve/upsert calls
 * - External API calls OUTSIDE transactions, checkpoint writes via CheckpointService
 * - Records processed sequentially, progress persisted after every chunk
 * - Resume: previous processed_items = p and an unchanged total → first p records skipped
 * - One ResolverCache per run, discarded at the end
 * - Any exception → checkpoint FAILED and the exception is rethrown
 */
@Service
@Slf4j
public class BackfillOrchestrator {

    private static final String CORRELATION_ID = "correlationId";

    private final Map<Source, RecordSource> sources = new EnumMap<>(Source.class);
    private final CheckpointService checkpointService;
    private final SyncStatusService syncStatusService;
    private final EntityResolver entityResolver;
    private final TranscriptDeduplicator transcriptDeduplicator;
    private final VectorIngestionSink vectorIngestionSink;
    private final IngestionMetrics ingestionMetrics;
    private final int progressInterval;
    private final Set<String> projectKeys;

    public BackfillOrchestrator(List<RecordSource> recordSources,
                                CheckpointService checkpointService,
                                SyncStatusService syncStatusService,
                                EntityResolver entityResolver,
                                TranscriptDeduplicator transcriptDeduplicator,
                                VectorIngestionSink vectorIngestionSink,
                                IngestionMetrics ingestionMetrics,
                                @Value("${ingestion.backfill.progress-interval:500}") int progressInterval,
                                @Value("${ingestion.backfill.project-keys:}") String projectKeys) {
        if (progressInterval < 1) {
            throw new IllegalArgumentException("progressInterval must be >= 1");
        }
        for (RecordSource recordSource : recordSources) {
            this.sources.put(recordSource.source(), recordSource);
        }
        this.checkpointService = checkpointService;
        this.syncStatusService = syncStatusService;
        this.entityResolver = entityResolver;
        this.transcriptDeduplicator = transcriptDeduplicator;
        this.vectorIngestionSink = vectorIngestionSink;
        this.ingestionMetrics = ingestionMetrics;
        this.progressInterval = progressInterval;
        this.projectKeys = Arrays.stream(projectKeys.split(","))
                .map(String::trim)
                .filter(key -> !key.isEmpty())
                .map(key -> key.toUpperCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }

    /**
     * Run on backfillTaskExecutor. The submitter's MDC (correlationId) is carried
     * over by MdcTaskDecorator.
     */
    @Async("backfillTaskExecutor")
    public CompletableFuture<BackfillResult> runAsync(BackfillRequest request) {
        return CompletableFuture.completedFuture(run(request));
    }

    public BackfillResult run(BackfillRequest request) {
        boolean ownsCorrelationId = MDC.get(CORRELATION_ID) == null;
        String correlationId = ownsCorrelationId
                ? "BACKFILL-" + UUID.randomUUID().toString().substring(0, 8)
                : MDC.get(CORRELATION_ID);
        if (ownsCorrelationId) {
            MDC.put(CORRELATION_ID, correlationId);
        }
        try {
            return doRun(request, correlationId);
        } finally {
            if (ownsCorrelationId) {
                MDC.remove(CORRELATION_ID);
            }
        }
    }

    private BackfillResult doRun(BackfillRequest request, String correlationId) {
        long startTime = System.currentTimeMillis();
        Source source = request.getSource();
        String batchId = request.getBatchId();

        BackfillCheckpoint existing = checkpointService.find(source.key(), batchId).orElse(null);
        if (existing != null && existing.isCompleted()) {
            return alreadyCompleted(existing, correlationId);
        }

        RecordSource recordSource = sources.get(source);
        if (recordSource == null) {
            throw new IllegalStateException("No record source registered for " + source.key());
        }

        BackfillCheckpoint checkpoint = checkpointService.claim(source.key(), batchId,
                request.getStartDate(), request.getEndDate(), correlationId);
        if (checkpoint.isCompleted()) {
            return alreadyCompleted(checkpoint, correlationId);
        }

        log.info("Starting batch source={}, batchId={}, window={}, incremental={}",
                source.key(), batchId, request.getWindow(), request.isIncremental());

        BackfillResult result = BackfillResult.builder()
                .source(source.key())
                .batchId(batchId)
                .startDate(request.getStartDate())
                .endDate(request.getEndDate())
                .correlationId(correlationId)
                .build();
        ResolverCache cache = entityResolver.newCache();

        try {
            List<ActivityRecord> records = recordSource.fetch(request.getWindow());
            if (source == Source.FIREFLIES) {
                DedupResult dedup = transcriptDeduplicator.deduplicate(transcripts(records));
                result.setDedupStats(dedup.getStats());
                records = new ArrayList<>(dedup.getSurvivors());
            } else {
                result.setDedupStats(DedupStats.builder()
                        .total(records.size())
                        .finalCount(records.size())
                        .build());
            }

            int total = records.size();
            int processed = 0;
            int ingested = 0;
            int skipped = 0;

            Integer previousTotal = checkpoint.getTotalItems();
            if (checkpoint.getProcessedItems() > 0) {
                if (previousTotal != null && previousTotal == total) {
                    processed = Math.min(checkpoint.getProcessedItems(), total);
                    ingested = checkpoint.getIngestedItems();
                    skipped = checkpoint.getSkippedItems();
                    log.info("Resuming batch {} at record {}/{}", batchId, processed, total);
                } else {
                    log.warn("⚠️ Upstream total changed for batch {} ({} -> {}), reprocessing from the start",
                            batchId, previousTotal, total);
                    checkpoint = checkpointService.restartProgress(checkpoint.getId());
                }
            }
            result.setResumedFrom(processed);
            checkpoint = checkpointService.recordTotal(checkpoint.getId(), total);

            ResolutionStats resolutionStats = new ResolutionStats();
            int filtered = 0;
            while (processed < total) {
                int end = Math.min(processed + progressInterval, total);
                List<ResolvedRecord> toIngest = new ArrayList<>(end - processed);
                for (ActivityRecord record : records.subList(processed, end)) {
                    ResolvedRecord resolved = entityResolver.resolveRecord(record, cache);
                    resolutionStats.record(resolved.getIdentity());
                    if (!resolved.getIdentity().isResolved()) {
                        skipped++;
                    } else if (!inProjectScope(resolved)) {
                        filtered++;
                        skipped++;
                    } else {
                        toIngest.add(resolved);
                    }
                }

                SinkResult sinkResult = vectorIngestionSink.upsert(toIngest);
                ingested += sinkResult.getIngested();
                skipped += sinkResult.getInvalidDocuments();
                result.setEmbeddingFailures(result.getEmbeddingFailures() + sinkResult.getEmbeddingFailures());
                result.setFailedBatches(result.getFailedBatches() + sinkResult.getFailedBatches());
                result.getErrors().addAll(sinkResult.getErrors());

                processed = end;
                checkpointService.recordProgress(checkpoint.getId(), processed, ingested, skipped);
                log.info("Progress batch={}: {}/{} processed, {} ingested, {} skipped",
                        batchId, processed, total, ingested, skipped);
            }

            checkpointService.complete(checkpoint.getId(), processed, ingested, skipped);
            if (request.isIncremental()) {
                syncStatusService.markSynced(source, request.getWindow().getTo());
            }

            long durationMs = System.currentTimeMillis() - startTime;
            fill(result, cache, resolutionStats);
            result.setStatus(BackfillCheckpoint.CheckpointStatus.COMPLETED.name());
            result.setTotalItems(total);
            result.setProcessedItems(processed);
            result.setIngestedItems(ingested);
            result.setSkippedItems(skipped);
            result.setFilteredItems(filtered);
            result.setDurationMs(durationMs);

            ingestionMetrics.recordJobCompleted(source.key(), durationMs);
            ingestionMetrics.recordRecords(source.key(), "ingested", ingested);
            ingestionMetrics.recordRecords(source.key(), "skipped", skipped - filtered);
            ingestionMetrics.recordRecords(source.key(), "filtered", filtered);

            log.info("✅ Batch completed: source={}, batchId={}, total={}, ingested={}, skipped={}, " +
                            "fast={}, slow={}, direct={}, lookupFailures={}, duration={}ms",
                    source.key(), batchId, total, ingested, skipped, resolutionStats.getFastPath(),
                    resolutionStats.getSlowPath(), resolutionStats.getDirect(), result.getLookupFailures(), durationMs);
            return result;

        } catch (RuntimeException e) {
            long durationMs = System.currentTimeMillis() - startTime;
            ingestionMetrics.recordJobFailed(source.key(), durationMs);
            log.error("❌ Batch failed: source={}, batchId={}, error={}", source.key(), batchId, e.getMessage(), e);
            try {
                checkpointService.fail(checkpoint.getId(), describe(e));
            } catch (RuntimeException markFailure) {
                log.error("❌ Could not mark checkpoint {}/{} as FAILED: {}",
                        source.key(), batchId, markFailure.getMessage());
                e.addSuppressed(markFailure);
            }
            throw e;
        }
    }

    private boolean inProjectScope(ResolvedRecord resolved) {
        if (projectKeys.isEmpty()) {
            return true;
        }
        RecordKind kind = resolved.getRecord().getKind();
        if (kind != RecordKind.ISSUE && kind != RecordKind.WORKLOG) {
            return true;
        }
        return projectKeys.contains(IssueKeyExtractor.projectOf(resolved.getIdentity().getResolvedKey()));
    }

    private BackfillResult alreadyCompleted(BackfillCheckpoint checkpoint, String correlationId) {
        ingestionMetrics.recordJobAlreadyCompleted(checkpoint.getSource());
        log.info("Batch {}/{} already completed, skipping", checkpoint.getSource(), checkpoint.getBatchId());
        int total = checkpoint.getTotalItems() != null ? checkpoint.getTotalItems() : checkpoint.getProcessedItems();
        return BackfillResult.builder()
                .source(checkpoint.getSource())
                .batchId(checkpoint.getBatchId())
                .status(BackfillCheckpoint.CheckpointStatus.COMPLETED.name())
                .alreadyCompleted(true)
                .startDate(checkpoint.getStartDate())
                .endDate(checkpoint.getEndDate())
                .totalItems(total)
                .processedItems(checkpoint.getProcessedItems())
                .ingestedItems(checkpoint.getIngestedItems())
                .skippedItems(checkpoint.getSkippedItems())
                .correlationId(correlationId)
                .build();
    }

    private static void fill(BackfillResult result, ResolverCache cache, ResolutionStats stats) {
        result.setFastPath(stats.getFastPath());
        result.setSlowPath(stats.getSlowPath());
        result.setDirect(stats.getDirect());
        result.setLookupFailures(cache.totalLookupFailures());
        result.setCacheStats(cache.stats());
        result.getErrors().addAll(cache.getLookupErrors());
    }

    private static List<FirefliesTranscriptRecord> transcripts(List<ActivityRecord> records) {
        List<FirefliesTranscriptRecord> transcripts = new ArrayList<>(records.size());
        for (ActivityRecord record : records) {
            transcripts.add((FirefliesTranscriptRecord) record);
        }
        return transcripts;
    }

    private static String describe(Throwable e) {
        String message = e.getMessage();
        return e.getClass().getSimpleName() + (message != null ? ": " + message : "");
    }
}
