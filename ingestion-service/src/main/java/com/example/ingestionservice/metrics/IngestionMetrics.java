package com.example.ingestionservice.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Metrics component for Prometheus monitoring.
 * 
 * Exposes:
 * - ingestion_jobs_total: Counter of batch jobs by source and status
 * - ingestion_duration_seconds: Timer for batch duration by source
 * - ingestion_records_total: Counter of records by source and outcome (ingested, skipped, filtered)
 * - resolution_path_total: Counter of identity resolutions by path (fast, authoritative, none)
 * - embedding_failures_total: Records dropped because no embedding was produced
 * - vector_upsert_batch_failures_total: Upsert batches excluded from the ingested count
 * - retry_attempts_total / retry_exhausted_total: Retry envelope activity by operation
 * - backfill_tasks_rejected_total: Tasks rejected because the executor queue was full
 * - parser_warning_count: Upstream timestamps replaced by a fallback value
 * 
 * A skewed fast/authoritative ratio on resolution_path_total means the key
 * heuristic stopped matching what people write in worklog descriptions.
 * 
 * Access metrics: http://localhost:8085/actuator/prometheus
 */
@Component
@Slf4j
public class IngestionMetrics {

    private final MeterRegistry meterRegistry;

    private final Counter embeddingFailureCounter;
    private final Counter upsertBatchFailureCounter;
    private final Counter taskRejectedCounter;
    private final Counter lookupFailureCounter;
    private final Counter parserWarningCounter;

    public IngestionMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.embeddingFailureCounter = Counter.builder("embedding_failures_total")
                .description("Records skipped because no embedding could be produced")
                .register(meterRegistry);

        this.upsertBatchFailureCounter = Counter.builder("vector_upsert_batch_failures_total")
                .description("Vector upsert batches that failed and were excluded from the count")
                .register(meterRegistry);

        this.taskRejectedCounter = Counter.builder("backfill_tasks_rejected_total")
                .description("Backfill tasks rejected due to queue full (AbortPolicy)")
                .register(meterRegistry);

        this.lookupFailureCounter = Counter.builder("resolver_lookup_failures_total")
                .description("Authoritative lookups that failed after retries (sentinel cached)")
                .register(meterRegistry);

        this.parserWarningCounter = Counter.builder("parser_warning_count")
                .description("Upstream timestamps that could not be parsed (fallback used)")
                .register(meterRegistry);
    }

    public void recordJobCompleted(String source, long durationMs) {
        jobCounter(source, "completed").increment();
        durationTimer(source).record(durationMs, TimeUnit.MILLISECONDS);
        log.debug("Recorded job completed: source={}, duration={}ms", source, durationMs);
    }

    public void recordJobFailed(String source, long durationMs) {
        jobCounter(source, "failed").increment();
        durationTimer(source).record(durationMs, TimeUnit.MILLISECONDS);
        log.debug("Recorded job failure: source={}", source);
    }

    public void recordJobAlreadyCompleted(String source) {
        jobCounter(source, "already_completed").increment();
    }

    public void recordRecords(String source, String outcome, int count) {
        if (count <= 0) {
            return;
        }
        Counter.builder("ingestion_records_total")
                .description("Records processed by outcome")
                .tag("source", source)
                .tag("outcome", outcome)
                .register(meterRegistry)
                .increment(count);
    }

    public void recordResolution(String source, String path) {
        Counter.builder("resolution_path_total")
                .description("Identity resolutions by path")
                .tag("source", source)
                .tag("path", path)
                .register(meterRegistry)
                .increment();
    }

    public void recordLookupFailure() {
        lookupFailureCounter.increment();
    }

    public void recordEmbeddingFailure() {
        embeddingFailureCounter.increment();
    }

    public void recordUpsertBatchFailure() {
        upsertBatchFailureCounter.increment();
        log.warn("⚠️ Recorded vector upsert batch failure");
    }

    public void recordParserWarning() {
        parserWarningCounter.increment();
    }

    public void recordRetryAttempt(String operation) {
        Counter.builder("retry_attempts_total")
                .tag("operation", operation)
                .register(meterRegistry)
                .increment();
    }

    public void recordRetryExhausted(String operation) {
        Counter.builder("retry_exhausted_total")
                .tag("operation", operation)
                .register(meterRegistry)
                .increment();
    }

    /**
     * Record task rejection (queue full).
     * Called when RejectedExecutionException is thrown by AbortPolicy.
     */
    public void recordTaskRejection() {
        taskRejectedCounter.increment();
        log.error("❌ CRITICAL: Backfill task rejected - queue full (capacity exhausted)");
    }

    /**
     * Register thread pool metrics for monitoring (from AsyncConfig executor).
     */
    public void registerThreadPoolMetrics(String executorName, ThreadPoolExecutor executor) {
        Gauge.builder("thread_pool_active", executor, ThreadPoolExecutor::getActiveCount)
                .tag("executor", executorName)
                .description("Active thread count")
                .register(meterRegistry);

        Gauge.builder("thread_pool_queue_size", executor, e -> e.getQueue().size())
                .tag("executor", executorName)
                .description("Queue size")
                .register(meterRegistry);
    }

    private Counter jobCounter(String source, String status) {
        return Counter.builder("ingestion_jobs_total")
                .description("Total number of ingestion batch jobs")
                .tag("source", source)
                .tag("status", status)
                .register(meterRegistry);
    }

    private Timer durationTimer(String source) {
        return Timer.builder("ingestion_duration_seconds")
                .description("Duration of ingestion batch jobs")
                .tag("source", source)
                .register(meterRegistry);
    }
}
