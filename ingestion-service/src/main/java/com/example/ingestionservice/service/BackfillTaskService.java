package com.example.ingestionservice.service;

import com.example.ingestionservice.dto.BackfillRequestDto;
import com.example.ingestionservice.dto.TaskStatusResponse;
import com.example.ingestionservice.dto.TaskSubmissionResponse;
import com.example.ingestionservice.exception.BadRequestException;
import com.example.ingestionservice.exception.ResourceNotFoundException;
import com.example.ingestionservice.exception.ServiceUnavailableException;
import com.example.ingestionservice.metrics.IngestionMetrics;
import com.example.ingestionservice.record.Source;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Comparator;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Accepts backfill submissions and tracks their outcome.
 * 
 * CRITICAL DESIGN:
 * - Submission returns at once; work runs on backfillTaskExecutor
 * - Task state lives in memory only: the checkpoint table is the durable record
 * - Queue full (AbortPolicy) → 503 to the caller, rejection counted
 * - Failures surface only through the task status endpoint
 */
@Service
@Slf4j
public class BackfillTaskService {

    private static final String CORRELATION_ID = "correlationId";

    private final BackfillOrchestrator backfillOrchestrator;
    private final ChunkedBackfillRunner chunkedBackfillRunner;
    private final IngestionMetrics ingestionMetrics;
    private final int maxRetainedTasks;
    private final Clock clock;

    private final Map<String, BackfillTask> tasks = new ConcurrentHashMap<>();

    @Autowired
    public BackfillTaskService(BackfillOrchestrator backfillOrchestrator,
                               ChunkedBackfillRunner chunkedBackfillRunner,
                               IngestionMetrics ingestionMetrics,
                               @Value("${ingestion.tasks.max-retained:1000}") int maxRetainedTasks) {
        this(backfillOrchestrator, chunkedBackfillRunner, ingestionMetrics, maxRetainedTasks, Clock.systemUTC());
    }

    BackfillTaskService(BackfillOrchestrator backfillOrchestrator,
                        ChunkedBackfillRunner chunkedBackfillRunner,
                        IngestionMetrics ingestionMetrics,
                        int maxRetainedTasks,
                        Clock clock) {
        this.backfillOrchestrator = backfillOrchestrator;
        this.chunkedBackfillRunner = chunkedBackfillRunner;
        this.ingestionMetrics = ingestionMetrics;
        this.maxRetainedTasks = maxRetainedTasks;
        this.clock = clock;
    }

    public TaskSubmissionResponse submitBackfill(String sourceKey, BackfillRequestDto dto) {
        Source source = parseSource(sourceKey);
        BackfillRequest request = toRequest(source, dto);
        return submit(source, request.getBatchId(), () -> backfillOrchestrator.runAsync(request));
    }

    public TaskSubmissionResponse submitChunked(String sourceKey, int monthsBack) {
        Source source = parseSource(sourceKey);
        if (monthsBack < 1) {
            throw new BadRequestException("INVALID_RANGE", "months_back must be >= 1", "months_back");
        }
        LocalDate endDate = LocalDate.now(clock.withZone(ZoneOffset.UTC));
        LocalDate startDate = endDate.minusMonths(monthsBack);
        String batchId = source.key() + "-chunked-" + startDate + "_to_" + endDate;
        return submit(source, batchId, () -> chunkedBackfillRunner.runAsync(source, startDate, endDate));
    }

    public TaskStatusResponse getTask(String taskId) {
        BackfillTask task = tasks.get(taskId);
        if (task == null) {
            throw ResourceNotFoundException.taskNotFound(taskId);
        }
        return task.toResponse();
    }

    /**
     * Validate the body and turn it into a batch: exactly one of days_back or
     * from_date/to_date, dates in order and not after today (UTC), days_back >= 1.
     */
    BackfillRequest toRequest(Source source, BackfillRequestDto dto) {
        if (dto == null) {
            throw BadRequestException.invalidRange("Request body is required");
        }
        boolean hasDays = dto.getDaysBack() != null;
        boolean hasFrom = dto.getFromDate() != null;
        boolean hasTo = dto.getToDate() != null;

        if (hasDays && (hasFrom || hasTo)) {
            throw BadRequestException.invalidRange("Give either days_back or from_date/to_date, not both");
        }
        if (!hasDays && !(hasFrom && hasTo)) {
            throw BadRequestException.invalidRange("Give days_back, or both from_date and to_date");
        }

        LocalDate today = LocalDate.now(clock.withZone(ZoneOffset.UTC));
        LocalDate startDate;
        LocalDate endDate;
        if (hasDays) {
            if (dto.getDaysBack() < 1) {
                throw new BadRequestException("INVALID_RANGE", "days_back must be >= 1", "days_back");
            }
            endDate = today;
            startDate = endDate.minusDays(dto.getDaysBack());
        } else {
            startDate = dto.getFromDate();
            endDate = dto.getToDate();
            if (startDate.isAfter(today)) {
                throw new BadRequestException("INVALID_RANGE", "from_date must not be in the future", "from_date");
            }
            if (endDate.isAfter(today)) {
                throw new BadRequestException("INVALID_RANGE", "to_date must not be in the future", "to_date");
            }
            if (startDate.isAfter(endDate)) {
                throw new BadRequestException("INVALID_RANGE", "from_date must not be after to_date", "from_date");
            }
        }

        String batchId = dto.getBatchId() != null && !dto.getBatchId().isBlank()
                ? dto.getBatchId().trim()
                : BackfillRequest.defaultBatchId(source, startDate, endDate);
        return BackfillRequest.forDays(source, batchId, startDate, endDate);
    }

    private TaskSubmissionResponse submit(Source source, String batchId,
                                          Supplier<CompletableFuture<?>> submission) {
        String taskId = UUID.randomUUID().toString();
        String correlationId = "BACKFILL-" + taskId.substring(0, 8);
        BackfillTask task = new BackfillTask(taskId, source.key(), batchId);

        evictFinishedTasks();
        tasks.put(taskId, task);

        MDC.put(CORRELATION_ID, correlationId);
        try {
            submission.get().whenComplete((result, error) -> {
                if (error != null) {
                    Throwable cause = error instanceof CompletionException && error.getCause() != null
                            ? error.getCause() : error;
                    task.fail(cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName());
                } else {
                    task.complete(result);
                }
            });
            log.info("Submitted task id={} source={} batchId={}", taskId, source.key(), batchId);
        } catch (RejectedExecutionException e) {
            // Catches both RejectedExecutionException and its subclass TaskRejectedException
            tasks.remove(taskId);
            ingestionMetrics.recordTaskRejection();
            log.error("❌ Backfill queue full, task rejected: source={}, batchId={}, type={}",
                    source.key(), batchId, e.getClass().getSimpleName());
            throw ServiceUnavailableException.queueFull();
        } finally {
            MDC.remove(CORRELATION_ID);
        }

        return TaskSubmissionResponse.builder()
                .taskId(taskId)
                .status(BackfillTask.TaskStatus.RUNNING.name())
                .source(source.key())
                .batchId(batchId)
                .build();
    }

    private void evictFinishedTasks() {
        if (tasks.size() < maxRetainedTasks) {
            return;
        }
        tasks.values().stream()
                .filter(BackfillTask::isFinished)
                .sorted(Comparator.comparing(BackfillTask::getSubmittedAt))
                .limit(Math.max(1, tasks.size() - maxRetainedTasks + 1))
                .map(BackfillTask::getTaskId)
                .collect(Collectors.toList())
                .forEach(tasks::remove);
    }

    private static Source parseSource(String sourceKey) {
        return Source.fromKey(sourceKey).orElseThrow(() -> BadRequestException.unknownSource(sourceKey));
    }
}
