package com.example.ingestionservice.scheduler;

import com.example.ingestionservice.client.external.ExternalApiException;
import com.example.ingestionservice.dto.BackfillResult;
import com.example.ingestionservice.record.Source;
import com.example.ingestionservice.service.IncrementalSyncService;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Scheduler for incremental syncs.
 * 
 * CRITICAL DESIGN:
 * - @SchedulerLock ensures only ONE instance executes (multi-replica safe)
 * - Scheduler delegates to service layer (NO business logic here)
 * - Sources synced one after another; one failing source does not stop the others
 * - Can be disabled via ingestion.scheduler.enabled=false
 */
@Component
@Slf4j
@ConditionalOnProperty(name = "ingestion.scheduler.enabled", havingValue = "true", matchIfMissing = true)
public class IngestionScheduler {

    private final IncrementalSyncService incrementalSyncService;
    private final List<Source> sources;

    public IngestionScheduler(IncrementalSyncService incrementalSyncService,
                              @Value("${ingestion.scheduler.sources:jira,tempo,fireflies,notion,slack}") String sources) {
        this.incrementalSyncService = incrementalSyncService;
        this.sources = new ArrayList<>();
        for (String key : sources.split(",")) {
            if (key.isBlank()) {
                continue;
            }
            Source.fromKey(key).ifPresentOrElse(this.sources::add,
                    () -> log.warn("⚠️ Ignoring unknown source '{}' in ingestion.scheduler.sources", key.trim()));
        }
    }

    /**
     * Default: every hour. Lock: max 55 minutes.
     */
    @Scheduled(cron = "${ingestion.scheduler.sync-cron:0 0 * * * *}")
    @SchedulerLock(
            name = "incrementalVectorSync",
            lockAtMostFor = "55m",
            lockAtLeastFor = "1m"
    )
    public void syncAll() {
        String correlationId = "SCHEDULER-" + UUID.randomUUID().toString().substring(0, 8);
        MDC.put("correlationId", correlationId);

        try {
            log.info("=== Starting scheduled incremental sync: correlationId={}, sources={} ===",
                    correlationId, sources);
            int failed = 0;
            for (Source source : sources) {
                try {
                    BackfillResult result = incrementalSyncService.sync(source);
                    log.info("Incremental sync source={} ingested={} skipped={}",
                            source.key(), result.getIngestedItems(), result.getSkippedItems());
                } catch (ExternalApiException.SourceNotConfiguredException e) {
                    log.warn("⚠️ Skipping incremental sync of {}: {}", source.key(), e.getMessage());
                } catch (Exception e) {
                    failed++;
                    log.error("Error in incremental sync of {}: {}", source.key(), e.getMessage(), e);
                }
            }
            log.info("=== Completed scheduled incremental sync: correlationId={}, failedSources={} ===",
                    correlationId, failed);
        } finally {
            MDC.remove("correlationId");
        }
    }
}
