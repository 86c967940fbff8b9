package com.example.ingestionservice.dto;

import com.example.ingestionservice.dedup.DedupStats;
import com.example.ingestionservice.resolver.ResolverCacheStats;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Result of one backfill or incremental sync batch.
 * Used for the task status endpoint, metrics and logging.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class BackfillResult {

    private String source;
    private String batchId;
    private String status;
    private boolean alreadyCompleted;
    private LocalDate startDate;
    private LocalDate endDate;

    private int totalItems;
    private int processedItems;
    private int ingestedItems;
    private int skippedItems;
    private int filteredItems;
    private int resumedFrom;

    private int fastPath;
    private int slowPath;
    private int direct;

    private DedupStats dedupStats;
    private int embeddingFailures;
    private int failedBatches;
    private long lookupFailures;
    private Map<String, ResolverCacheStats> cacheStats;

    @Builder.Default
    private List<String> errors = new ArrayList<>();

    private long durationMs;
    private String correlationId;
}
