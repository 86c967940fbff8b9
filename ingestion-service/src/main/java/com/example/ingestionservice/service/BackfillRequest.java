package com.example.ingestionservice.service;

import com.example.ingestionservice.record.Source;
import com.example.ingestionservice.source.FetchWindow;
import lombok.Builder;
import lombok.Getter;

import java.time.LocalDate;

/**
 * One batch to run: a source, a window and the batch id its checkpoint is keyed by.
 * 
 * incremental = true for scheduler syncs: the batch id is generated per run and a
 * successful run moves the source's last_sync forward.
 */
@Getter
@Builder
public class BackfillRequest {

    private final Source source;
    private final String batchId;
    private final FetchWindow window;
    private final boolean incremental;

    public LocalDate getStartDate() {
        return window.fromDate();
    }

    public LocalDate getEndDate() {
        return window.toDate();
    }

    public static BackfillRequest forDays(Source source, String batchId, LocalDate startDate, LocalDate endDate) {
        return BackfillRequest.builder()
                .source(source)
                .batchId(batchId)
                .window(FetchWindow.ofDays(startDate, endDate))
                .build();
    }

    /**
     * Default batch id of a date-range backfill, stable for the same range so
     * re-submitting it resumes instead of starting over.
     */
    public static String defaultBatchId(Source source, LocalDate startDate, LocalDate endDate) {
        return source.key() + "-" + startDate + "_to_" + endDate;
    }
}
